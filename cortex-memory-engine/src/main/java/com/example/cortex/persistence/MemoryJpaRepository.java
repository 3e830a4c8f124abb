package com.example.cortex.persistence;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemoryJpaRepository extends JpaRepository<MemoryEntity, String> {

    List<MemoryEntity> findByMemorySpaceIdOrderByCreatedAtDesc(String memorySpaceId, Pageable pageable);

    @Modifying
    @Query("update MemoryEntity m set m.accessCount = m.accessCount + 1, m.lastAccessedAt = :accessedAt "
            + "where m.id in :ids")
    int incrementAccessCount(@Param("ids") Collection<String> ids, @Param("accessedAt") Instant accessedAt);
}
