package com.example.cortex.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FactJpaRepository extends JpaRepository<FactEntity, String> {

    List<FactEntity> findByMemorySpaceIdOrderByCreatedAtDesc(String memorySpaceId, Pageable pageable);

    List<FactEntity> findByMemorySpaceIdAndFactTypeOrderByCreatedAtAsc(String memorySpaceId, String factType);
}
