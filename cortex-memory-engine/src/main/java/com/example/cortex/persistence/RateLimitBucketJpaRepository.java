package com.example.cortex.persistence;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RateLimitBucketJpaRepository extends JpaRepository<RateLimitBucketEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from RateLimitBucketEntity b where b.id = :id")
    Optional<RateLimitBucketEntity> findForUpdate(@Param("id") String id);

    @Modifying
    @Query("delete from RateLimitBucketEntity b where b.windowStart < :cutoff")
    int deleteByWindowStartBefore(@Param("cutoff") Instant cutoff);
}
