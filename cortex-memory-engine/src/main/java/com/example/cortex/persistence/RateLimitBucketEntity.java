package com.example.cortex.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "cortex_rate_limit_buckets",
        indexes = @Index(name = "idx_rate_limit_buckets_window", columnList = "window_start"))
public class RateLimitBucketEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 255)
    private String id;

    @Column(name = "request_count", nullable = false)
    private int requestCount;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "window_ms", nullable = false)
    private long windowMs;

    @Column(name = "max_requests", nullable = false)
    private int maxRequests;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
