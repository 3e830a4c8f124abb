package com.example.cortex.service.ratelimit;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.domain.RateLimitStatus;
import java.time.Instant;

/**
 * Shared storage for rate limit buckets. Implementations must make the check and the increment
 * of one bucket atomic across all engine instances.
 */
public interface RateLimitBucketStore {

    /**
     * Counts one request against {@code bucketId}, opening a new window when none is open.
     * A request that would exceed the ceiling is rejected and leaves the bucket unchanged.
     */
    RateLimitStatus incrementOrReset(String bucketId, CortexProperties.Policy policy, Instant now);

    RateLimitStatus peek(String bucketId, CortexProperties.Policy policy, Instant now);

    /**
     * Removes buckets whose window started before {@code cutoff}.
     *
     * @return number of removed buckets
     */
    int purgeOlderThan(Instant cutoff);
}
