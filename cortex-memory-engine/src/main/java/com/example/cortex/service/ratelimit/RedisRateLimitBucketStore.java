package com.example.cortex.service.ratelimit;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.domain.RateLimitStatus;
import com.example.cortex.service.DistributedLockService;
import com.example.cortex.service.RedisKeyFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Keeps each bucket in a Redis hash that expires with its window. Updates happen under a
 * Redisson lock for the bucket.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "cortex.rate-limit", name = "store", havingValue = "redis")
public class RedisRateLimitBucketStore implements RateLimitBucketStore {

    private static final String WINDOW_START = "windowStart";
    private static final String COUNT = "count";

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final DistributedLockService lockService;

    @Override
    public RateLimitStatus incrementOrReset(String bucketId, CortexProperties.Policy policy, Instant now) {
        return lockService.withLock(keyFactory.rateLimitLockKey(bucketId), () -> {
            Duration window = policy.getWindow();
            int maxRequests = policy.getMaxRequests();
            RMap<String, String> bucket = bucket(bucketId);
            Map<String, String> state = bucket.readAllMap();
            Instant windowStart = windowStart(state);

            if (FixedWindowCounter.isElapsed(windowStart, window, now)) {
                bucket.putAll(Map.of(
                        WINDOW_START, String.valueOf(now.toEpochMilli()),
                        COUNT, "1"));
                bucket.expire(window);
                return FixedWindowCounter.status(true, 1, maxRequests, now, window, now);
            }

            int count = count(state);
            if (FixedWindowCounter.isFull(count, maxRequests)) {
                return FixedWindowCounter.status(false, count, maxRequests, windowStart, window, now);
            }

            int updated = count + 1;
            bucket.fastPut(COUNT, String.valueOf(updated));
            return FixedWindowCounter.status(true, updated, maxRequests, windowStart, window, now);
        });
    }

    @Override
    public RateLimitStatus peek(String bucketId, CortexProperties.Policy policy, Instant now) {
        Map<String, String> state = bucket(bucketId).readAllMap();
        Instant windowStart = windowStart(state);
        if (FixedWindowCounter.isElapsed(windowStart, policy.getWindow(), now)) {
            return FixedWindowCounter.empty(policy.getMaxRequests(), policy.getWindow(), now);
        }
        int count = count(state);
        return FixedWindowCounter.status(
                !FixedWindowCounter.isFull(count, policy.getMaxRequests()),
                count,
                policy.getMaxRequests(),
                windowStart,
                policy.getWindow(),
                now);
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        // buckets expire together with their window
        return 0;
    }

    private RMap<String, String> bucket(String bucketId) {
        return redissonClient.getMap(keyFactory.rateLimitBucketKey(bucketId), StringCodec.INSTANCE);
    }

    private Instant windowStart(Map<String, String> state) {
        String value = state.get(WINDOW_START);
        return value == null ? null : Instant.ofEpochMilli(Long.parseLong(value));
    }

    private int count(Map<String, String> state) {
        String value = state.get(COUNT);
        return value == null ? 0 : Integer.parseInt(value);
    }
}
