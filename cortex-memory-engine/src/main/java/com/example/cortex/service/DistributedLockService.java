package com.example.cortex.service;

import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Serializes read-modify-write sequences on a single record across every engine instance.
 * The supplied work must open and commit its own transaction so the lock outlives the commit.
 */
@Component
@RequiredArgsConstructor
public class DistributedLockService {

    private final RedissonClient redissonClient;

    public <T> T withLock(String lockKey, Supplier<T> supplier) {
        if (!StringUtils.hasText(lockKey)) {
            throw new IllegalArgumentException("Lock key is required");
        }
        RLock lock = redissonClient.getLock(lockKey);
        lock.lock();
        try {
            return supplier.get();
        } finally {
            lock.unlock();
        }
    }
}
