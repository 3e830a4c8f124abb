package com.example.cortex.service.ratelimit;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.domain.RateLimitStatus;
import com.example.cortex.persistence.RateLimitBucketEntity;
import com.example.cortex.persistence.RateLimitBucketJpaRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Keeps buckets in the relational store next to the rest of the memory data. Each admission
 * runs in one transaction that holds a row lock on the bucket.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "cortex.rate-limit", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaRateLimitBucketStore implements RateLimitBucketStore {

    private final RateLimitBucketJpaRepository bucketRepository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public JpaRateLimitBucketStore(
            RateLimitBucketJpaRepository bucketRepository, PlatformTransactionManager transactionManager) {
        this.bucketRepository = bucketRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    @Override
    public RateLimitStatus incrementOrReset(String bucketId, CortexProperties.Policy policy, Instant now) {
        try {
            return transactionTemplate.execute(tx -> countRequest(bucketId, policy, now));
        } catch (DataIntegrityViolationException ex) {
            // another instance inserted the bucket first; the row exists now and can be locked
            log.debug("Bucket {} was created concurrently, retrying with row lock", bucketId);
            return transactionTemplate.execute(tx -> countRequest(bucketId, policy, now));
        }
    }

    @Override
    public RateLimitStatus peek(String bucketId, CortexProperties.Policy policy, Instant now) {
        return readOnlyTemplate.execute(tx -> bucketRepository.findById(bucketId)
                .filter(bucket -> !FixedWindowCounter.isElapsed(bucket.getWindowStart(), policy.getWindow(), now))
                .map(bucket -> FixedWindowCounter.status(
                        !FixedWindowCounter.isFull(bucket.getRequestCount(), policy.getMaxRequests()),
                        bucket.getRequestCount(),
                        policy.getMaxRequests(),
                        bucket.getWindowStart(),
                        policy.getWindow(),
                        now))
                .orElseGet(() -> FixedWindowCounter.empty(policy.getMaxRequests(), policy.getWindow(), now)));
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        Integer deleted = transactionTemplate.execute(tx -> bucketRepository.deleteByWindowStartBefore(cutoff));
        return deleted != null ? deleted : 0;
    }

    private RateLimitStatus countRequest(String bucketId, CortexProperties.Policy policy, Instant now) {
        Duration window = policy.getWindow();
        int maxRequests = policy.getMaxRequests();
        Optional<RateLimitBucketEntity> existing = bucketRepository.findForUpdate(bucketId);

        if (existing.isEmpty()) {
            RateLimitBucketEntity bucket = new RateLimitBucketEntity();
            bucket.setId(bucketId);
            bucket.setCreatedAt(now);
            openWindow(bucket, policy, now);
            bucketRepository.saveAndFlush(bucket);
            return FixedWindowCounter.status(true, 1, maxRequests, now, window, now);
        }

        RateLimitBucketEntity bucket = existing.get();
        if (FixedWindowCounter.isElapsed(bucket.getWindowStart(), window, now)) {
            openWindow(bucket, policy, now);
            return FixedWindowCounter.status(true, 1, maxRequests, now, window, now);
        }

        if (FixedWindowCounter.isFull(bucket.getRequestCount(), maxRequests)) {
            return FixedWindowCounter.status(
                    false, bucket.getRequestCount(), maxRequests, bucket.getWindowStart(), window, now);
        }

        bucket.setRequestCount(bucket.getRequestCount() + 1);
        bucket.setUpdatedAt(now);
        return FixedWindowCounter.status(
                true, bucket.getRequestCount(), maxRequests, bucket.getWindowStart(), window, now);
    }

    private void openWindow(RateLimitBucketEntity bucket, CortexProperties.Policy policy, Instant now) {
        bucket.setRequestCount(1);
        bucket.setWindowStart(now);
        bucket.setWindowMs(policy.getWindow().toMillis());
        bucket.setMaxRequests(policy.getMaxRequests());
        bucket.setUpdatedAt(now);
    }
}
