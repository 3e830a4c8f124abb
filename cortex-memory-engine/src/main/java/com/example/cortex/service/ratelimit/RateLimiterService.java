package com.example.cortex.service.ratelimit;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.domain.OperationClass;
import com.example.cortex.domain.RateLimitStatus;
import com.example.cortex.service.exception.RateLimitExceededException;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Fixed-window admission gate in front of every memory write. Counting happens in the shared
 * {@link RateLimitBucketStore}, so all engine instances see the same buckets. A window boundary
 * can admit up to twice the ceiling in quick succession.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterService {

    private final RateLimitBucketStore bucketStore;
    private final CortexProperties cortexProperties;
    private final Clock clock;

    public RateLimitStatus admit(String identity, OperationClass operationClass) {
        String bucketId = bucketId(identity, operationClass);
        CortexProperties.Policy policy = cortexProperties.getRateLimit().policyFor(operationClass);
        RateLimitStatus status = bucketStore.incrementOrReset(bucketId, policy, Instant.now(clock));
        if (!status.allowed()) {
            log.debug("Rejected {} for {} ({} of {} used, retry in {}s)",
                    operationClass, identity, status.current(), status.limit(), status.retryAfterSeconds());
        }
        return status;
    }

    /**
     * Admits the request or throws, so callers can gate an operation before they touch storage.
     *
     * @throws RateLimitExceededException when the identity has used up its window
     */
    public RateLimitStatus assertAdmitted(String identity, OperationClass operationClass) {
        RateLimitStatus status = admit(identity, operationClass);
        if (!status.allowed()) {
            throw new RateLimitExceededException(operationClass, status);
        }
        return status;
    }

    public RateLimitStatus status(String identity, OperationClass operationClass) {
        CortexProperties.Policy policy = cortexProperties.getRateLimit().policyFor(operationClass);
        return bucketStore.peek(bucketId(identity, operationClass), policy, Instant.now(clock));
    }

    private String bucketId(String identity, OperationClass operationClass) {
        if (!StringUtils.hasText(identity)) {
            throw new IllegalArgumentException("Rate limit identity is required");
        }
        if (operationClass == null) {
            throw new IllegalArgumentException("Operation class is required");
        }
        return operationClass.bucketKey(identity);
    }
}
