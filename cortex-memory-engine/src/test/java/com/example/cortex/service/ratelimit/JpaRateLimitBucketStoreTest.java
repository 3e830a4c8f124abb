package com.example.cortex.service.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.domain.RateLimitStatus;
import com.example.cortex.persistence.RateLimitBucketEntity;
import com.example.cortex.persistence.RateLimitBucketJpaRepository;
import com.example.cortex.support.EngineJpaTestSupport;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class JpaRateLimitBucketStoreTest extends EngineJpaTestSupport {

    private static final String BUCKET = "memory:ops:user:u1";
    private static final CortexProperties.Policy POLICY = new CortexProperties.Policy(60, Duration.ofMinutes(1));

    @Autowired
    private RateLimitBucketStore bucketStore;

    @Autowired
    private RateLimitBucketJpaRepository bucketRepository;

    @Test
    void rejectsTheRequestAfterTheCeilingAndKeepsTheCount() {
        Instant now = Instant.now(clock);
        for (int i = 1; i <= 60; i++) {
            RateLimitStatus status = bucketStore.incrementOrReset(BUCKET, POLICY, now);
            assertThat(status.allowed()).as("call %d", i).isTrue();
            assertThat(status.current()).isEqualTo(i);
        }

        RateLimitStatus rejected = bucketStore.incrementOrReset(BUCKET, POLICY, now.plusSeconds(15));

        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.current()).isEqualTo(60);
        assertThat(rejected.remaining()).isZero();
        assertThat(rejected.retryAfterSeconds()).isEqualTo(45);
        assertThat(rejected.resetTime()).isEqualTo(now.plus(Duration.ofMinutes(1)));
        assertThat(bucketRepository.findById(BUCKET))
                .get()
                .extracting(RateLimitBucketEntity::getRequestCount)
                .isEqualTo(60);
    }

    @Test
    void opensAFreshWindowOnceTheOldOneHasElapsed() {
        Instant start = Instant.now(clock);
        for (int i = 0; i < 60; i++) {
            bucketStore.incrementOrReset(BUCKET, POLICY, start);
        }

        RateLimitStatus atBoundary = bucketStore.incrementOrReset(BUCKET, POLICY, start.plus(Duration.ofMinutes(1)));

        assertThat(atBoundary.allowed()).isTrue();
        assertThat(atBoundary.current()).isEqualTo(1);
        assertThat(atBoundary.resetTime()).isEqualTo(start.plus(Duration.ofMinutes(2)));
    }

    @Test
    void peekDoesNotCountTheRequest() {
        Instant now = Instant.now(clock);
        bucketStore.incrementOrReset(BUCKET, POLICY, now);
        bucketStore.incrementOrReset(BUCKET, POLICY, now);

        RateLimitStatus status = bucketStore.peek(BUCKET, POLICY, now.plusSeconds(1));

        assertThat(status.current()).isEqualTo(2);
        assertThat(status.remaining()).isEqualTo(58);
        assertThat(bucketStore.peek(BUCKET, POLICY, now.plusSeconds(2)).current()).isEqualTo(2);
    }

    @Test
    void peekReportsAnUnknownBucketAsEmpty() {
        RateLimitStatus status = bucketStore.peek("memory:ops:user:nobody", POLICY, Instant.now(clock));

        assertThat(status.allowed()).isTrue();
        assertThat(status.current()).isZero();
        assertThat(status.remaining()).isEqualTo(60);
    }

    @Test
    void purgeRemovesOnlyBucketsOpenedBeforeTheCutoff() {
        Instant now = Instant.now(clock);
        bucketStore.incrementOrReset("memory:ops:user:old", POLICY, now.minus(Duration.ofHours(30)));
        bucketStore.incrementOrReset("memory:ops:user:recent", POLICY, now);

        int deleted = bucketStore.purgeOlderThan(now.minus(Duration.ofHours(24)));

        assertThat(deleted).isEqualTo(1);
        flushAndClear();
        assertThat(bucketRepository.findById("memory:ops:user:old")).isEmpty();
        assertThat(bucketRepository.findById("memory:ops:user:recent")).isPresent();
    }
}
