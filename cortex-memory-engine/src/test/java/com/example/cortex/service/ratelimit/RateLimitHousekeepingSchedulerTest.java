package com.example.cortex.service.ratelimit;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.cortex.config.CortexProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class RateLimitHousekeepingSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-03-02T09:00:00Z");

    @Mock
    private RateLimitBucketStore bucketStore;

    private final CortexProperties cortexProperties = new CortexProperties();

    @Test
    void purgesBucketsOlderThanTheRetention() {
        given(bucketStore.purgeOlderThan(any())).willReturn(4);

        scheduler().purgeExpiredBuckets();

        verify(bucketStore).purgeOlderThan(NOW.minus(Duration.ofHours(24)));
    }

    @Test
    void zeroRetentionDisablesThePurge() {
        cortexProperties.getHousekeeping().setBucketRetention(Duration.ZERO);

        scheduler().purgeExpiredBuckets();

        verifyNoInteractions(bucketStore);
    }

    @Test
    void storageFailuresAreLoggedNotThrown() {
        given(bucketStore.purgeOlderThan(any())).willThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> scheduler().purgeExpiredBuckets()).doesNotThrowAnyException();
    }

    private RateLimitHousekeepingScheduler scheduler() {
        return new RateLimitHousekeepingScheduler(cortexProperties, bucketStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
