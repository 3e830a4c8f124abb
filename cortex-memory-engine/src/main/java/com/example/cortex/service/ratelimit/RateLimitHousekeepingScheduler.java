package com.example.cortex.service.ratelimit;

import com.example.cortex.config.CortexProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitHousekeepingScheduler {

    private final CortexProperties cortexProperties;
    private final RateLimitBucketStore bucketStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${cortex.housekeeping.interval:PT10M}').toMillis()}")
    public void purgeExpiredBuckets() {
        Duration retention = cortexProperties.getHousekeeping().getBucketRetention();
        if (retention == null || retention.isNegative() || retention.isZero()) {
            return;
        }
        Instant cutoff = Instant.now(clock).minus(retention);
        try {
            int deleted = bucketStore.purgeOlderThan(cutoff);
            if (deleted > 0) {
                log.debug("Purged {} rate limit buckets with windows opened before {}", deleted, cutoff);
            }
        } catch (Exception ex) {
            log.warn("Failed to purge rate limit buckets older than {}", cutoff, ex);
        }
    }
}
