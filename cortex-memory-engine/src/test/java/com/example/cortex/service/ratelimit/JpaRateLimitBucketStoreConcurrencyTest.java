package com.example.cortex.service.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.domain.RateLimitStatus;
import com.example.cortex.persistence.RateLimitBucketJpaRepository;
import com.example.cortex.support.EngineJpaTestSupport;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs without the test-managed transaction so every admission commits on its own connection,
 * the way concurrent engine instances hit the store.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaRateLimitBucketStoreConcurrencyTest extends EngineJpaTestSupport {

    private static final String BUCKET = "memory:ops:user:racer";
    private static final int MAX_REQUESTS = 20;
    private static final int THREADS = 8;
    private static final int CALLS_PER_THREAD = 5;
    private static final CortexProperties.Policy POLICY =
            new CortexProperties.Policy(MAX_REQUESTS, Duration.ofMinutes(1));

    @Autowired
    private RateLimitBucketStore bucketStore;

    @Autowired
    private RateLimitBucketJpaRepository bucketRepository;

    @AfterEach
    void removeBuckets() {
        bucketRepository.deleteAll();
    }

    @Test
    void concurrentCallersAreAdmittedExactlyUpToTheCeiling() throws Exception {
        Instant now = Instant.now(clock);
        assertThat(bucketStore.incrementOrReset(BUCKET, POLICY, now).allowed()).isTrue();

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int t = 0; t < THREADS; t++) {
                Callable<Integer> caller = () -> {
                    start.await();
                    int admitted = 0;
                    for (int call = 0; call < CALLS_PER_THREAD; call++) {
                        RateLimitStatus status = bucketStore.incrementOrReset(BUCKET, POLICY, now);
                        if (status.allowed()) {
                            admitted++;
                        }
                    }
                    return admitted;
                };
                results.add(executor.submit(caller));
            }
            start.countDown();

            int admitted = 1;
            for (Future<Integer> result : results) {
                admitted += result.get(30, TimeUnit.SECONDS);
            }

            assertThat(admitted).isEqualTo(MAX_REQUESTS);
            assertThat(bucketRepository.findById(BUCKET).orElseThrow().getRequestCount()).isEqualTo(MAX_REQUESTS);
        } finally {
            executor.shutdownNow();
        }
    }
}
