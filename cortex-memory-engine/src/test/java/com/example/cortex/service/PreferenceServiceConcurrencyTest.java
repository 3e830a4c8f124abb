package com.example.cortex.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.willAnswer;

import com.example.cortex.persistence.FactJpaRepository;
import com.example.cortex.persistence.MemorySpaceJpaRepository;
import com.example.cortex.persistence.RateLimitBucketJpaRepository;
import com.example.cortex.persistence.SuburbPreferenceEntity;
import com.example.cortex.persistence.SuburbPreferenceJpaRepository;
import com.example.cortex.support.EngineJpaTestSupport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Concurrent mentions of one suburb, each committed on its own connection. The Redisson lock is
 * backed by an in-process mutex so the merge is serialized the way a shared lock would do it.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class PreferenceServiceConcurrencyTest extends EngineJpaTestSupport {

    private static final int THREADS = 6;
    private static final int MENTIONS_PER_THREAD = 3;

    @Autowired
    private PreferenceService preferenceService;

    @Autowired
    private MemorySpaceService memorySpaceService;

    @Autowired
    private FactJpaRepository factRepository;

    @Autowired
    private SuburbPreferenceJpaRepository suburbRepository;

    @Autowired
    private MemorySpaceJpaRepository spaceRepository;

    @Autowired
    private RateLimitBucketJpaRepository bucketRepository;

    private final ReentrantLock mutex = new ReentrantLock();

    @BeforeEach
    void backTheLockWithAMutex() {
        willAnswer(invocation -> {
            mutex.lock();
            return null;
        }).given(lock).lock();
        willAnswer(invocation -> {
            mutex.unlock();
            return null;
        }).given(lock).unlock();
    }

    @AfterEach
    void removeRows() {
        factRepository.deleteAll();
        suburbRepository.deleteAll();
        bucketRepository.deleteAll();
        userRepository.deleteAll();
        spaceRepository.deleteAll();
    }

    @Test
    void concurrentMentionsMergeIntoOneRowWithoutLostUpdates() throws Exception {
        registerUser("u1");
        memorySpaceService.ensureSpace("u1", null);

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> results = new ArrayList<>();
        try {
            for (int t = 0; t < THREADS; t++) {
                int thread = t;
                results.add(executor.submit(() -> {
                    start.await();
                    for (int mention = 0; mention < MENTIONS_PER_THREAD; mention++) {
                        preferenceService.storePreference("u1", "suburb", "Bondi", 80, Map.of(
                                "suburbName", "Bondi",
                                "state", "NSW",
                                "reason", "reason %d-%d".formatted(thread, mention)), null);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        int mentions = THREADS * MENTIONS_PER_THREAD;
        List<SuburbPreferenceEntity> rows = suburbRepository.findByUserIdOrderByPreferenceScoreDesc("u1");
        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getInteractionCount()).isEqualTo(mentions);
            assertThat(row.getPreferenceScore()).isEqualTo(80);
        });
        assertThat(factRepository.count()).isEqualTo(mentions);
    }
}
