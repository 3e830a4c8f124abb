package com.example.cortex.service;

import com.example.cortex.domain.OperationClass;
import com.example.cortex.domain.PreferenceMetadata;
import com.example.cortex.domain.SuburbPreferenceMetadata;
import com.example.cortex.dto.FactRecall;
import com.example.cortex.dto.PreferencesResult;
import com.example.cortex.dto.SuburbPreferenceRecall;
import com.example.cortex.event.MemoryEventPublisher;
import com.example.cortex.event.MemoryEventType;
import com.example.cortex.persistence.FactEntity;
import com.example.cortex.persistence.FactJpaRepository;
import com.example.cortex.persistence.JsonColumnMapper;
import com.example.cortex.persistence.SuburbPreferenceEntity;
import com.example.cortex.persistence.SuburbPreferenceJpaRepository;
import com.example.cortex.service.ratelimit.RateLimitIdentityResolver;
import com.example.cortex.service.ratelimit.RateLimiterService;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Stores stated preferences as facts and keeps the per-suburb preference scores current.
 */
@Slf4j
@Service
public class PreferenceService {

    static final String PREFERENCE_FACT_TYPE = "preference";
    static final String PREFERENCE_TAG = "preference";
    static final int POSITIVE_THRESHOLD = 50;

    private final FactJpaRepository factRepository;
    private final SuburbPreferenceJpaRepository suburbRepository;
    private final MemorySpaceService memorySpaceService;
    private final RateLimiterService rateLimiter;
    private final RateLimitIdentityResolver identityResolver;
    private final DistributedLockService lockService;
    private final RedisKeyFactory keyFactory;
    private final MemoryEventPublisher eventPublisher;
    private final RecallProjectionMapper projectionMapper;
    private final JsonColumnMapper jsonMapper;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public PreferenceService(
            FactJpaRepository factRepository,
            SuburbPreferenceJpaRepository suburbRepository,
            MemorySpaceService memorySpaceService,
            RateLimiterService rateLimiter,
            RateLimitIdentityResolver identityResolver,
            DistributedLockService lockService,
            RedisKeyFactory keyFactory,
            MemoryEventPublisher eventPublisher,
            RecallProjectionMapper projectionMapper,
            JsonColumnMapper jsonMapper,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.factRepository = factRepository;
        this.suburbRepository = suburbRepository;
        this.memorySpaceService = memorySpaceService;
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
        this.lockService = lockService;
        this.keyFactory = keyFactory;
        this.eventPublisher = eventPublisher;
        this.projectionMapper = projectionMapper;
        this.jsonMapper = jsonMapper;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Records a preference and returns the id of the stored fact. Suburb preferences also update
     * the user's running score for that suburb.
     *
     * @param confidence 0 to 100; anything above 50 is read as a liking, the rest as a dislike
     * @throws IllegalArgumentException when confidence is out of range or the value is blank
     * @throws com.example.cortex.service.exception.MemorySpaceNotFoundException when the user has
     *         no memory space yet
     */
    public String storePreference(String userId, String category, String preferenceValue, int confidence,
                                  Map<String, Object> metadata, String sessionToken) {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence must be between 0 and 100");
        }
        if (!StringUtils.hasText(category) || !StringUtils.hasText(preferenceValue)) {
            throw new IllegalArgumentException("Category and preference value are required");
        }
        FieldLimits.requireMaxLength(category, FieldLimits.CATEGORY, "Category");
        rateLimiter.assertAdmitted(identityResolver.resolve(userId, sessionToken), OperationClass.MEMORY_OPERATIONS);
        String memorySpaceId = memorySpaceService.requireSpace(userId);

        PreferenceMetadata preferenceMetadata = PreferenceMetadata.from(category, metadata);
        if (preferenceMetadata instanceof SuburbPreferenceMetadata suburb) {
            FieldLimits.requireMaxLength(suburb.suburbName(), FieldLimits.SUBURB_NAME, "Suburb name");
            FieldLimits.requireMaxLength(suburb.state(), FieldLimits.STATE, "State");
        }
        Instant now = Instant.now(clock);

        String factId;
        if (preferenceMetadata instanceof SuburbPreferenceMetadata suburb) {
            factId = lockService.withLock(
                    keyFactory.suburbPreferenceLockKey(userId, suburb.suburbName(), suburb.state()),
                    () -> transactionTemplate.execute(tx -> {
                        mergeSuburbPreference(userId, memorySpaceId, suburb, confidence, now);
                        return saveFact(userId, memorySpaceId, category, preferenceValue, confidence,
                                preferenceMetadata, now);
                    }));
        } else {
            factId = transactionTemplate.execute(tx -> saveFact(userId, memorySpaceId, category, preferenceValue,
                    confidence, preferenceMetadata, now));
        }

        log.debug("Stored {} preference {} for user {}", category, factId, userId);
        eventPublisher.publish(MemoryEventType.FACT_STORED, memorySpaceId, userId, factId, now,
                Map.of("category", category, "confidence", confidence));
        return factId;
    }

    /**
     * Returns the user's preference facts, optionally narrowed to one category, and all suburb
     * scores. Users without a space get empty lists.
     */
    public PreferencesResult getPreferences(String userId, String category) {
        Optional<String> memorySpaceId = memorySpaceService.findSpaceId(userId);
        if (memorySpaceId.isEmpty()) {
            return PreferencesResult.empty();
        }
        return transactionTemplate.execute(tx -> {
            List<FactRecall> facts = factRepository
                    .findByMemorySpaceIdAndFactTypeOrderByCreatedAtAsc(memorySpaceId.get(), PREFERENCE_FACT_TYPE)
                    .stream()
                    .filter(fact -> !StringUtils.hasText(category) || category.equals(fact.getCategory()))
                    .map(projectionMapper::toRecall)
                    .toList();
            List<SuburbPreferenceRecall> suburbs = suburbRepository.findByUserIdOrderByPreferenceScoreDesc(userId)
                    .stream()
                    .map(projectionMapper::toRecall)
                    .toList();
            return new PreferencesResult(facts, suburbs);
        });
    }

    private void mergeSuburbPreference(String userId, String memorySpaceId, SuburbPreferenceMetadata suburb,
                                       int confidence, Instant now) {
        SuburbPreferenceEntity preference = suburbRepository
                .findByUserIdAndSuburbNameAndState(userId, suburb.suburbName(), suburb.state())
                .orElse(null);
        if (preference == null) {
            preference = new SuburbPreferenceEntity();
            preference.setUserId(userId);
            preference.setMemorySpaceId(memorySpaceId);
            preference.setSuburbName(suburb.suburbName());
            preference.setState(suburb.state());
            preference.setInteractionCount(1);
            preference.setReasons(jsonMapper.writeJson(appendIfPresent(List.of(), suburb.reason())));
            preference.setMentionedInQueries(jsonMapper.writeJson(appendIfPresent(List.of(),
                    suburb.mentionedInQuery())));
            preference.setFirstMentionedAt(now);
        } else {
            preference.setInteractionCount(preference.getInteractionCount() + 1);
            preference.setReasons(jsonMapper.writeJson(
                    appendIfPresent(jsonMapper.readStrings(preference.getReasons()), suburb.reason())));
            preference.setMentionedInQueries(jsonMapper.writeJson(
                    appendIfPresent(jsonMapper.readStrings(preference.getMentionedInQueries()),
                            suburb.mentionedInQuery())));
        }
        // Latest mention wins.
        preference.setPreferenceScore(signedScore(confidence));
        preference.setLastMentionedAt(now);
        preference.setUpdatedAt(now);
        suburbRepository.save(preference);
    }

    private String saveFact(String userId, String memorySpaceId, String category, String preferenceValue,
                            int confidence, PreferenceMetadata metadata, Instant now) {
        String predicate = isPositive(confidence) ? "prefers" : "dislikes";

        FactEntity fact = new FactEntity();
        fact.setId("pref-" + UUID.randomUUID());
        fact.setMemorySpaceId(memorySpaceId);
        fact.setUserId(userId);
        fact.setFact("User %s %s".formatted(predicate, preferenceValue));
        fact.setFactType(PREFERENCE_FACT_TYPE);
        fact.setSubject(userId);
        fact.setPredicate(predicate);
        fact.setObjectValue(preferenceValue);
        fact.setConfidence(confidence);
        fact.setSourceType("conversation");
        fact.setCategory(category);
        fact.setMetadata(jsonMapper.writeJson(metadata.asMap()));
        fact.setTags(jsonMapper.writeJson(List.of(PREFERENCE_TAG, category)));
        fact.setRevision(1);
        fact.setCreatedAt(now);
        fact.setUpdatedAt(now);
        return factRepository.save(fact).getId();
    }

    static int signedScore(int confidence) {
        return isPositive(confidence) ? confidence : -confidence;
    }

    private static boolean isPositive(int confidence) {
        return confidence > POSITIVE_THRESHOLD;
    }

    private static List<String> appendIfPresent(List<String> values, String value) {
        if (!StringUtils.hasText(value)) {
            return values;
        }
        List<String> result = new ArrayList<>(values);
        result.add(value);
        return result;
    }
}
