package com.example.cortex.service;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.dto.FactRecall;
import com.example.cortex.dto.MemoryRecall;
import com.example.cortex.dto.PropertyInteractionRecall;
import com.example.cortex.dto.RecallResult;
import com.example.cortex.dto.SuburbPreferenceRecall;
import com.example.cortex.persistence.FactJpaRepository;
import com.example.cortex.persistence.MemoryEntity;
import com.example.cortex.persistence.MemoryJpaRepository;
import com.example.cortex.persistence.PropertyInteractionEntity;
import com.example.cortex.persistence.PropertyInteractionJpaRepository;
import com.example.cortex.persistence.SuburbPreferenceJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Assembles recall candidates for the agent. Results are ordered by recency; relevance ranking
 * against the query happens in the external indexer.
 */
@Slf4j
@Service
public class RecallService {

    private final MemoryJpaRepository memoryRepository;
    private final FactJpaRepository factRepository;
    private final PropertyInteractionJpaRepository interactionRepository;
    private final SuburbPreferenceJpaRepository suburbRepository;
    private final MemorySpaceService memorySpaceService;
    private final RecallProjectionMapper projectionMapper;
    private final CortexProperties cortexProperties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public RecallService(
            MemoryJpaRepository memoryRepository,
            FactJpaRepository factRepository,
            PropertyInteractionJpaRepository interactionRepository,
            SuburbPreferenceJpaRepository suburbRepository,
            MemorySpaceService memorySpaceService,
            RecallProjectionMapper projectionMapper,
            CortexProperties cortexProperties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.memoryRepository = memoryRepository;
        this.factRepository = factRepository;
        this.interactionRepository = interactionRepository;
        this.suburbRepository = suburbRepository;
        this.memorySpaceService = memorySpaceService;
        this.projectionMapper = projectionMapper;
        this.cortexProperties = cortexProperties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Returns the latest memories, facts and property interactions for the user together with the
     * suburbs the user clearly likes. Unknown users and users without a space get empty lists.
     *
     * @param query the agent's current query; accepted for the indexer's benefit, not used for ordering
     * @param limit per-category cap, {@code null} for the configured default
     */
    public RecallResult recall(String userId, String query, Integer limit) {
        Optional<String> memorySpaceId = memorySpaceService.findSpaceId(userId);
        if (memorySpaceId.isEmpty()) {
            return RecallResult.empty();
        }
        CortexProperties.Recall settings = cortexProperties.getRecall();
        int effectiveLimit = clampLimit(limit);
        PageRequest page = PageRequest.of(0, effectiveLimit);

        RecallResult result = transactionTemplate.execute(tx -> {
            List<MemoryEntity> memories = memoryRepository.findByMemorySpaceIdOrderByCreatedAtDesc(
                    memorySpaceId.get(), page);
            List<FactRecall> facts = factRepository.findByMemorySpaceIdOrderByCreatedAtDesc(memorySpaceId.get(), page)
                    .stream()
                    .map(projectionMapper::toRecall)
                    .toList();
            List<PropertyInteractionRecall> interactions = interactionRepository
                    .findByUserIdOrderByOccurredAtDesc(userId, page)
                    .stream()
                    .map(projectionMapper::toRecall)
                    .toList();
            List<SuburbPreferenceRecall> suburbs = suburbRepository
                    .findByUserIdAndPreferenceScoreGreaterThanOrderByPreferenceScoreDesc(
                            userId, settings.getSuburbMinimumScore(), PageRequest.of(0, settings.getSuburbLimit()))
                    .stream()
                    .map(projectionMapper::toRecall)
                    .toList();

            if (settings.isTrackAccess() && !memories.isEmpty()) {
                memoryRepository.incrementAccessCount(
                        memories.stream().map(MemoryEntity::getId).toList(), Instant.now(clock));
            }
            List<MemoryRecall> memoryRecalls = memories.stream().map(projectionMapper::toRecall).toList();
            return new RecallResult(memoryRecalls, facts, interactions, suburbs);
        });

        log.debug("Recalled {} memories, {} facts, {} interactions, {} suburbs for user {} (query length {})",
                result.memories().size(), result.facts().size(), result.propertyInteractions().size(),
                result.suburbPreferences().size(), userId, query == null ? 0 : query.length());
        return result;
    }

    /**
     * Lists the user's property interactions, newest first, optionally for one property only.
     */
    public List<PropertyInteractionRecall> getPropertyHistory(String userId, String propertyId) {
        if (memorySpaceService.findSpaceId(userId).isEmpty()) {
            return List.of();
        }
        return transactionTemplate.execute(tx -> {
            List<PropertyInteractionEntity> interactions = StringUtils.hasText(propertyId)
                    ? interactionRepository.findByUserIdAndPropertyIdOrderByOccurredAtDesc(userId, propertyId)
                    : interactionRepository.findByUserIdOrderByOccurredAtDesc(userId);
            return interactions.stream().map(projectionMapper::toRecall).toList();
        });
    }

    int clampLimit(Integer limit) {
        CortexProperties.Recall settings = cortexProperties.getRecall();
        int requested = limit == null ? settings.getDefaultLimit() : limit;
        return Math.max(1, Math.min(settings.getMaxLimit(), requested));
    }
}
