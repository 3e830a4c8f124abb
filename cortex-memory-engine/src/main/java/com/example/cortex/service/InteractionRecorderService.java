package com.example.cortex.service;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.domain.ConversationMessage;
import com.example.cortex.domain.MessageRole;
import com.example.cortex.domain.OperationClass;
import com.example.cortex.domain.PropertyInteractionType;
import com.example.cortex.dto.ImportanceResponse;
import com.example.cortex.dto.RememberResult;
import com.example.cortex.event.MemoryEventPublisher;
import com.example.cortex.event.MemoryEventType;
import com.example.cortex.persistence.ConversationEntity;
import com.example.cortex.persistence.ConversationJpaRepository;
import com.example.cortex.persistence.JsonColumnMapper;
import com.example.cortex.persistence.MemoryEntity;
import com.example.cortex.persistence.MemoryJpaRepository;
import com.example.cortex.persistence.PropertyInteractionEntity;
import com.example.cortex.persistence.PropertyInteractionJpaRepository;
import com.example.cortex.service.exception.MemoryNotFoundException;
import com.example.cortex.service.ratelimit.RateLimitIdentityResolver;
import com.example.cortex.service.ratelimit.RateLimiterService;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Records agent exchanges. Each exchange is stored as a two-message conversation together with a
 * searchable memory, plus a property interaction entry when a listing was discussed.
 */
@Slf4j
@Service
public class InteractionRecorderService {

    static final String VOICE_SEARCH_TAG = "voice-search";
    static final String PROPERTY_TAG = "property";
    static final String GENERAL_TAG = "general";

    private final ConversationJpaRepository conversationRepository;
    private final MemoryJpaRepository memoryRepository;
    private final PropertyInteractionJpaRepository interactionRepository;
    private final MemorySpaceService memorySpaceService;
    private final RateLimiterService rateLimiter;
    private final RateLimitIdentityResolver identityResolver;
    private final MemoryEventPublisher eventPublisher;
    private final JsonColumnMapper jsonMapper;
    private final CortexProperties cortexProperties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public InteractionRecorderService(
            ConversationJpaRepository conversationRepository,
            MemoryJpaRepository memoryRepository,
            PropertyInteractionJpaRepository interactionRepository,
            MemorySpaceService memorySpaceService,
            RateLimiterService rateLimiter,
            RateLimitIdentityResolver identityResolver,
            MemoryEventPublisher eventPublisher,
            JsonColumnMapper jsonMapper,
            CortexProperties cortexProperties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.conversationRepository = conversationRepository;
        this.memoryRepository = memoryRepository;
        this.interactionRepository = interactionRepository;
        this.memorySpaceService = memorySpaceService;
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
        this.eventPublisher = eventPublisher;
        this.jsonMapper = jsonMapper;
        this.cortexProperties = cortexProperties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Stores one user/agent exchange.
     *
     * @param propertyId listing discussed in the exchange, if any
     * @param propertyContext snapshot of the listing; an interaction entry is written whenever
     *                        {@code propertyId} is set and this is non-null, even if it is empty
     * @param sessionToken token identifying an anonymous session for rate limiting
     * @throws com.example.cortex.service.exception.RateLimitExceededException before anything is written
     * @throws com.example.cortex.service.exception.UserNotFoundException for unknown users
     */
    public RememberResult remember(String userId, String userQuery, String agentResponse, String propertyId,
                                   Map<String, Object> propertyContext, String sessionToken) {
        if (!StringUtils.hasText(userQuery) || !StringUtils.hasText(agentResponse)) {
            throw new IllegalArgumentException("Both the user query and the agent response are required");
        }
        FieldLimits.requireMaxLength(propertyId, FieldLimits.PROPERTY_ID, "Property id");
        rateLimiter.assertAdmitted(identityResolver.resolve(userId, sessionToken), OperationClass.MEMORY_OPERATIONS);

        String memorySpaceId = memorySpaceService.ensureSpace(userId);
        Instant now = Instant.now(clock);
        Map<String, Object> context = propertyContext == null ? null : new HashMap<>(propertyContext);
        boolean trackInteraction = StringUtils.hasText(propertyId) && context != null;

        RecordedExchange exchange = transactionTemplate.execute(tx -> {
            ConversationEntity conversation = saveConversation(
                    memorySpaceId, userId, userQuery, agentResponse, context, now);
            MemoryEntity memory = saveMemory(memorySpaceId, userId, conversation, userQuery, agentResponse,
                    propertyId, now);
            String interactionId = trackInteraction
                    ? saveInteraction(memorySpaceId, userId, conversation.getId(), propertyId, context, userQuery, now)
                    : null;
            return new RecordedExchange(conversation.getId(), memory.getId(), interactionId);
        });

        log.debug("Recorded conversation {} with memory {} in space {}",
                exchange.conversationId(), exchange.memoryId(), memorySpaceId);
        eventPublisher.publish(MemoryEventType.MEMORY_STORED, memorySpaceId, userId, exchange.memoryId(), now,
                Map.of("conversationId", exchange.conversationId()));
        if (exchange.interactionId() != null) {
            eventPublisher.publish(MemoryEventType.PROPERTY_INTERACTION_RECORDED, memorySpaceId, userId,
                    exchange.interactionId(), now, Map.of("propertyId", propertyId));
        }
        return new RememberResult(exchange.conversationId(), exchange.memoryId(), memorySpaceId);
    }

    /**
     * Replaces the importance of a memory in the user's space and bumps its revision.
     */
    public ImportanceResponse reviseImportance(String userId, String memoryId, int importance, String sessionToken) {
        rateLimiter.assertAdmitted(identityResolver.resolve(userId, sessionToken), OperationClass.MEMORY_OPERATIONS);
        String memorySpaceId = memorySpaceService.requireSpace(userId);
        int clamped = Math.max(0, Math.min(100, importance));
        Instant now = Instant.now(clock);

        Integer revision = transactionTemplate.execute(tx -> {
            MemoryEntity memory = memoryRepository.findById(memoryId)
                    .filter(candidate -> memorySpaceId.equals(candidate.getMemorySpaceId()))
                    .orElseThrow(() -> new MemoryNotFoundException(memoryId));
            memory.setImportance(clamped);
            memory.setRevision(memory.getRevision() + 1);
            memory.setUpdatedAt(now);
            return memory.getRevision();
        });

        eventPublisher.publish(MemoryEventType.MEMORY_IMPORTANCE_REVISED, memorySpaceId, userId, memoryId, now,
                Map.of("importance", clamped));
        return ImportanceResponse.builder()
                .memoryId(memoryId)
                .importance(clamped)
                .revision(revision)
                .build();
    }

    private ConversationEntity saveConversation(String memorySpaceId, String userId, String userQuery,
                                                String agentResponse, Map<String, Object> context, Instant now) {
        String conversationId = "conv-" + UUID.randomUUID();
        List<ConversationMessage> messages = List.of(
                ConversationMessage.builder()
                        .id(conversationId + "-msg-1")
                        .role(MessageRole.USER)
                        .content(userQuery)
                        .timestamp(now)
                        .build(),
                ConversationMessage.builder()
                        .id(conversationId + "-msg-2")
                        .role(MessageRole.AGENT)
                        .content(agentResponse)
                        .timestamp(now.plusMillis(1))
                        .build());

        ConversationEntity conversation = new ConversationEntity();
        conversation.setId(conversationId);
        conversation.setMemorySpaceId(memorySpaceId);
        conversation.setConversationType("user-agent");
        conversation.setUserId(userId);
        conversation.setAgentId(cortexProperties.getAgentId());
        conversation.setMessages(jsonMapper.writeJson(messages));
        conversation.setMessageCount(messages.size());
        conversation.setMetadata(jsonMapper.writeJson(context));
        conversation.setCreatedAt(now);
        conversation.setUpdatedAt(now);
        return conversationRepository.save(conversation);
    }

    private MemoryEntity saveMemory(String memorySpaceId, String userId, ConversationEntity conversation,
                                    String userQuery, String agentResponse, String propertyId, Instant now) {
        List<String> tags = new ArrayList<>();
        tags.add(VOICE_SEARCH_TAG);
        tags.add(StringUtils.hasText(propertyId) ? PROPERTY_TAG : GENERAL_TAG);

        MemoryEntity memory = new MemoryEntity();
        memory.setId("mem-" + UUID.randomUUID());
        memory.setMemorySpaceId(memorySpaceId);
        memory.setContent("User: %s\nAgent: %s".formatted(userQuery, agentResponse));
        memory.setContentType("raw");
        memory.setSourceType("conversation");
        memory.setUserId(userId);
        memory.setAgentId(cortexProperties.getAgentId());
        memory.setConversationId(conversation.getId());
        memory.setMessageIds(jsonMapper.writeJson(List.of(conversation.getId() + "-msg-1")));
        memory.setImportance(cortexProperties.getMemory().getDefaultImportance());
        memory.setTags(jsonMapper.writeJson(tags));
        memory.setRevision(1);
        memory.setAccessCount(0);
        memory.setCreatedAt(now);
        memory.setUpdatedAt(now);
        return memoryRepository.save(memory);
    }

    private String saveInteraction(String memorySpaceId, String userId, String conversationId, String propertyId,
                                   Map<String, Object> context, String userQuery, Instant now) {
        PropertyInteractionEntity interaction = new PropertyInteractionEntity();
        interaction.setId("prop-int-" + UUID.randomUUID());
        interaction.setUserId(userId);
        interaction.setMemorySpaceId(memorySpaceId);
        interaction.setConversationId(conversationId);
        interaction.setPropertyId(propertyId);
        interaction.setInteractionType(PropertyInteractionType.VOICE_QUERY.wireName());
        interaction.setPropertyContext(jsonMapper.writeJson(context));
        interaction.setQueryText(userQuery);
        interaction.setOccurredAt(now);
        interaction.setRevision(1);
        return interactionRepository.save(interaction).getId();
    }

    private record RecordedExchange(String conversationId, String memoryId, String interactionId) {
    }
}
