package com.example.cortex.service;

import com.example.cortex.domain.MemorySpaceStatus;
import com.example.cortex.domain.OperationClass;
import com.example.cortex.domain.ParticipantType;
import com.example.cortex.domain.SpaceParticipant;
import com.example.cortex.event.MemoryEventPublisher;
import com.example.cortex.event.MemoryEventType;
import com.example.cortex.persistence.JsonColumnMapper;
import com.example.cortex.persistence.MemorySpaceEntity;
import com.example.cortex.persistence.MemorySpaceJpaRepository;
import com.example.cortex.persistence.UserAccountEntity;
import com.example.cortex.persistence.UserAccountJpaRepository;
import com.example.cortex.service.exception.MemorySpaceNotFoundException;
import com.example.cortex.service.exception.UserNotFoundException;
import com.example.cortex.service.ratelimit.RateLimitIdentityResolver;
import com.example.cortex.service.ratelimit.RateLimiterService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Registry of per-user memory spaces. Every user owns at most one space, created lazily by the
 * first recorded interaction.
 */
@Slf4j
@Service
public class MemorySpaceService {

    static final String PERSONAL_SPACE_TYPE = "personal";

    private final UserAccountJpaRepository userRepository;
    private final MemorySpaceJpaRepository spaceRepository;
    private final JsonColumnMapper jsonMapper;
    private final DistributedLockService lockService;
    private final RedisKeyFactory keyFactory;
    private final RateLimiterService rateLimiter;
    private final RateLimitIdentityResolver identityResolver;
    private final MemoryEventPublisher eventPublisher;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public MemorySpaceService(
            UserAccountJpaRepository userRepository,
            MemorySpaceJpaRepository spaceRepository,
            JsonColumnMapper jsonMapper,
            DistributedLockService lockService,
            RedisKeyFactory keyFactory,
            RateLimiterService rateLimiter,
            RateLimitIdentityResolver identityResolver,
            MemoryEventPublisher eventPublisher,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.userRepository = userRepository;
        this.spaceRepository = spaceRepository;
        this.jsonMapper = jsonMapper;
        this.lockService = lockService;
        this.keyFactory = keyFactory;
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Caller-facing variant of {@link #ensureSpace(String)} that is counted against the memory
     * operations ceiling first.
     */
    public String ensureSpace(String userId, String sessionToken) {
        rateLimiter.assertAdmitted(identityResolver.resolve(userId, sessionToken), OperationClass.MEMORY_OPERATIONS);
        return ensureSpace(userId);
    }

    /**
     * Returns the user's space id, creating the space on first use. Repeated and concurrent calls
     * for the same user resolve to the same id.
     *
     * @throws UserNotFoundException when {@code userId} is not a known account
     */
    public String ensureSpace(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new UserNotFoundException(userId);
        }
        Optional<String> existing = findSpaceId(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        SpaceCreation creation = lockService.withLock(
                keyFactory.memorySpaceLockKey(userId),
                () -> transactionTemplate.execute(tx -> createIfAbsent(userId)));

        if (creation.created()) {
            log.debug("Created memory space {} for user {}", creation.spaceId(), userId);
            eventPublisher.publish(MemoryEventType.MEMORY_SPACE_CREATED, creation.spaceId(), userId,
                    creation.spaceId(), creation.createdAt(), Map.of("type", PERSONAL_SPACE_TYPE));
        }
        return creation.spaceId();
    }

    /**
     * Looks up the user's space without creating one.
     *
     * @throws UserNotFoundException when the user does not exist
     * @throws MemorySpaceNotFoundException when the user has no space yet
     */
    public String requireSpace(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new UserNotFoundException(userId);
        }
        UserAccountEntity user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        if (!StringUtils.hasText(user.getMemorySpaceId())) {
            throw new MemorySpaceNotFoundException(userId);
        }
        return user.getMemorySpaceId();
    }

    /**
     * Returns the user's space id if the user exists and already has one. Unknown users are
     * reported as having no space.
     */
    public Optional<String> findSpaceId(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return userRepository.findById(userId)
                .map(UserAccountEntity::getMemorySpaceId)
                .filter(StringUtils::hasText);
    }

    private SpaceCreation createIfAbsent(String userId) {
        UserAccountEntity user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        if (StringUtils.hasText(user.getMemorySpaceId())) {
            return new SpaceCreation(user.getMemorySpaceId(), false, null);
        }

        Instant now = Instant.now(clock);
        String spaceId = personalSpaceId(userId);
        MemorySpaceEntity space = spaceRepository.findById(spaceId).orElseGet(() -> {
            MemorySpaceEntity created = new MemorySpaceEntity();
            created.setId(spaceId);
            created.setName(userId + "-" + PERSONAL_SPACE_TYPE);
            created.setSpaceType(PERSONAL_SPACE_TYPE);
            created.setOwnerUserId(userId);
            created.setParticipants(jsonMapper.writeJson(List.of(SpaceParticipant.builder()
                    .id(userId)
                    .type(ParticipantType.HUMAN)
                    .joinedAt(now)
                    .build())));
            created.setStatus(MemorySpaceStatus.ACTIVE);
            created.setMetadata(jsonMapper.writeJson(Map.of("userId", userId)));
            created.setCreatedAt(now);
            created.setUpdatedAt(now);
            return spaceRepository.save(created);
        });

        user.setMemorySpaceId(space.getId());
        user.setUpdatedAt(now);
        userRepository.save(user);
        return new SpaceCreation(space.getId(), true, now);
    }

    static String personalSpaceId(String userId) {
        return "user-" + userId + "-" + PERSONAL_SPACE_TYPE;
    }

    private record SpaceCreation(String spaceId, boolean created, Instant createdAt) {
    }
}
