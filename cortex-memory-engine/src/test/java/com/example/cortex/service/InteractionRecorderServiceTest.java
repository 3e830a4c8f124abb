package com.example.cortex.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.cortex.domain.ConversationMessage;
import com.example.cortex.domain.MessageRole;
import com.example.cortex.dto.ImportanceResponse;
import com.example.cortex.dto.RememberResult;
import com.example.cortex.persistence.ConversationEntity;
import com.example.cortex.persistence.ConversationJpaRepository;
import com.example.cortex.persistence.JsonColumnMapper;
import com.example.cortex.persistence.MemoryEntity;
import com.example.cortex.persistence.MemoryJpaRepository;
import com.example.cortex.persistence.PropertyInteractionEntity;
import com.example.cortex.persistence.PropertyInteractionJpaRepository;
import com.example.cortex.service.exception.MemoryNotFoundException;
import com.example.cortex.service.exception.RateLimitExceededException;
import com.example.cortex.service.exception.UserNotFoundException;
import com.example.cortex.support.EngineJpaTestSupport;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

@TestPropertySource(properties = "cortex.rate-limit.memory-operations.max-requests=5")
class InteractionRecorderServiceTest extends EngineJpaTestSupport {

    @Autowired
    private InteractionRecorderService recorder;

    @Autowired
    private ConversationJpaRepository conversationRepository;

    @Autowired
    private MemoryJpaRepository memoryRepository;

    @Autowired
    private PropertyInteractionJpaRepository interactionRepository;

    @Autowired
    private JsonColumnMapper jsonMapper;

    @Test
    void storesTheExchangeAsConversationAndMemory() {
        registerUser("u1");

        RememberResult result = recorder.remember(
                "u1", "show me 3 bed houses in Bondi", "Here are some options", null, null, null);
        flushAndClear();

        assertThat(result.memorySpaceId()).isEqualTo("user-u1-personal");
        ConversationEntity conversation = conversationRepository.findById(result.conversationId()).orElseThrow();
        assertThat(conversation.getConversationType()).isEqualTo("user-agent");
        assertThat(conversation.getAgentId()).isEqualTo("haus-voice-agent");
        assertThat(conversation.getMessageCount()).isEqualTo(2);
        List<ConversationMessage> messages = jsonMapper.readMessages(conversation.getMessages());
        assertThat(messages).extracting(ConversationMessage::getRole)
                .containsExactly(MessageRole.USER, MessageRole.AGENT);
        assertThat(messages.get(1).getTimestamp())
                .isEqualTo(messages.get(0).getTimestamp().plusMillis(1));

        MemoryEntity memory = memoryRepository.findById(result.memoryId()).orElseThrow();
        assertThat(memory.getContent()).isEqualTo("User: show me 3 bed houses in Bondi\nAgent: Here are some options");
        assertThat(memory.getImportance()).isEqualTo(50);
        assertThat(memory.getRevision()).isEqualTo(1);
        assertThat(memory.getConversationId()).isEqualTo(result.conversationId());
        assertThat(jsonMapper.readStrings(memory.getMessageIds())).containsExactly(messages.get(0).getId());
        assertThat(jsonMapper.readStrings(memory.getTags())).containsExactly("voice-search", "general");
        assertThat(interactionRepository.findByUserIdOrderByOccurredAtDesc("u1")).isEmpty();
    }

    @Test
    void logsThePropertyInteractionWhenAListingWasDiscussed() {
        registerUser("u1");

        RememberResult result = recorder.remember("u1", "tell me about this one", "It has three bedrooms",
                "p1", Map.of("suburb", "Bondi", "price", 1_500_000), "session-1");
        flushAndClear();

        MemoryEntity memory = memoryRepository.findById(result.memoryId()).orElseThrow();
        assertThat(jsonMapper.readStrings(memory.getTags())).containsExactly("voice-search", "property");
        List<PropertyInteractionEntity> interactions = interactionRepository.findByUserIdOrderByOccurredAtDesc("u1");
        assertThat(interactions).singleElement().satisfies(interaction -> {
            assertThat(interaction.getPropertyId()).isEqualTo("p1");
            assertThat(interaction.getInteractionType()).isEqualTo("voice_query");
            assertThat(interaction.getQueryText()).isEqualTo("tell me about this one");
            assertThat(interaction.getConversationId()).isEqualTo(result.conversationId());
            assertThat(jsonMapper.readMap(interaction.getPropertyContext())).containsEntry("suburb", "Bondi");
        });
    }

    @Test
    void emptyPropertyContextIsStillLogged() {
        registerUser("u1");

        recorder.remember("u1", "is p2 still available", "Yes", "p2", Map.of(), null);
        flushAndClear();

        assertThat(interactionRepository.findByUserIdOrderByOccurredAtDesc("u1")).singleElement()
                .satisfies(interaction -> {
                    assertThat(interaction.getPropertyId()).isEqualTo("p2");
                    assertThat(jsonMapper.readMap(interaction.getPropertyContext())).isEmpty();
                });
    }

    @Test
    void propertyWithoutContextIsTaggedButNotLogged() {
        registerUser("u1");

        RememberResult result = recorder.remember("u1", "is p3 still available", "Yes", "p3", null, null);
        flushAndClear();

        assertThat(jsonMapper.readStrings(memoryRepository.findById(result.memoryId()).orElseThrow().getTags()))
                .contains("property");
        assertThat(interactionRepository.findByUserIdOrderByOccurredAtDesc("u1")).isEmpty();
    }

    @Test
    void longUserAndPropertyIdsFitTheGeneratedKeys() {
        String userId = "u".repeat(128);
        String propertyId = "p".repeat(128);
        registerUser(userId);

        RememberResult result = recorder.remember(userId, "what about this one", "Nice garden", propertyId,
                Map.of("suburb", "Manly"), null);
        flushAndClear();

        assertThat(memoryRepository.findById(result.memoryId())).isPresent();
        assertThat(interactionRepository.findByUserIdOrderByOccurredAtDesc(userId)).singleElement()
                .satisfies(interaction -> {
                    assertThat(interaction.getId()).startsWith("prop-int-").doesNotContain(userId);
                    assertThat(interaction.getPropertyId()).isEqualTo(propertyId);
                });
    }

    @Test
    void overlongPropertyIdIsRejectedBeforeAnythingIsWritten() {
        registerUser("u1");

        assertThatThrownBy(() -> recorder.remember("u1", "q", "a", "p".repeat(129), Map.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Property id");
        flushAndClear();
        assertThat(conversationRepository.count()).isZero();
        assertThat(interactionRepository.count()).isZero();
    }

    @Test
    void blankSidesOfTheExchangeAreRejected() {
        registerUser("u1");

        assertThatThrownBy(() -> recorder.remember("u1", " ", "a", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> recorder.remember("u1", "q", "", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(memoryRepository.count()).isZero();
    }

    @Test
    void unknownUserWritesNothing() {
        assertThatThrownBy(() -> recorder.remember("ghost", "hello", "hi", null, null, null))
                .isInstanceOf(UserNotFoundException.class);
        assertThat(conversationRepository.count()).isZero();
        assertThat(memoryRepository.count()).isZero();
    }

    @Test
    void rejectedCallsWriteNothing() {
        registerUser("u1");
        for (int i = 0; i < 5; i++) {
            recorder.remember("u1", "query " + i, "answer " + i, null, null, null);
        }

        assertThatThrownBy(() -> recorder.remember("u1", "one more", "no", null, null, null))
                .isInstanceOf(RateLimitExceededException.class);
        assertThat(memoryRepository.count()).isEqualTo(5);

        clock.advance(Duration.ofMinutes(1));
        recorder.remember("u1", "after the window", "ok", null, null, null);
        assertThat(memoryRepository.count()).isEqualTo(6);
    }

    @Test
    void revisingImportanceClampsAndBumpsTheRevision() {
        registerUser("u1");
        RememberResult result = recorder.remember("u1", "q", "a", null, null, null);

        ImportanceResponse raised = recorder.reviseImportance("u1", result.memoryId(), 140, null);
        ImportanceResponse lowered = recorder.reviseImportance("u1", result.memoryId(), -3, null);
        flushAndClear();

        assertThat(raised.getImportance()).isEqualTo(100);
        assertThat(raised.getRevision()).isEqualTo(2);
        assertThat(lowered.getImportance()).isZero();
        assertThat(lowered.getRevision()).isEqualTo(3);
        assertThat(memoryRepository.findById(result.memoryId()).orElseThrow().getImportance()).isZero();
    }

    @Test
    void revisingSomeoneElsesMemoryIsNotFound() {
        registerUser("u1");
        registerUser("u2");
        RememberResult result = recorder.remember("u1", "q", "a", null, null, null);
        recorder.remember("u2", "q", "a", null, null, null);

        assertThatThrownBy(() -> recorder.reviseImportance("u2", result.memoryId(), 80, null))
                .isInstanceOf(MemoryNotFoundException.class);
        assertThatThrownBy(() -> recorder.reviseImportance("u1", "mem-missing", 80, null))
                .isInstanceOf(MemoryNotFoundException.class);
    }
}
