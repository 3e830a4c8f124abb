package com.example.cortex.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "cortex_conversations",
        indexes = @Index(name = "idx_conversations_space", columnList = "memory_space_id, created_at"))
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "memory_space_id", nullable = false, length = 192)
    private String memorySpaceId;

    @Column(name = "conversation_type", nullable = false, length = 32)
    private String conversationType;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "agent_id", length = 128)
    private String agentId;

    @Column(name = "messages", columnDefinition = "text")
    private String messages;

    @Column(name = "message_count", nullable = false)
    private int messageCount;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
