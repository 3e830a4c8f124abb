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
        name = "cortex_memories",
        indexes = @Index(name = "idx_memories_space_created", columnList = "memory_space_id, created_at"))
public class MemoryEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "memory_space_id", nullable = false, length = 192)
    private String memorySpaceId;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "content_type", nullable = false, length = 32)
    private String contentType;

    @Column(name = "source_type", nullable = false, length = 32)
    private String sourceType;

    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(name = "agent_id", length = 128)
    private String agentId;

    @Column(name = "conversation_id", length = 64)
    private String conversationId;

    @Column(name = "message_ids", columnDefinition = "text")
    private String messageIds;

    @Column(name = "importance", nullable = false)
    private int importance;

    @Column(name = "tags", columnDefinition = "text")
    private String tags;

    @Column(name = "revision", nullable = false)
    private int revision;

    @Column(name = "access_count", nullable = false)
    private long accessCount;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
