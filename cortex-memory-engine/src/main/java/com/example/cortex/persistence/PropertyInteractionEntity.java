package com.example.cortex.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

/**
 * Append-only log entry. Rows are never updated; corrections are written as new entries.
 */
@Getter
@Setter
@Entity
@Immutable
@Table(
        name = "cortex_property_interactions",
        indexes = @Index(name = "idx_property_interactions_user", columnList = "user_id, occurred_at"))
public class PropertyInteractionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 255)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "memory_space_id", updatable = false, length = 192)
    private String memorySpaceId;

    @Column(name = "conversation_id", updatable = false, length = 64)
    private String conversationId;

    @Column(name = "property_id", nullable = false, updatable = false, length = 128)
    private String propertyId;

    @Column(name = "interaction_type", nullable = false, updatable = false, length = 32)
    private String interactionType;

    @Column(name = "property_context", updatable = false, columnDefinition = "text")
    private String propertyContext;

    @Column(name = "query_text", updatable = false, columnDefinition = "text")
    private String queryText;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "revision", nullable = false, updatable = false)
    private int revision;
}
