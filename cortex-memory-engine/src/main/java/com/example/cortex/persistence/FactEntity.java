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
        name = "cortex_facts",
        indexes = @Index(name = "idx_facts_space", columnList = "memory_space_id, created_at"))
public class FactEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 192)
    private String id;

    @Column(name = "memory_space_id", nullable = false, length = 192)
    private String memorySpaceId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "fact", nullable = false, columnDefinition = "text")
    private String fact;

    @Column(name = "fact_type", nullable = false, length = 32)
    private String factType;

    @Column(name = "subject", nullable = false, length = 128)
    private String subject;

    @Column(name = "predicate", nullable = false, length = 64)
    private String predicate;

    @Column(name = "object_value", nullable = false, columnDefinition = "text")
    private String objectValue;

    @Column(name = "confidence", nullable = false)
    private int confidence;

    @Column(name = "source_type", length = 32)
    private String sourceType;

    @Column(name = "category", length = 64)
    private String category;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "tags", columnDefinition = "text")
    private String tags;

    @Column(name = "revision", nullable = false)
    private int revision;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
