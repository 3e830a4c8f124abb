package com.example.cortex.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "cortex_suburb_preferences",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_suburb_preferences_user_suburb_state",
                columnNames = {"user_id", "suburb_name", "state"}))
public class SuburbPreferenceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "memory_space_id", nullable = false, length = 192)
    private String memorySpaceId;

    @Column(name = "suburb_name", nullable = false, length = 128)
    private String suburbName;

    @Column(name = "state", nullable = false, length = 32)
    private String state;

    @Column(name = "preference_score", nullable = false)
    private int preferenceScore;

    @Column(name = "interaction_count", nullable = false)
    private int interactionCount;

    @Column(name = "reasons", columnDefinition = "text")
    private String reasons;

    @Column(name = "mentioned_in_queries", columnDefinition = "text")
    private String mentionedInQueries;

    @Column(name = "first_mentioned_at", nullable = false)
    private Instant firstMentionedAt;

    @Column(name = "last_mentioned_at", nullable = false)
    private Instant lastMentionedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
