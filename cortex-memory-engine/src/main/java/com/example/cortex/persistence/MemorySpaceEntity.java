package com.example.cortex.persistence;

import com.example.cortex.domain.MemorySpaceStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "cortex_memory_spaces")
public class MemorySpaceEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 192)
    private String id;

    @Column(name = "name", nullable = false, length = 192)
    private String name;

    @Column(name = "space_type", nullable = false, length = 32)
    private String spaceType;

    @Column(name = "owner_user_id", nullable = false, length = 128)
    private String ownerUserId;

    @Column(name = "participants", columnDefinition = "text")
    private String participants;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private MemorySpaceStatus status;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
