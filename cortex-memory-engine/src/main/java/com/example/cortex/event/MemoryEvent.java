package com.example.cortex.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Notification for the external indexer that embeds memories and syncs facts into the graph.
 * {@code referenceId} names the written record: a memory, fact, interaction or space id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEvent implements Serializable {

    private String eventId;
    private MemoryEventType type;
    private String memorySpaceId;
    private String userId;
    private String referenceId;
    private Instant occurredAt;
    private Map<String, Object> payload;
}
