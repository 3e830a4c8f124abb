package com.example.cortex.event;

import com.example.cortex.config.CortexProperties;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes committed writes to Kafka, keyed by memory space so one space's events stay ordered.
 * Call only after the write has committed; a failed send is logged and never undoes the write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MemoryEventPublisher {

    private final KafkaTemplate<String, MemoryEvent> memoryEventKafkaTemplate;
    private final CortexProperties cortexProperties;

    public void publish(MemoryEventType type, String memorySpaceId, String userId, String referenceId,
                        Instant occurredAt, Map<String, Object> payload) {
        publish(MemoryEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .memorySpaceId(memorySpaceId)
                .userId(userId)
                .referenceId(referenceId)
                .occurredAt(occurredAt)
                .payload(payload == null ? Map.of() : payload)
                .build());
    }

    public void publish(MemoryEvent event) {
        String topic = cortexProperties.getKafka().getMemoryEventTopic();
        try {
            memoryEventKafkaTemplate.send(topic, event.getMemorySpaceId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to deliver {} event {} for space {}",
                                    event.getType(), event.getReferenceId(), event.getMemorySpaceId(), ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} event {} for space {}",
                    event.getType(), event.getReferenceId(), event.getMemorySpaceId(), ex);
        }
    }
}
