package com.example.cortex.config;

import com.example.cortex.event.MemoryEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, MemoryEvent> memoryEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, MemoryEvent> memoryEventKafkaTemplate(
            ProducerFactory<String, MemoryEvent> memoryEventProducerFactory) {
        return new KafkaTemplate<>(memoryEventProducerFactory);
    }

    @Bean
    public NewTopic memoryEventTopic(CortexProperties cortexProperties) {
        return TopicBuilder.name(cortexProperties.getKafka().getMemoryEventTopic())
                .partitions(cortexProperties.getKafka().getPartitions())
                .replicas(1)
                .build();
    }
}
