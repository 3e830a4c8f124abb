package com.example.cortex.support;

import com.example.cortex.config.CortexProperties;
import com.example.cortex.event.MemoryEventPublisher;
import com.example.cortex.persistence.JsonColumnMapper;
import com.example.cortex.service.DistributedLockService;
import com.example.cortex.service.InteractionRecorderService;
import com.example.cortex.service.MemorySpaceService;
import com.example.cortex.service.PreferenceService;
import com.example.cortex.service.RecallProjectionMapper;
import com.example.cortex.service.RecallService;
import com.example.cortex.service.RedisKeyFactory;
import com.example.cortex.service.ratelimit.JpaRateLimitBucketStore;
import com.example.cortex.service.ratelimit.RateLimitIdentityResolver;
import com.example.cortex.service.ratelimit.RateLimiterService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Wires the engine services on top of a JPA test slice. Redis and Kafka are mocked by the tests.
 */
@TestConfiguration
@EnableConfigurationProperties(CortexProperties.class)
@Import({
        JsonColumnMapper.class,
        RedisKeyFactory.class,
        DistributedLockService.class,
        JpaRateLimitBucketStore.class,
        RateLimiterService.class,
        RateLimitIdentityResolver.class,
        MemoryEventPublisher.class,
        MemorySpaceService.class,
        InteractionRecorderService.class,
        PreferenceService.class,
        RecallProjectionMapper.class,
        RecallService.class
})
public class TestEngineConfig {

    public static final Instant START = Instant.parse("2025-03-01T09:00:00Z");

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public MutableClock clock() {
        return new MutableClock(START);
    }
}
