package com.example.cortex.dto;

import java.time.Instant;
import java.util.Map;

public record PropertyInteractionRecall(
        String propertyId,
        Map<String, Object> propertyContext,
        String interactionType,
        String queryText,
        Instant timestamp) {
}
