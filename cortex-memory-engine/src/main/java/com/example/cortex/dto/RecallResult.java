package com.example.cortex.dto;

import java.util.List;

/**
 * Candidate context handed back to the agent. Each list is already trimmed to the requested limit.
 */
public record RecallResult(
        List<MemoryRecall> memories,
        List<FactRecall> facts,
        List<PropertyInteractionRecall> propertyInteractions,
        List<SuburbPreferenceRecall> suburbPreferences) {

    public static RecallResult empty() {
        return new RecallResult(List.of(), List.of(), List.of(), List.of());
    }
}
