package com.example.cortex.dto;

import java.util.List;

public record PreferencesResult(List<FactRecall> facts, List<SuburbPreferenceRecall> suburbPreferences) {

    public static PreferencesResult empty() {
        return new PreferencesResult(List.of(), List.of());
    }
}
