package com.example.cortex.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record GenericPreferenceMetadata(Map<String, Object> attributes) implements PreferenceMetadata {

    public GenericPreferenceMetadata {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public Map<String, Object> asMap() {
        return attributes;
    }
}
