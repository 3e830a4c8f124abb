package com.example.cortex.domain;

import java.util.LinkedHashMap;
import java.util.Map;

public record SuburbPreferenceMetadata(
        String suburbName,
        String state,
        String reason,
        String mentionedInQuery) implements PreferenceMetadata {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("suburbName", suburbName);
        map.put("state", state);
        if (reason != null) {
            map.put("reason", reason);
        }
        if (mentionedInQuery != null) {
            map.put("mentionedInQuery", mentionedInQuery);
        }
        return map;
    }
}
