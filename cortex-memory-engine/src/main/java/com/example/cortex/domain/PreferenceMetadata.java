package com.example.cortex.domain;

import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Structured metadata attached to a stored preference. The concrete variant is selected by the
 * preference category, so merge logic can branch on the type instead of probing map keys.
 */
public sealed interface PreferenceMetadata permits SuburbPreferenceMetadata, GenericPreferenceMetadata {

    String SUBURB_CATEGORY = "suburb";

    Map<String, Object> asMap();

    /**
     * Builds the variant for {@code category}. A suburb category only yields
     * {@link SuburbPreferenceMetadata} when both the suburb name and state are present.
     */
    static PreferenceMetadata from(String category, Map<String, Object> raw) {
        Map<String, Object> attributes = raw == null ? Map.of() : raw;
        if (SUBURB_CATEGORY.equals(category)) {
            String suburbName = text(attributes.get("suburbName"));
            String state = text(attributes.get("state"));
            if (StringUtils.hasText(suburbName) && StringUtils.hasText(state)) {
                return new SuburbPreferenceMetadata(
                        suburbName,
                        state,
                        text(attributes.get("reason")),
                        text(attributes.get("mentionedInQuery")));
            }
        }
        return new GenericPreferenceMetadata(attributes);
    }

    private static String text(Object value) {
        if (value instanceof String s && StringUtils.hasText(s)) {
            return s.trim();
        }
        return null;
    }
}
