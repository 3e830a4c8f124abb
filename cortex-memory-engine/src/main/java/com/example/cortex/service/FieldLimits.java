package com.example.cortex.service;

/**
 * Upper bounds for caller-supplied values that end up in sized columns.
 */
final class FieldLimits {

    static final int PROPERTY_ID = 128;
    static final int CATEGORY = 64;
    static final int SUBURB_NAME = 128;
    static final int STATE = 32;

    private FieldLimits() {
    }

    static void requireMaxLength(String value, int maxLength, String field) {
        if (value != null && value.length() > maxLength) {
            throw new IllegalArgumentException("%s must be at most %d characters".formatted(field, maxLength));
        }
    }
}
