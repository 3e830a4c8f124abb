package com.example.cortex.domain;

import java.util.Locale;

public enum PropertyInteractionType {

    VOICE_QUERY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
