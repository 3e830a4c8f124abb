package com.example.cortex.domain;

/**
 * Classes of operations that are counted separately by the rate limiter.
 */
public enum OperationClass {

    MEMORY_OPERATIONS("memory:ops"),
    VOICE_TOKEN("voice:token"),
    RECALL("memory:recall");

    private final String keyPrefix;

    OperationClass(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public String bucketKey(String identity) {
        return keyPrefix + ":" + identity;
    }
}
