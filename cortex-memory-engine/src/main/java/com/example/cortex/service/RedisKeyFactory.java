package com.example.cortex.service;

import com.example.cortex.config.CortexProperties;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final CortexProperties cortexProperties;

    public RedisKeyFactory(CortexProperties cortexProperties) {
        this.cortexProperties = cortexProperties;
    }

    private String prefix() {
        return cortexProperties.getRedis().getKeyPrefix();
    }

    public String rateLimitBucketKey(String bucketId) {
        return "%s:ratelimit:%s".formatted(prefix(), bucketId);
    }

    public String rateLimitLockKey(String bucketId) {
        return "%s:ratelimit:%s:lock".formatted(prefix(), bucketId);
    }

    public String memorySpaceLockKey(String userId) {
        return "%s:user:%s:space:lock".formatted(prefix(), userId);
    }

    public String suburbPreferenceLockKey(String userId, String suburbName, String state) {
        return "%s:user:%s:suburb:%s:%s:lock".formatted(
                prefix(), userId, normalize(suburbName), normalize(state));
    }

    private String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
