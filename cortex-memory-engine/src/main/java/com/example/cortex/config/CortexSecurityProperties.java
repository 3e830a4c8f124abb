package com.example.cortex.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cortex.security")
public class CortexSecurityProperties {

    /**
     * Toggle to enable or disable the inbound HTTP read throttle.
     */
    private boolean rateLimitingEnabled = true;

    /**
     * Request path prefix guarded by the inbound throttle.
     */
    private String guardedPath = "/api/memory/";

    /**
     * Browser origins allowed to call the memory API.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public String getGuardedPath() {
        return guardedPath;
    }

    public void setGuardedPath(String guardedPath) {
        this.guardedPath = guardedPath;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }
}
