package com.example.cortex.service.ratelimit;

import com.example.cortex.config.CortexProperties;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Derives the identity a request is counted against. Signed-in callers share one bucket per
 * user; anonymous callers are keyed by a digest of their session token so separate sessions never
 * share one and raw tokens never reach the bucket store.
 */
@Component
@RequiredArgsConstructor
public class RateLimitIdentityResolver {

    /**
     * Longest user id or client address kept verbatim in a bucket key; longer values are digested.
     */
    static final int MAX_PLAIN_LENGTH = 128;

    private final CortexProperties cortexProperties;

    public String resolve(String userId, String sessionToken) {
        return resolve(userId, sessionToken, null);
    }

    /**
     * Same as {@link #resolve(String, String)}, but falls back to the client address before
     * minting a one-off anonymous identity.
     */
    public String resolve(String userId, String sessionToken, String clientAddress) {
        if (StringUtils.hasText(userId) && !isAnonymous(userId)) {
            return "user:" + boundedValue(userId.trim());
        }
        if (StringUtils.hasText(sessionToken)) {
            return "anon:" + DigestUtils.sha256Hex(sessionToken.trim());
        }
        if (StringUtils.hasText(clientAddress)) {
            return "ip:" + boundedValue(clientAddress.trim());
        }
        return "anon:" + UUID.randomUUID();
    }

    public boolean isAnonymous(String userId) {
        return !StringUtils.hasText(userId) || cortexProperties.getAnonymousUserId().equals(userId.trim());
    }

    private static String boundedValue(String value) {
        return value.length() <= MAX_PLAIN_LENGTH ? value : "sha256:" + DigestUtils.sha256Hex(value);
    }
}
