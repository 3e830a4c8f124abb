package com.example.cortex.service.ratelimit;

import com.example.cortex.domain.RateLimitStatus;
import java.time.Duration;
import java.time.Instant;

/**
 * Arithmetic shared by the bucket stores. A window opens at the first request and stays open
 * for its configured length; requests beyond the ceiling leave the count where it is.
 */
final class FixedWindowCounter {

    private FixedWindowCounter() {
    }

    static boolean isElapsed(Instant windowStart, Duration window, Instant now) {
        return windowStart == null || !now.isBefore(windowStart.plus(window));
    }

    static boolean isFull(int count, int maxRequests) {
        return count >= maxRequests;
    }

    static RateLimitStatus status(boolean allowed, int current, int maxRequests, Instant windowStart,
                                  Duration window, Instant now) {
        Instant resetTime = windowStart.plus(window);
        long millisLeft = Math.max(0, Duration.between(now, resetTime).toMillis());
        long retryAfter = (millisLeft + 999) / 1000;
        return new RateLimitStatus(
                allowed,
                current,
                maxRequests,
                Math.max(0, maxRequests - current),
                resetTime,
                retryAfter);
    }

    static RateLimitStatus empty(int maxRequests, Duration window, Instant now) {
        return new RateLimitStatus(true, 0, maxRequests, maxRequests, now.plus(window), 0);
    }
}
