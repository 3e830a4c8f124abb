package com.example.cortex.domain;

import java.time.Instant;

/**
 * Outcome of a rate limit admission check for one identity and operation class.
 *
 * @param allowed whether the request was admitted
 * @param current requests counted in the current window
 * @param limit configured ceiling for the window
 * @param remaining requests still admitted in the current window
 * @param resetTime instant at which the current window ends
 * @param retryAfterSeconds whole seconds until the window ends
 */
public record RateLimitStatus(
        boolean allowed,
        int current,
        int limit,
        int remaining,
        Instant resetTime,
        long retryAfterSeconds) {
}
