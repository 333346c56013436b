package com.hrms.gateway.ratelimit;

import java.time.Duration;

/**
 * Outcome of one quota check.
 *
 * @param retryAfter time until the window resets; meaningful when rejected
 */
public record RateDecision(
        boolean allowed,
        String category,
        int limit,
        int remaining,
        Duration retryAfter,
        double loadFactor
) {
}
