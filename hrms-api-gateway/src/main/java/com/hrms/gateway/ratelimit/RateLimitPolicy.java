package com.hrms.gateway.ratelimit;

import com.hrms.gateway.exception.ErrorCode;

import java.time.Duration;

/**
 * Base quota of one rate-limit category.
 *
 * @param pathPattern only requests on this pattern are counted; {@code null} for all
 */
public record RateLimitPolicy(
        String category,
        Duration window,
        int baseLimit,
        ErrorCode errorCode,
        String pathPattern
) {

    public static final String GLOBAL = "global";
    public static final String USER = "user";
    public static final String API_KEY = "apikey";

    public RateLimitPolicy {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate limit window must be positive for " + category);
        }
        if (baseLimit < 1) {
            throw new IllegalArgumentException("Rate limit must be at least 1 for " + category);
        }
    }
}
