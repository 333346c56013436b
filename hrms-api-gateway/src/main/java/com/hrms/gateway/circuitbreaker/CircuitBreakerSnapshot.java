package com.hrms.gateway.circuitbreaker;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one breaker, for the admin endpoint.
 *
 * @param failureCount failed calls among the last {@code threshold} calls
 * @param failureRate  percentage of failed calls, -1 until {@code threshold} calls were seen
 */
public record CircuitBreakerSnapshot(
        String service,
        CircuitBreaker.State state,
        int failureCount,
        float failureRate,
        int threshold,
        Duration cooldown,
        Instant lastFailureAt,
        Instant lastSuccessAt,
        Instant nextAttemptAt,
        long successCount,
        long totalFailures,
        long rejectedCount
) {
}
