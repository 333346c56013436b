package com.hrms.gateway.circuitbreaker;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One breaker per logical service, created on first use from a shared
 * Resilience4j {@link CircuitBreakerRegistry}.
 */
@Slf4j
public class CircuitBreakerManager {

    private final CircuitBreakerRegistry registry;
    private final Map<String, ServiceCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Duration cooldown;
    private final Clock clock;

    public CircuitBreakerManager(int threshold, float failureRateThreshold, Duration cooldown, Clock clock) {
        this(CircuitBreakerRegistry.of(breakerConfig(threshold, failureRateThreshold, cooldown, clock)),
                cooldown, clock);
    }

    public CircuitBreakerManager(CircuitBreakerRegistry registry, Duration cooldown, Clock clock) {
        this.registry = registry;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Breaker settings: the last {@code threshold} calls are kept, and the breaker
     * opens once at least {@code failureRateThreshold} percent of them failed.
     * OPEN moves to HALF_OPEN only when a call arrives after the cooldown, and
     * HALF_OPEN admits exactly one trial call.
     */
    public static CircuitBreakerConfig breakerConfig(int threshold, float failureRateThreshold,
                                                     Duration cooldown, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1");
        }
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(cooldown)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .permittedNumberOfCallsInHalfOpenState(1)
                .clock(clock)
                .build();
    }

    public ServiceCircuitBreaker breakerFor(String service) {
        return breakers.computeIfAbsent(service, name -> {
            CircuitBreakerConfig config = registry.getDefaultConfig();
            log.info("Circuit breaker created for {} (threshold {}, failure rate {}%, cooldown {})",
                    name, config.getMinimumNumberOfCalls(), config.getFailureRateThreshold(), cooldown);
            return new ServiceCircuitBreaker(registry.circuitBreaker(name), cooldown, clock);
        });
    }

    public Optional<ServiceCircuitBreaker> find(String service) {
        return Optional.ofNullable(breakers.get(service));
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(ServiceCircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::service))
                .toList();
    }

    public boolean reset(String service) {
        return find(service).map(breaker -> {
            breaker.reset();
            return true;
        }).orElse(false);
    }

    public CircuitBreakerRegistry registry() {
        return registry;
    }
}
