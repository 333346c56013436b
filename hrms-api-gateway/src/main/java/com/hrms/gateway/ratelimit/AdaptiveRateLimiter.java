package com.hrms.gateway.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/*
 * ============================================================================
 * ADAPTIVE RATE LIMITER - CODE FLOW
 * ============================================================================
 *
 *   updateSystemLoad(L)                      tryAcquire(category, key)
 *         │                                         │
 *         ▼                                         ▼
 *   ┌──────────────────────────────┐   ┌──────────────────────────────────┐
 *   │ clamp L to [0,1]             │   │ window = windows[(category,key)] │
 *   │ L > 0.8        → × 0.5       │   │ expired? → restart at now        │
 *   │ 0.6 < L ≤ 0.8  → × 0.75      │   │ count ≥ currentLimit? → reject   │
 *   │ L < 0.3        → × 1.25      │   │   (retryAfter = until reset)     │
 *   │ otherwise      → × 1.0       │   │ else count++ → allow             │
 *   │ currentLimit = ⌊base × f⌋    │   └──────────────────────────────────┘
 *   └──────────────────────────────┘
 *
 * Limits are recomputed per load sample, never per request.
 * ============================================================================
 */

/**
 * Per-category fixed-window rate limiter whose limits follow the system load.
 */
@Slf4j
public class AdaptiveRateLimiter {

    private final Map<String, RateLimitPolicy> policies = new LinkedHashMap<>();
    private final Map<String, Integer> currentLimits = new ConcurrentHashMap<>();
    private final Map<WindowKey, RateWindow> windows = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> totalRequests = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> blockedRequests = new ConcurrentHashMap<>();
    private final Duration idleEviction;
    private final Clock clock;

    private volatile double systemLoad = 0.5;
    private volatile double loadFactor = 1.0;

    public AdaptiveRateLimiter(Collection<RateLimitPolicy> policies, Duration idleEviction, Clock clock) {
        policies.forEach(policy -> this.policies.put(policy.category(), policy));
        this.idleEviction = idleEviction;
        this.clock = clock;
        recomputeLimits();
        log.info("Adaptive rate limiter initialized with categories {}", this.policies.keySet());
    }

    /**
     * Load multiplier for a load sample, clamped to [0, 1].
     */
    public static double loadFactor(double load) {
        double clamped = clamp(load);
        if (clamped > 0.8) {
            return 0.5;
        }
        if (clamped > 0.6) {
            return 0.75;
        }
        if (clamped < 0.3) {
            return 1.25;
        }
        return 1.0;
    }

    public void updateSystemLoad(double load) {
        double clamped = clamp(load);
        double previousFactor = loadFactor;
        systemLoad = clamped;
        loadFactor = loadFactor(clamped);
        recomputeLimits();
        if (previousFactor != loadFactor) {
            log.info("System load {} changed rate limit factor {} -> {}, limits now {}",
                    String.format("%.2f", clamped), previousFactor, loadFactor, currentLimits);
        }
    }

    private synchronized void recomputeLimits() {
        double factor = loadFactor;
        policies.values().forEach(policy -> currentLimits.put(policy.category(),
                Math.max(1, (int) Math.floor(policy.baseLimit() * factor))));
    }

    /**
     * Counts one request against the window of {@code (category, key)}.
     */
    public RateDecision tryAcquire(String category, String key) {
        RateLimitPolicy policy = policies.get(category);
        if (policy == null) {
            throw new IllegalArgumentException("Unknown rate limit category " + category);
        }
        Instant now = clock.instant();
        RateWindow window = windows.computeIfAbsent(new WindowKey(category, key),
                k -> new RateWindow(policy.window(), now));

        RateDecision decision = window.tryAcquire(category, currentLimits.get(category), loadFactor, now);

        totalRequests.computeIfAbsent(category, c -> new LongAdder()).increment();
        if (!decision.allowed()) {
            blockedRequests.computeIfAbsent(category, c -> new LongAdder()).increment();
        }
        return decision;
    }

    /**
     * Drops windows that have not seen a request for the idle-eviction period.
     */
    @Scheduled(fixedDelayString = "${hrms.gateway.rate-limiting.eviction-interval:PT5M}")
    public int evictIdleWindows() {
        Instant cutoff = clock.instant().minus(idleEviction);
        int before = windows.size();
        windows.values().removeIf(window -> window.idleSince(cutoff));
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limit windows", evicted);
        }
        return evicted;
    }

    public RateLimitPolicy policy(String category) {
        return policies.get(category);
    }

    public List<RateLimitPolicy> policies() {
        return List.copyOf(policies.values());
    }

    public int currentLimit(String category) {
        Integer limit = currentLimits.get(category);
        return limit != null ? limit : 0;
    }

    public double getSystemLoad() {
        return systemLoad;
    }

    public double getLoadFactor() {
        return loadFactor;
    }

    public int activeWindows() {
        return windows.size();
    }

    public Map<String, Object> metrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        policies.keySet().forEach(category -> {
            long total = count(totalRequests, category);
            long blocked = count(blockedRequests, category);
            metrics.put(category, Map.of(
                    "baseLimit", policies.get(category).baseLimit(),
                    "currentLimit", currentLimit(category),
                    "windowMs", policies.get(category).window().toMillis(),
                    "totalRequests", total,
                    "blockedRequests", blocked,
                    "blockRate", total > 0 ? (double) blocked / total : 0.0));
        });
        return metrics;
    }

    private static long count(Map<String, LongAdder> counters, String category) {
        LongAdder adder = counters.get(category);
        return adder != null ? adder.sum() : 0;
    }

    private static double clamp(double load) {
        if (Double.isNaN(load)) {
            return 0;
        }
        return Math.max(0, Math.min(1, load));
    }

    private record WindowKey(String category, String key) {
    }
}
