package com.hrms.gateway.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed counting window for one (category, key) pair. The window is reset
 * lazily by the first request arriving after it expired.
 */
final class RateWindow {

    private final Duration window;
    private Instant windowStartAt;
    private int currentCount;
    private Instant lastSeenAt;

    RateWindow(Duration window, Instant now) {
        this.window = window;
        this.windowStartAt = now;
        this.lastSeenAt = now;
    }

    synchronized RateDecision tryAcquire(String category, int limit, double loadFactor, Instant now) {
        lastSeenAt = now;
        Instant resetAt = windowStartAt.plus(window);
        if (!now.isBefore(resetAt)) {
            windowStartAt = now;
            currentCount = 0;
            resetAt = now.plus(window);
        }

        Duration untilReset = Duration.between(now, resetAt);
        if (currentCount >= limit) {
            return new RateDecision(false, category, limit, 0, untilReset, loadFactor);
        }
        currentCount++;
        return new RateDecision(true, category, limit, limit - currentCount, untilReset, loadFactor);
    }

    synchronized boolean idleSince(Instant cutoff) {
        return lastSeenAt.isBefore(cutoff);
    }
}
