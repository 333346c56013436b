package com.hrms.gateway.circuitbreaker;

import com.hrms.gateway.exception.ErrorCode;
import com.hrms.gateway.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/*
 * ============================================================================
 * SERVICE CIRCUIT BREAKER - STATE MACHINE (Resilience4j)
 * ============================================================================
 *
 *          last <threshold> calls failed
 *   CLOSED ─────────────────────────────────► OPEN
 *     ▲                                        │
 *     │ trial succeeds                         │ cooldown elapsed, checked
 *     │ (window cleared)                       │ lazily on the next acquire
 *     │                                        ▼
 *     └──────────────────────────────────── HALF_OPEN
 *                                              │
 *                     trial fails              │
 *          OPEN ◄──────────────────────────────┘  (cooldown restarts)
 *
 * OPEN:      tryAcquirePermission() is false, retryAfter = remaining cooldown
 * HALF_OPEN: one permitted call; everyone else fails fast until the trial
 *            reports back or is released
 * ============================================================================
 */

/**
 * Gateway view of the Resilience4j breaker of one logical service.
 *
 * A caller takes a {@link Permission} before the downstream call and reports the
 * outcome on it exactly once. Rejections are turned into {@link ErrorCode#CIRCUIT_OPEN}
 * with the remaining cooldown as retry hint.
 */
@Slf4j
public class ServiceCircuitBreaker {

    static final Duration HALF_OPEN_RETRY_HINT = Duration.ofSeconds(1);

    private final CircuitBreaker delegate;
    private final Duration cooldown;
    private final Clock clock;

    private final LongAdder successCount = new LongAdder();
    private final LongAdder totalFailures = new LongAdder();
    private final LongAdder rejectedCount = new LongAdder();
    private volatile Instant openedAt;
    private volatile Instant lastFailureAt;
    private volatile Instant lastSuccessAt;

    ServiceCircuitBreaker(CircuitBreaker delegate, Duration cooldown, Clock clock) {
        this.delegate = delegate;
        this.cooldown = cooldown;
        this.clock = clock;

        delegate.getEventPublisher()
                .onStateTransition(this::onStateTransition)
                .onSuccess(event -> {
                    successCount.increment();
                    lastSuccessAt = clock.instant();
                })
                .onError(event -> {
                    totalFailures.increment();
                    lastFailureAt = clock.instant();
                });
    }

    private void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        State to = event.getStateTransition().getToState();
        if (to == State.OPEN) {
            openedAt = clock.instant();
            log.warn("Circuit breaker for {} is OPEN ({}), next attempt in {}",
                    getService(), event.getStateTransition(), cooldown);
        } else if (to == State.HALF_OPEN) {
            log.info("Circuit breaker for {} is HALF_OPEN, letting one trial call through", getService());
        } else {
            log.info("Circuit breaker for {} is {}", getService(), to);
        }
    }

    public String getService() {
        return delegate.getName();
    }

    /**
     * Asks to call the downstream service.
     *
     * @throws GatewayException with {@link ErrorCode#CIRCUIT_OPEN} when the call
     *                          must not be attempted
     */
    public Permission acquirePermission() {
        if (delegate.tryAcquirePermission()) {
            return new Permission(delegate.getState() == State.HALF_OPEN);
        }

        rejectedCount.increment();
        State state = delegate.getState();
        Duration retryAfter = state == State.HALF_OPEN ? HALF_OPEN_RETRY_HINT : remainingCooldown();
        log.warn("Request to {} rejected, circuit breaker is {} (retry after {} ms)",
                getService(), state, retryAfter.toMillis());
        throw new GatewayException(ErrorCode.CIRCUIT_OPEN,
                "Circuit breaker is open for " + getService(), retryAfter,
                Map.of("service", getService(), "state", state.name()));
    }

    private Duration remainingCooldown() {
        Instant opened = openedAt;
        if (opened == null) {
            return cooldown;
        }
        Duration remaining = Duration.between(clock.instant(), opened.plus(cooldown));
        return remaining.isNegative() || remaining.isZero() ? HALF_OPEN_RETRY_HINT : remaining;
    }

    public State getState() {
        return delegate.getState();
    }

    /**
     * Forces the breaker back to CLOSED and forgets recorded calls.
     */
    public void reset() {
        delegate.reset();
        log.info("Circuit breaker for {} manually reset", getService());
    }

    /**
     * Forces the breaker OPEN; the cooldown starts now.
     */
    public void trip() {
        if (delegate.getState() == State.OPEN) {
            delegate.transitionToClosedState();
        }
        delegate.transitionToOpenState();
        log.warn("Circuit breaker for {} manually tripped", getService());
    }

    public CircuitBreakerSnapshot snapshot() {
        State state = delegate.getState();
        CircuitBreaker.Metrics metrics = delegate.getMetrics();
        Instant opened = openedAt;
        return new CircuitBreakerSnapshot(getService(), state,
                metrics.getNumberOfFailedCalls(),
                metrics.getFailureRate(),
                delegate.getCircuitBreakerConfig().getMinimumNumberOfCalls(),
                cooldown,
                lastFailureAt,
                lastSuccessAt,
                state == State.OPEN && opened != null ? opened.plus(cooldown) : null,
                successCount.sum(),
                totalFailures.sum(),
                rejectedCount.sum());
    }

    /**
     * Right to make one downstream call. The first of {@link #recordSuccess()},
     * {@link #recordFailure(Throwable)} or {@link #release()} wins; later calls are ignored.
     */
    public final class Permission {

        private final boolean trial;
        private final long startedAt = delegate.getCurrentTimestamp();
        private final AtomicBoolean completed = new AtomicBoolean(false);

        private Permission(boolean trial) {
            this.trial = trial;
        }

        public boolean isTrial() {
            return trial;
        }

        public void recordSuccess() {
            if (completed.compareAndSet(false, true)) {
                delegate.onSuccess(elapsed(), delegate.getTimestampUnit());
            }
        }

        public void recordFailure(Throwable cause) {
            if (completed.compareAndSet(false, true)) {
                delegate.onError(elapsed(), delegate.getTimestampUnit(), cause);
            }
        }

        /**
         * Gives the permission back without an outcome, e.g. when no instance
         * could be selected or the client went away.
         */
        public void release() {
            if (completed.compareAndSet(false, true)) {
                delegate.releasePermission();
            }
        }

        private long elapsed() {
            return delegate.getCurrentTimestamp() - startedAt;
        }
    }
}
