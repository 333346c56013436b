package com.hrms.gateway.circuitbreaker;

import com.hrms.gateway.MutableClock;
import com.hrms.gateway.exception.ErrorCode;
import com.hrms.gateway.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceCircuitBreakerTest {

    private static final Duration COOLDOWN = Duration.ofSeconds(30);
    private static final Duration PAST_COOLDOWN = COOLDOWN.plusSeconds(1);

    private MutableClock clock;
    private CircuitBreakerManager manager;
    private ServiceCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        manager = new CircuitBreakerManager(3, 100, COOLDOWN, clock);
        breaker = manager.breakerFor("employee");
    }

    @Test
    @DisplayName("Threshold failures open the breaker and the next call fails fast with the remaining cooldown")
    void opensAfterThresholdFailures() {
        failTimes(3);

        assertThat(breaker.getState()).isEqualTo(State.OPEN);

        clock.advance(Duration.ofSeconds(10));
        assertThatThrownBy(() -> breaker.acquirePermission())
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CIRCUIT_OPEN);
                    assertThat(ex.getRetryAfter()).isEqualTo(Duration.ofSeconds(20));
                    assertThat(ex.getDetails()).containsEntry("service", "employee").containsEntry("state", "OPEN");
                });
        assertThat(breaker.snapshot().rejectedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A success between failures keeps the breaker closed at a 100% failure rate")
    void successBreaksTheFailureRun() {
        failTimes(2);
        breaker.acquirePermission().recordSuccess();
        failTimes(2);

        assertThat(breaker.getState()).isEqualTo(State.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("A lower failure rate threshold opens on intermittent failures")
    void lowerRateOpensOnIntermittentFailures() {
        ServiceCircuitBreaker flaky = new CircuitBreakerManager(4, 50, COOLDOWN, clock).breakerFor("learning");

        flaky.acquirePermission().recordSuccess();
        flaky.acquirePermission().recordFailure(new IOException("reset"));
        flaky.acquirePermission().recordSuccess();
        assertThat(flaky.getState()).isEqualTo(State.CLOSED);

        flaky.acquirePermission().recordFailure(new IOException("reset"));

        assertThat(flaky.getState()).isEqualTo(State.OPEN);
    }

    @Test
    @DisplayName("The breaker stays open until the cooldown has fully elapsed")
    void staysOpenUntilCooldownElapsed() {
        failTimes(3);
        clock.advance(COOLDOWN.minusSeconds(1));

        assertThatThrownBy(() -> breaker.acquirePermission())
                .isInstanceOfSatisfying(GatewayException.class,
                        ex -> assertThat(ex.getRetryAfter()).isEqualTo(Duration.ofSeconds(1)));
        assertThat(breaker.getState()).isEqualTo(State.OPEN);
    }

    @Test
    @DisplayName("After the cooldown exactly one trial call is let through")
    void halfOpenAllowsSingleTrialCall() {
        failTimes(3);
        clock.advance(PAST_COOLDOWN);

        ServiceCircuitBreaker.Permission trial = breaker.acquirePermission();

        assertThat(trial.isTrial()).isTrue();
        assertThat(breaker.getState()).isEqualTo(State.HALF_OPEN);
        assertThatThrownBy(() -> breaker.acquirePermission())
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CIRCUIT_OPEN);
                    assertThat(ex.getRetryAfter()).isEqualTo(ServiceCircuitBreaker.HALF_OPEN_RETRY_HINT);
                });
    }

    @Test
    @DisplayName("Concurrent callers during the trial call all fail fast")
    void concurrentHalfOpenCallersFailFast() throws Exception {
        failTimes(3);
        clock.advance(PAST_COOLDOWN);
        ServiceCircuitBreaker.Permission trial = breaker.acquirePermission();

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    breaker.acquirePermission();
                    return true;
                } catch (GatewayException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int permitted = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                permitted++;
            }
        }
        pool.shutdown();

        assertThat(trial.isTrial()).isTrue();
        assertThat(permitted).isZero();
        assertThat(breaker.snapshot().rejectedCount()).isEqualTo(callers);
    }

    @Test
    @DisplayName("A successful trial call closes the breaker and clears failures")
    void trialSuccessCloses() {
        failTimes(3);
        clock.advance(PAST_COOLDOWN);

        breaker.acquirePermission().recordSuccess();

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertThat(snapshot.state()).isEqualTo(State.CLOSED);
        assertThat(snapshot.failureCount()).isZero();
        assertThat(snapshot.nextAttemptAt()).isNull();
        assertThat(breaker.acquirePermission().isTrial()).isFalse();
    }

    @Test
    @DisplayName("A failed trial call re-opens the breaker and restarts the cooldown")
    void trialFailureReopens() {
        failTimes(3);
        clock.advance(PAST_COOLDOWN);

        breaker.acquirePermission().recordFailure(new IOException("connection refused"));

        assertThat(breaker.getState()).isEqualTo(State.OPEN);
        assertThat(breaker.snapshot().nextAttemptAt()).isEqualTo(clock.instant().plus(COOLDOWN));
        clock.advance(Duration.ofSeconds(29));
        assertThatThrownBy(() -> breaker.acquirePermission()).isInstanceOf(GatewayException.class);
        clock.advance(Duration.ofSeconds(2));
        assertThat(breaker.acquirePermission().isTrial()).isTrue();
    }

    @Test
    @DisplayName("A released trial permission lets the next caller try")
    void releasedTrialFreesTheSlot() {
        failTimes(3);
        clock.advance(PAST_COOLDOWN);

        breaker.acquirePermission().release();

        assertThat(breaker.acquirePermission().isTrial()).isTrue();
    }

    @Test
    @DisplayName("Only the first outcome reported on a permission counts")
    void permissionOutcomeIsRecordedOnce() {
        ServiceCircuitBreaker.Permission permission = breaker.acquirePermission();

        permission.recordFailure(new IOException("boom"));
        permission.recordFailure(new IOException("boom"));
        permission.recordSuccess();

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertThat(snapshot.totalFailures()).isEqualTo(1);
        assertThat(snapshot.successCount()).isZero();
        assertThat(snapshot.lastFailureAt()).isEqualTo(clock.instant());
        assertThat(snapshot.lastSuccessAt()).isNull();
    }

    @Test
    void manualTripAndReset() {
        breaker.trip();
        assertThat(breaker.getState()).isEqualTo(State.OPEN);
        assertThat(breaker.snapshot().nextAttemptAt()).isEqualTo(clock.instant().plus(COOLDOWN));

        clock.advance(Duration.ofSeconds(10));
        breaker.trip();
        assertThat(breaker.snapshot().nextAttemptAt()).isEqualTo(clock.instant().plus(COOLDOWN));

        breaker.reset();
        assertThat(breaker.getState()).isEqualTo(State.CLOSED);
        assertThat(breaker.acquirePermission().isTrial()).isFalse();
    }

    @Test
    void managerCreatesOneBreakerPerService() {
        assertThat(manager.breakerFor("employee")).isSameAs(breaker);
        manager.breakerFor("learning");

        assertThat(manager.snapshots()).extracting(CircuitBreakerSnapshot::service)
                .containsExactly("employee", "learning");
        assertThat(manager.registry().getAllCircuitBreakers()).hasSize(2);
        assertThat(manager.reset("unknown")).isFalse();
        assertThat(manager.reset("employee")).isTrue();
    }

    @Test
    void thresholdMustBePositive() {
        assertThatThrownBy(() -> CircuitBreakerManager.breakerConfig(0, 100, COOLDOWN, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void failTimes(int count) {
        for (int i = 0; i < count; i++) {
            breaker.acquirePermission().recordFailure(new IOException("connection refused"));
        }
    }
}
