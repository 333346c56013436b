package com.hrms.gateway.routing;

import com.hrms.gateway.MutableClock;
import com.hrms.gateway.circuitbreaker.CircuitBreakerManager;
import com.hrms.gateway.discovery.LoadAwareSelector;
import com.hrms.gateway.discovery.LoadBalancingStrategy;
import com.hrms.gateway.discovery.ServiceRegistry;
import com.hrms.gateway.exception.ErrorCode;
import com.hrms.gateway.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.cloud.gateway.support.ServerWebExchangeUtils.GATEWAY_REQUEST_URL_ATTR;

class ServiceProxyFilterTest {

    private MutableClock clock;
    private ServiceRegistry registry;
    private CircuitBreakerManager circuitBreakers;
    private ServiceProxyFilter filter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        registry = new ServiceRegistry(clock);
        circuitBreakers = new CircuitBreakerManager(2, 100, Duration.ofSeconds(30), clock);
        RouteTable routeTable = new RouteTable(List.of(
                new RouteMapping("/api/v1/employees", "employee", "/api/employees")));
        filter = new ServiceProxyFilter(routeTable, circuitBreakers, new LoadAwareSelector(registry),
                List.of(500, 502, 503, 504));

        registry.register("employee", "e1", "http://employee-1:3001");
        registry.recordProbe("employee", "e1", true, 40);
        registry.register("employee", "e2", "http://employee-2:3001");
        registry.recordProbe("employee", "e2", true, 15);
    }

    private static MockServerWebExchange exchange(String uri) {
        return MockServerWebExchange.from(MockServerHttpRequest.get(uri));
    }

    private static GatewayFilterChain respondingWith(HttpStatus status) {
        return exchange -> {
            exchange.getResponse().setStatusCode(status);
            return Mono.empty();
        };
    }

    @Test
    @DisplayName("Request is sent to the least loaded instance with the prefix rewritten and query kept")
    void rewritesToBestInstance() {
        MockServerWebExchange exchange = exchange("/api/v1/employees/7?expand=manager&page=2");

        StepVerifier.create(filter.filter(exchange, respondingWith(HttpStatus.OK))).verifyComplete();

        URI target = exchange.getAttribute(GATEWAY_REQUEST_URL_ATTR);
        assertThat(target).hasToString("http://employee-2:3001/api/employees/7?expand=manager&page=2");
        assertThat((String) exchange.getAttribute(ServiceProxyFilter.SERVICE_ATTR)).isEqualTo("employee");
        assertThat((String) exchange.getAttribute(ServiceProxyFilter.INSTANCE_ATTR)).isEqualTo("e2");
        assertThat(filter.requestMetrics().get("employee")).containsEntry("forwarded", 1L).containsEntry("failed", 0L);
    }

    @Test
    @DisplayName("Requests still in flight steer least-connections balancing and are released on cancel")
    void inFlightRequestsAreTrackedPerInstance() {
        LoadAwareSelector leastConnections =
                new LoadAwareSelector(registry, LoadBalancingStrategy.LEAST_CONNECTIONS, new Random());
        ServiceProxyFilter balanced = new ServiceProxyFilter(
                new RouteTable(List.of(new RouteMapping("/api/v1/employees", "employee", "/api/employees"))),
                circuitBreakers, leastConnections, List.of(500, 502, 503, 504));

        MockServerWebExchange slow = exchange("/api/v1/employees");
        Disposable pending = balanced.filter(slow, exchange -> Mono.never()).subscribe();
        assertThat((String) slow.getAttribute(ServiceProxyFilter.INSTANCE_ATTR)).isEqualTo("e2");
        assertThat(leastConnections.inFlight("employee", "e2")).isEqualTo(1);

        MockServerWebExchange next = exchange("/api/v1/employees");
        StepVerifier.create(balanced.filter(next, respondingWith(HttpStatus.OK))).verifyComplete();
        assertThat((String) next.getAttribute(ServiceProxyFilter.INSTANCE_ATTR)).isEqualTo("e1");

        pending.dispose();
        assertThat(leastConnections.inFlight("employee", "e2")).isZero();
        assertThat(leastConnections.inFlight("employee", "e1")).isZero();
    }

    @Test
    void unmappedPathIsUnroutable() {
        StepVerifier.create(filter.filter(exchange("/api/v1/unknown"), respondingWith(HttpStatus.OK)))
                .expectErrorSatisfies(e -> assertThat(((GatewayException) e).getErrorCode())
                        .isEqualTo(ErrorCode.UNROUTABLE))
                .verify();
    }

    @Test
    void openCircuitFailsFastWithoutCallingUpstream() {
        circuitBreakers.breakerFor("employee").trip();
        GatewayFilterChain chain = exchange -> {
            throw new AssertionError("upstream must not be called");
        };

        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), chain))
                .expectErrorSatisfies(e -> {
                    GatewayException gex = (GatewayException) e;
                    assertThat(gex.getErrorCode()).isEqualTo(ErrorCode.CIRCUIT_OPEN);
                    assertThat(gex.getRetryAfter()).isEqualTo(Duration.ofSeconds(30));
                })
                .verify();
    }

    @Test
    @DisplayName("With no healthy instance the half-open trial slot is given back")
    void noInstanceReleasesPermission() {
        circuitBreakers.breakerFor("employee").trip();
        clock.advance(Duration.ofSeconds(31));
        registry.markUnhealthy("employee", "e1");
        registry.markUnhealthy("employee", "e2");

        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), respondingWith(HttpStatus.OK)))
                .expectErrorSatisfies(e -> assertThat(((GatewayException) e).getErrorCode())
                        .isEqualTo(ErrorCode.SERVICE_UNAVAILABLE))
                .verify();

        assertThat(circuitBreakers.breakerFor("employee").acquirePermission().isTrial()).isTrue();
    }

    @Test
    void failureStatusesCountAgainstTheBreaker() {
        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), respondingWith(HttpStatus.SERVICE_UNAVAILABLE)))
                .verifyComplete();
        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), respondingWith(HttpStatus.NOT_FOUND)))
                .verifyComplete();
        assertThat(circuitBreakers.breakerFor("employee").getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), respondingWith(HttpStatus.BAD_GATEWAY)))
                .verifyComplete();
        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), respondingWith(HttpStatus.GATEWAY_TIMEOUT)))
                .verifyComplete();

        assertThat(circuitBreakers.breakerFor("employee").getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(filter.requestMetrics().get("employee")).containsEntry("forwarded", 4L).containsEntry("failed", 3L);
    }

    @Test
    void timeoutBecomesGatewayTimeout() {
        GatewayFilterChain chain = exchange -> Mono.error(new TimeoutException("Response took longer than 30s"));

        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), chain))
                .expectErrorSatisfies(e -> {
                    GatewayException gex = (GatewayException) e;
                    assertThat(gex.getErrorCode()).isEqualTo(ErrorCode.UPSTREAM_TIMEOUT);
                    assertThat(gex.getDetails()).containsEntry("service", "employee");
                })
                .verify();
    }

    @Test
    void connectionFailureBecomesBadGateway() {
        GatewayFilterChain chain = exchange -> Mono.error(new ConnectException("Connection refused"));

        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), chain))
                .expectErrorSatisfies(e -> assertThat(((GatewayException) e).getErrorCode())
                        .isEqualTo(ErrorCode.UPSTREAM_UNREACHABLE))
                .verify();
        StepVerifier.create(filter.filter(exchange("/api/v1/employees"), chain))
                .expectError(GatewayException.class)
                .verify();

        assertThat(circuitBreakers.breakerFor("employee").getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }
}
