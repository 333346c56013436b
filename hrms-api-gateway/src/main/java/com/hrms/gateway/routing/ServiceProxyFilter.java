package com.hrms.gateway.routing;

/*
 * ============================================================================
 * SERVICE PROXY FILTER - CODE FLOW
 * ============================================================================
 *
 *   REQUEST (after auth + rate limiting, RouteToRequestUrlFilter done)
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Path prefix → logical service    │
 *   └─────────────────────────────────────┘
 *         │ no mapping → 404 UNROUTABLE
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Circuit breaker permission       │
 *   └─────────────────────────────────────┘
 *         │ open → 503 CIRCUIT_OPEN (+ retryAfter)
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. Best healthy instance            │
 *   └─────────────────────────────────────┘
 *         │ none → 503 SERVICE_UNAVAILABLE
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 4. Rewrite URL                      │
 *   │    instance + targetPrefix + rest   │
 *   │    (query string kept)              │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   NETTY ROUTING FILTER (method, headers, body, response timeout)
 *         │
 *         ├── failure status (5xx) / transport error → breaker failure
 *         │       timeout → 504 UPSTREAM_TIMEOUT, refused → 502 UPSTREAM_UNREACHABLE
 *         └── anything else → breaker success
 *
 * ============================================================================
 */

import com.hrms.gateway.circuitbreaker.CircuitBreakerManager;
import com.hrms.gateway.circuitbreaker.ServiceCircuitBreaker;
import com.hrms.gateway.discovery.LoadAwareSelector;
import com.hrms.gateway.discovery.ServiceInstance;
import com.hrms.gateway.exception.ErrorCode;
import com.hrms.gateway.exception.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilter;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.RouteToRequestUrlFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;

import static org.springframework.cloud.gateway.support.ServerWebExchangeUtils.GATEWAY_REQUEST_URL_ATTR;

/**
 * Resolves the upstream instance of every proxied request and reports the
 * outcome of the forwarded call to the service's circuit breaker.
 */
@Slf4j
public class ServiceProxyFilter implements GatewayFilter, Ordered {

    public static final String SERVICE_ATTR = "hrms.service";
    public static final String INSTANCE_ATTR = "hrms.instance";

    private final RouteTable routeTable;
    private final CircuitBreakerManager circuitBreakers;
    private final LoadAwareSelector selector;
    private final Set<Integer> failureStatuses;
    private final Map<String, LongAdder> forwarded = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> failed = new ConcurrentHashMap<>();

    public ServiceProxyFilter(RouteTable routeTable,
                              CircuitBreakerManager circuitBreakers,
                              LoadAwareSelector selector,
                              Collection<Integer> failureStatuses) {
        this.routeTable = routeTable;
        this.circuitBreakers = circuitBreakers;
        this.selector = selector;
        this.failureStatuses = Set.copyOf(failureStatuses);
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        URI requestUri = exchange.getRequest().getURI();
        String path = requestUri.getRawPath();

        // ========== STEP 1: Which service owns this path? ==========
        Optional<RouteMapping> mapping = routeTable.resolve(path);
        if (mapping.isEmpty()) {
            log.warn("No route for {} {}", exchange.getRequest().getMethod(), path);
            return Mono.error(new GatewayException(ErrorCode.UNROUTABLE, "No service is mapped to " + path));
        }
        String service = mapping.get().service();
        exchange.getAttributes().put(SERVICE_ATTR, service);

        // ========== STEP 2: Is the circuit closed? ==========
        ServiceCircuitBreaker.Permission permission;
        try {
            permission = circuitBreakers.breakerFor(service).acquirePermission();
        } catch (GatewayException e) {
            return Mono.error(e);
        }

        // ========== STEP 3: Pick an instance ==========
        Optional<ServiceInstance> instance = selector.getBestInstance(service);
        if (instance.isEmpty()) {
            permission.release();
            return Mono.error(new GatewayException(ErrorCode.SERVICE_UNAVAILABLE,
                    "No healthy instance available for " + service, null, Map.of("service", service)));
        }

        // ========== STEP 4: Rewrite the URL ==========
        URI target = UriComponentsBuilder.fromHttpUrl(instance.get().baseUrl())
                .path(mapping.get().rewrite(path))
                .query(requestUri.getRawQuery())
                .build(true)
                .toUri();
        exchange.getAttributes().put(GATEWAY_REQUEST_URL_ATTR, target);
        exchange.getAttributes().put(INSTANCE_ATTR, instance.get().id());
        log.debug("Routing {} {} -> {} ({})", exchange.getRequest().getMethod(), path, target, instance.get().id());

        counter(forwarded, service).increment();
        String instanceId = instance.get().id();
        selector.requestStarted(service, instanceId);
        long startedAt = System.nanoTime();

        return chain.filter(exchange)
                .doOnSuccess(done -> {
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    if (status != null && failureStatuses.contains(status.value())) {
                        log.warn("{} answered {} for {}", service, status.value(), path);
                        counter(failed, service).increment();
                        permission.recordFailure(
                                new ResponseStatusException(status, service + " answered " + status.value()));
                    } else {
                        permission.recordSuccess();
                    }
                })
                .onErrorResume(ex -> {
                    counter(failed, service).increment();
                    permission.recordFailure(ex);
                    return Mono.error(translate(ex, service));
                })
                .doOnCancel(permission::release)
                .doFinally(signal -> selector.requestFinished(service, instanceId,
                        Duration.ofNanos(System.nanoTime() - startedAt)));
    }

    private GatewayException translate(Throwable ex, String service) {
        if (ex instanceof GatewayException gex) {
            return gex;
        }
        Map<String, Object> details = Map.of("service", service);
        if (isTimeout(ex)) {
            log.warn("Upstream {} timed out: {}", service, ex.getMessage());
            return new GatewayException(ErrorCode.UPSTREAM_TIMEOUT,
                    "Upstream service " + service + " timed out", null, details);
        }
        log.warn("Upstream {} unreachable: {}", service, ex.toString());
        return new GatewayException(ErrorCode.UPSTREAM_UNREACHABLE,
                "Upstream service " + service + " is unreachable", null, details);
    }

    private static boolean isTimeout(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException) {
                return true;
            }
            if (current instanceof ResponseStatusException rse && rse.getStatusCode().value() == 504) {
                return true;
            }
        }
        return false;
    }

    private static LongAdder counter(Map<String, LongAdder> counters, String service) {
        return counters.computeIfAbsent(service, s -> new LongAdder());
    }

    /**
     * Forwarded and failed call counts per logical service.
     */
    public Map<String, Map<String, Long>> requestMetrics() {
        Map<String, Map<String, Long>> metrics = new LinkedHashMap<>();
        forwarded.forEach((service, count) -> metrics.put(service, Map.of(
                "forwarded", count.sum(),
                "failed", failed.containsKey(service) ? failed.get(service).sum() : 0L)));
        return metrics;
    }

    @Override
    public int getOrder() {
        return RouteToRequestUrlFilter.ROUTE_TO_URL_FILTER_ORDER + 1;
    }
}
