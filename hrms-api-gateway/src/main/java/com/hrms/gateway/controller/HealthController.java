package com.hrms.gateway.controller;

import com.hrms.gateway.circuitbreaker.CircuitBreakerManager;
import com.hrms.gateway.circuitbreaker.CircuitBreakerSnapshot;
import com.hrms.gateway.discovery.ServiceHealthMonitor;
import com.hrms.gateway.discovery.ServiceHealthSummary;
import com.hrms.gateway.discovery.ServiceRegistry;
import com.hrms.gateway.discovery.SystemHealth;
import com.hrms.gateway.discovery.SystemStatus;
import com.hrms.gateway.exception.ErrorCode;
import com.hrms.gateway.exception.GatewayException;
import com.hrms.gateway.ratelimit.AdaptiveRateLimiter;
import com.hrms.gateway.routing.ServiceProxyFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Gateway health summary and admin operations on the resilience layer.
 *
 * Responses use the same {@code {data, errors}} envelope as gateway errors.
 */
@Slf4j
@RestController
public class HealthController {

    public static final String ADMIN_PATH = "/admin";

    private final ServiceRegistry registry;
    private final ServiceHealthMonitor healthMonitor;
    private final CircuitBreakerManager circuitBreakers;
    private final AdaptiveRateLimiter rateLimiter;
    private final ServiceProxyFilter proxyFilter;

    public HealthController(ServiceRegistry registry,
                            ServiceHealthMonitor healthMonitor,
                            CircuitBreakerManager circuitBreakers,
                            AdaptiveRateLimiter rateLimiter,
                            ServiceProxyFilter proxyFilter) {
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.circuitBreakers = circuitBreakers;
        this.rateLimiter = rateLimiter;
        this.proxyFilter = proxyFilter;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        SystemHealth system = registry.systemHealth();

        Map<String, Object> systemHealth = new LinkedHashMap<>();
        systemHealth.put("status", system.status().name().toLowerCase(Locale.ROOT));
        systemHealth.put("services", system.services());
        systemHealth.put("healthyServices", system.healthyServices());
        systemHealth.put("totalInstances", system.totalInstances());
        systemHealth.put("healthyInstances", system.healthyInstances());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", system.status() == SystemStatus.HEALTHY ? "healthy" : "unhealthy");
        body.put("timestamp", Instant.now().toString());
        body.put("service", "api-gateway");
        body.put("systemHealth", systemHealth);
        body.put("services", servicesByName(system.details()));

        HttpStatus status = system.status() == SystemStatus.HEALTHY ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return Mono.just(ResponseEntity.status(status).body(envelope(body)));
    }

    @GetMapping(ADMIN_PATH + "/services")
    public Mono<Map<String, Object>> services() {
        return Mono.just(envelope(Map.of(
                "services", servicesByName(registry.healthSummary()),
                "requests", proxyFilter.requestMetrics())));
    }

    @PostMapping(ADMIN_PATH + "/services/refresh")
    public Mono<Map<String, Object>> refreshServices() {
        log.info("Forced health probe round requested");
        return healthMonitor.probeAll()
                .then(Mono.fromSupplier(() -> envelope(Map.of(
                        "services", servicesByName(registry.healthSummary())))));
    }

    @GetMapping(ADMIN_PATH + "/circuit-breakers")
    public Mono<Map<String, Object>> circuitBreakers() {
        List<CircuitBreakerSnapshot> snapshots = circuitBreakers.snapshots();
        return Mono.just(envelope(Map.of("circuitBreakers", snapshots)));
    }

    @PostMapping(ADMIN_PATH + "/circuit-breakers/{service}/reset")
    public Mono<Map<String, Object>> resetCircuitBreaker(@PathVariable String service) {
        if (!circuitBreakers.reset(service)) {
            return Mono.error(new GatewayException(ErrorCode.UNROUTABLE, "No circuit breaker for " + service));
        }
        return Mono.just(envelope(circuitBreakers.breakerFor(service).snapshot()));
    }

    @PostMapping(ADMIN_PATH + "/circuit-breakers/{service}/trip")
    public Mono<Map<String, Object>> tripCircuitBreaker(@PathVariable String service) {
        if (circuitBreakers.find(service).isEmpty() && !registry.serviceNames().contains(service)) {
            return Mono.error(new GatewayException(ErrorCode.UNROUTABLE, "Unknown service " + service));
        }
        circuitBreakers.breakerFor(service).trip();
        return Mono.just(envelope(circuitBreakers.breakerFor(service).snapshot()));
    }

    @GetMapping(ADMIN_PATH + "/rate-limits")
    public Mono<Map<String, Object>> rateLimits() {
        return Mono.just(envelope(rateLimitStatus()));
    }

    @PutMapping(ADMIN_PATH + "/rate-limits/load")
    public Mono<Map<String, Object>> updateLoad(@RequestBody LoadSample sample) {
        if (sample == null || sample.load() == null || sample.load().isNaN()) {
            return Mono.error(new GatewayException(ErrorCode.INVALID_REQUEST, "Body must contain a numeric 'load'"));
        }
        rateLimiter.updateSystemLoad(sample.load());
        return Mono.just(envelope(rateLimitStatus()));
    }

    private Map<String, Object> rateLimitStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("systemLoad", rateLimiter.getSystemLoad());
        status.put("loadFactor", rateLimiter.getLoadFactor());
        status.put("activeWindows", rateLimiter.activeWindows());
        status.put("categories", rateLimiter.metrics());
        return status;
    }

    private static Map<String, ServiceHealthSummary> servicesByName(List<ServiceHealthSummary> summaries) {
        Map<String, ServiceHealthSummary> byName = new LinkedHashMap<>();
        summaries.forEach(summary -> byName.put(summary.service(), summary));
        return byName;
    }

    private static Map<String, Object> envelope(Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("data", data);
        body.put("errors", List.of());
        return body;
    }

    public record LoadSample(Double load) {
    }
}
