package com.hrms.gateway.discovery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/*
 * ============================================================================
 * SERVICE HEALTH MONITOR - CODE FLOW
 * ============================================================================
 *
 *   every health.interval (and on POST /admin/services/refresh)
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ for each service, each instance     │
 *   │   GET baseUrl + healthPath          │
 *   │   (bounded by health.timeout)       │
 *   └─────────────────────────────────────┘
 *         │
 *         ├── status < 400 → recordProbe(healthy, loadScore = latency ms)
 *         └── status ≥ 400, timeout, refused → recordProbe(unhealthy)
 *
 * Instances are never evicted here, only marked.
 * ============================================================================
 */

/**
 * Periodic health prober feeding the {@link ServiceRegistry}.
 */
@Slf4j
public class ServiceHealthMonitor {

    private final ServiceRegistry registry;
    private final WebClient webClient;
    private final Duration probeTimeout;

    public ServiceHealthMonitor(ServiceRegistry registry, WebClient webClient, Duration probeTimeout) {
        this.registry = registry;
        this.webClient = webClient;
        this.probeTimeout = probeTimeout;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${hrms.gateway.health.interval:PT30S}")
    public void scheduledProbe() {
        probeAll().block();
    }

    /**
     * Runs one probe round over every registered instance and completes when all
     * probes have been recorded.
     */
    public Mono<Void> probeAll() {
        return Flux.fromIterable(registry.serviceNames())
                .flatMap(service -> Flux.fromIterable(registry.listInstances(service))
                        .flatMap(instance -> probe(service, instance)))
                .then()
                .doOnSuccess(done -> log.debug("Health probe round finished"));
    }

    Mono<Void> probe(String service, ServiceInstance instance) {
        String url = instance.baseUrl() + registry.healthPath(service);
        long startedAt = System.nanoTime();

        return webClient.get()
                .uri(url)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().value()))
                .timeout(probeTimeout)
                .map(status -> {
                    long latency = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
                    boolean healthy = status < 400;
                    registry.recordProbe(service, instance.id(), healthy, latency);
                    if (healthy) {
                        log.debug("Probe {} -> {} in {}ms", url, status, latency);
                    } else {
                        log.warn("Probe {} returned status {}", url, status);
                    }
                    return healthy;
                })
                .onErrorResume(e -> {
                    log.warn("Probe {} failed: {}", url, e.toString());
                    registry.recordProbe(service, instance.id(), false, 0);
                    return Mono.just(false);
                })
                .then();
    }
}
