package com.hrms.gateway.discovery;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Picks the instance a request is forwarded to.
 *
 * Only healthy instances are eligible. If none is healthy the result is empty
 * and the caller must treat the service as down; an unhealthy instance is never
 * used as a fallback. Which healthy instance wins depends on the configured
 * {@link LoadBalancingStrategy}.
 *
 * Callers report forwarded requests through {@link #requestStarted} and
 * {@link #requestFinished}; the in-flight count and response times feed
 * {@link LoadBalancingStrategy#LEAST_CONNECTIONS} and
 * {@link LoadBalancingStrategy#FASTEST_RESPONSE}.
 */
@Slf4j
public class LoadAwareSelector {

    private static final Comparator<ServiceInstance> LOWEST_LOAD_FIRST = Comparator
            .comparingLong(ServiceInstance::loadScore)
            .thenComparing(ServiceInstance::lastCheckedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(ServiceInstance::id);

    /** Weight of the newest sample in the response time average. */
    static final double RESPONSE_TIME_WEIGHT = 0.3;

    private final ServiceRegistry registry;
    private final LoadBalancingStrategy strategy;
    private final Random random;
    private final Map<String, AtomicInteger> roundRobinCursors = new ConcurrentHashMap<>();
    private final Map<String, InstanceTraffic> traffic = new ConcurrentHashMap<>();

    public LoadAwareSelector(ServiceRegistry registry) {
        this(registry, LoadBalancingStrategy.LOWEST_LOAD, new Random());
    }

    public LoadAwareSelector(ServiceRegistry registry, LoadBalancingStrategy strategy, Random random) {
        this.registry = registry;
        this.strategy = strategy;
        this.random = random;
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }

    public Optional<ServiceInstance> getBestInstance(String service) {
        List<ServiceInstance> healthy = registry.listInstances(service).stream()
                .filter(ServiceInstance::healthy)
                .toList();
        if (healthy.isEmpty()) {
            log.warn("No healthy instances available for {}", service);
            return Optional.empty();
        }
        return Optional.of(select(service, healthy));
    }

    private ServiceInstance select(String service, List<ServiceInstance> healthy) {
        switch (strategy) {
            case ROUND_ROBIN:
                int next = roundRobinCursors.computeIfAbsent(service, s -> new AtomicInteger()).getAndIncrement();
                return healthy.get(Math.floorMod(next, healthy.size()));
            case LEAST_CONNECTIONS:
                return healthy.stream()
                        .min(Comparator.<ServiceInstance>comparingInt(i -> trafficOf(service, i).inFlight.get())
                                .thenComparing(LOWEST_LOAD_FIRST))
                        .orElseThrow();
            case FASTEST_RESPONSE:
                return healthy.stream()
                        .min(Comparator.<ServiceInstance>comparingDouble(i -> responseTimeOf(service, i))
                                .thenComparing(LOWEST_LOAD_FIRST))
                        .orElseThrow();
            case RANDOM:
                return healthy.get(random.nextInt(healthy.size()));
            case LOWEST_LOAD:
            default:
                return healthy.stream().min(LOWEST_LOAD_FIRST).orElseThrow();
        }
    }

    public void requestStarted(String service, String instanceId) {
        traffic(service, instanceId).inFlight.incrementAndGet();
    }

    public void requestFinished(String service, String instanceId, Duration elapsed) {
        InstanceTraffic stats = traffic(service, instanceId);
        stats.inFlight.updateAndGet(n -> Math.max(0, n - 1));
        stats.record(elapsed.toMillis());
    }

    public int inFlight(String service, String instanceId) {
        InstanceTraffic stats = traffic.get(key(service, instanceId));
        return stats == null ? 0 : stats.inFlight.get();
    }

    private double responseTimeOf(String service, ServiceInstance instance) {
        InstanceTraffic stats = traffic.get(key(service, instance.id()));
        if (stats != null && stats.hasSamples()) {
            return stats.averageMillis();
        }
        return instance.loadMeasured() ? instance.loadScore() : Double.MAX_VALUE;
    }

    private InstanceTraffic trafficOf(String service, ServiceInstance instance) {
        return traffic(service, instance.id());
    }

    private InstanceTraffic traffic(String service, String instanceId) {
        return traffic.computeIfAbsent(key(service, instanceId), k -> new InstanceTraffic());
    }

    private static String key(String service, String instanceId) {
        return service + "/" + instanceId;
    }

    private static final class InstanceTraffic {
        private final AtomicInteger inFlight = new AtomicInteger();
        private double averageMillis = -1;

        synchronized void record(long millis) {
            averageMillis = averageMillis < 0
                    ? millis
                    : RESPONSE_TIME_WEIGHT * millis + (1 - RESPONSE_TIME_WEIGHT) * averageMillis;
        }

        synchronized boolean hasSamples() {
            return averageMillis >= 0;
        }

        synchronized double averageMillis() {
            return averageMillis;
        }
    }
}
