package com.hrms.gateway.discovery;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * In-memory registry of service instances.
 *
 * Health is advisory: a failed probe marks an instance unhealthy but never
 * evicts it, so it can recover without re-registration. Nothing is persisted.
 */
@Slf4j
public class ServiceRegistry {

    private final Map<String, Map<String, ServiceInstance>> services = new LinkedHashMap<>();
    private final Map<String, String> healthPaths = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public ServiceRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Adds an instance or replaces the address of an existing one. New instances
     * start unhealthy until their first successful probe.
     */
    public void register(String service, String instanceId, String baseUrl) {
        lock.writeLock().lock();
        try {
            Map<String, ServiceInstance> instances = services.computeIfAbsent(service, s -> new LinkedHashMap<>());
            ServiceInstance existing = instances.get(instanceId);
            if (existing != null && existing.baseUrl().equals(ServiceInstance.unchecked(instanceId, baseUrl).baseUrl())) {
                return;
            }
            instances.put(instanceId, ServiceInstance.unchecked(instanceId, baseUrl));
            log.info("Registered {} instance {} at {}", service, instanceId, baseUrl);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setHealthPath(String service, String healthPath) {
        lock.writeLock().lock();
        try {
            healthPaths.put(service, healthPath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String healthPath(String service) {
        lock.readLock().lock();
        try {
            return healthPaths.getOrDefault(service, "/health");
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean deregister(String service, String instanceId) {
        lock.writeLock().lock();
        try {
            Map<String, ServiceInstance> instances = services.get(service);
            if (instances == null || instances.remove(instanceId) == null) {
                return false;
            }
            log.info("Deregistered {} instance {}", service, instanceId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void markHealthy(String service, String instanceId) {
        update(service, instanceId, instance -> instance.withHealthy(true, clock.instant()));
    }

    public void markUnhealthy(String service, String instanceId) {
        update(service, instanceId, instance -> instance.withHealthy(false, clock.instant()));
    }

    /**
     * Records the outcome of one health probe.
     *
     * @param latencyMillis probe latency, used as the load score on success
     */
    public void recordProbe(String service, String instanceId, boolean healthy, long latencyMillis) {
        update(service, instanceId, instance -> healthy
                ? instance.withProbeSuccess(clock.instant(), latencyMillis)
                : instance.withProbeFailure(clock.instant()));
    }

    private void update(String service, String instanceId, UnaryOperator<ServiceInstance> change) {
        ServiceInstance before;
        ServiceInstance after;
        lock.writeLock().lock();
        try {
            Map<String, ServiceInstance> instances = services.get(service);
            before = instances == null ? null : instances.get(instanceId);
            if (before == null) {
                log.debug("Ignoring health update for unknown instance {}/{}", service, instanceId);
                return;
            }
            after = change.apply(before);
            instances.put(instanceId, after);
        } finally {
            lock.writeLock().unlock();
        }

        if (!before.healthy() && after.healthy()) {
            log.info("Instance {}/{} became healthy", service, instanceId);
        } else if (before.healthy() && !after.healthy()) {
            log.warn("Instance {}/{} became unhealthy", service, instanceId);
        }
    }

    public List<ServiceInstance> listInstances(String service) {
        lock.readLock().lock();
        try {
            Map<String, ServiceInstance> instances = services.get(service);
            return instances == null ? List.of() : List.copyOf(instances.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ServiceInstance> findInstance(String service, String instanceId) {
        lock.readLock().lock();
        try {
            Map<String, ServiceInstance> instances = services.get(service);
            return Optional.ofNullable(instances == null ? null : instances.get(instanceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> serviceNames() {
        lock.readLock().lock();
        try {
            return Set.copyOf(services.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ServiceHealthSummary> healthSummary() {
        Map<String, List<ServiceInstance>> snapshot = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            services.forEach((service, instances) -> snapshot.put(service, List.copyOf(instances.values())));
        } finally {
            lock.readLock().unlock();
        }

        List<ServiceHealthSummary> summaries = new ArrayList<>();
        snapshot.forEach((service, instances) -> {
            int total = instances.size();
            int healthy = (int) instances.stream().filter(ServiceInstance::healthy).count();
            // instances marked healthy by hand keep the unmeasured score out of the average
            double avgLoad = instances.stream()
                    .filter(ServiceInstance::healthy)
                    .filter(ServiceInstance::loadMeasured)
                    .mapToDouble(ServiceInstance::loadScore)
                    .average()
                    .orElse(0);
            summaries.add(new ServiceHealthSummary(service, total, healthy, total - healthy,
                    total > 0 ? (double) healthy / total : 0, avgLoad, instances));
        });
        return summaries;
    }

    public SystemHealth systemHealth() {
        List<ServiceHealthSummary> summaries = healthSummary();
        int totalInstances = summaries.stream().mapToInt(ServiceHealthSummary::total).sum();
        int healthyInstances = summaries.stream().mapToInt(ServiceHealthSummary::healthy).sum();
        int healthyServices = (int) summaries.stream().filter(s -> s.healthy() > 0).count();
        double ratio = totalInstances > 0 ? (double) healthyInstances / totalInstances : 0;

        return new SystemHealth(SystemStatus.fromRatio(ratio), summaries.size(), healthyServices,
                totalInstances, healthyInstances, summaries);
    }
}
