package com.hrms.gateway.discovery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.client.discovery.DiscoveryClient;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mirrors the instances known to the discovery client (Eureka) into the
 * {@link ServiceRegistry}. Only instances this registrar added are removed when
 * they disappear from discovery; statically configured instances are left alone.
 */
@Slf4j
public class DiscoveryClientRegistrar {

    private final DiscoveryClient discoveryClient;
    private final ServiceRegistry registry;
    private final Map<String, Set<String>> mirrored = new HashMap<>();

    public DiscoveryClientRegistrar(DiscoveryClient discoveryClient, ServiceRegistry registry) {
        this.discoveryClient = discoveryClient;
        this.registry = registry;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${hrms.gateway.discovery.interval:PT30S}")
    public synchronized void sync() {
        Map<String, Set<String>> seen = new HashMap<>();
        try {
            for (String serviceId : discoveryClient.getServices()) {
                String service = serviceId.toLowerCase(Locale.ROOT);
                discoveryClient.getInstances(serviceId).forEach(instance -> {
                    String instanceId = instance.getInstanceId() != null
                            ? instance.getInstanceId()
                            : instance.getHost() + ":" + instance.getPort();
                    registry.register(service, instanceId, instance.getUri().toString());
                    seen.computeIfAbsent(service, s -> new HashSet<>()).add(instanceId);
                });
            }
        } catch (RuntimeException e) {
            log.warn("Discovery sync failed, keeping current registry: {}", e.getMessage());
            return;
        }

        mirrored.forEach((service, previous) -> previous.stream()
                .filter(id -> !seen.getOrDefault(service, Set.of()).contains(id))
                .forEach(id -> registry.deregister(service, id)));
        mirrored.clear();
        mirrored.putAll(seen);
        log.debug("Discovery sync mirrored {} services", seen.size());
    }
}
