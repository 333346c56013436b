package com.hrms.gateway.discovery;

import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

/**
 * Exposes the registry's system status on {@code /actuator/health}.
 */
public class RegistryHealthIndicator extends AbstractHealthIndicator {

    private final ServiceRegistry registry;

    public RegistryHealthIndicator(ServiceRegistry registry) {
        this.registry = registry;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        SystemHealth health = registry.systemHealth();
        switch (health.status()) {
            case HEALTHY -> builder.up();
            case DEGRADED -> builder.status("DEGRADED");
            default -> builder.down();
        }
        builder.withDetail("services", health.services())
                .withDetail("healthyServices", health.healthyServices())
                .withDetail("totalInstances", health.totalInstances())
                .withDetail("healthyInstances", health.healthyInstances());
    }
}
