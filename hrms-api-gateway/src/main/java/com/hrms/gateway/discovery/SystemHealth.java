package com.hrms.gateway.discovery;

import java.util.List;

/**
 * Registry-wide health, aggregated over every instance of every service.
 */
public record SystemHealth(
        SystemStatus status,
        int services,
        int healthyServices,
        int totalInstances,
        int healthyInstances,
        List<ServiceHealthSummary> details
) {
}
