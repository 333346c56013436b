package com.hrms.gateway.discovery;

import java.util.List;

/**
 * Per-service health breakdown reported by the health endpoints.
 */
public record ServiceHealthSummary(
        String service,
        int total,
        int healthy,
        int unhealthy,
        double healthRatio,
        double avgLoadScore,
        List<ServiceInstance> instances
) {
}
