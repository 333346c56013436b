package com.hrms.gateway.discovery;

public enum SystemStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    static SystemStatus fromRatio(double healthyRatio) {
        if (healthyRatio >= 0.8) {
            return HEALTHY;
        }
        if (healthyRatio >= 0.5) {
            return DEGRADED;
        }
        return UNHEALTHY;
    }
}
