package com.hrms.gateway.discovery;

/**
 * How {@link LoadAwareSelector} chooses among the healthy instances of a service.
 */
public enum LoadBalancingStrategy {

    /** Lowest probe latency, ties to the earliest check, then to the id. */
    LOWEST_LOAD,

    /** Healthy instances in registration order, one after another. */
    ROUND_ROBIN,

    /** Fewest requests currently in flight through this gateway. */
    LEAST_CONNECTIONS,

    /** Lowest average response time of proxied requests; probe latency until one was seen. */
    FASTEST_RESPONSE,

    RANDOM
}
