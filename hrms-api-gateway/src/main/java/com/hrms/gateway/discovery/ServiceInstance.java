package com.hrms.gateway.discovery;

import java.time.Instant;

/**
 * Snapshot of one running instance of a logical service.
 *
 * Immutable: the registry replaces the record on every change, so a copy handed
 * out to a caller never changes underneath it.
 *
 * @param loadScore last probe latency in milliseconds, lower is better
 */
public record ServiceInstance(
        String id,
        String baseUrl,
        boolean healthy,
        Instant lastCheckedAt,
        long loadScore,
        int consecutiveFailures
) {

    /** Load score of an instance no probe has measured yet; sorts after every measured one. */
    public static final long UNMEASURED_LOAD = Long.MAX_VALUE;

    public static ServiceInstance unchecked(String id, String baseUrl) {
        return new ServiceInstance(id, stripTrailingSlash(baseUrl), false, null, UNMEASURED_LOAD, 0);
    }

    public boolean loadMeasured() {
        return loadScore != UNMEASURED_LOAD;
    }

    public ServiceInstance withProbeSuccess(Instant checkedAt, long latencyMillis) {
        return new ServiceInstance(id, baseUrl, true, checkedAt, latencyMillis, 0);
    }

    public ServiceInstance withProbeFailure(Instant checkedAt) {
        return new ServiceInstance(id, baseUrl, false, checkedAt, loadScore, consecutiveFailures + 1);
    }

    public ServiceInstance withHealthy(boolean healthy, Instant checkedAt) {
        return new ServiceInstance(id, baseUrl, healthy, checkedAt, loadScore,
                healthy ? 0 : consecutiveFailures);
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
