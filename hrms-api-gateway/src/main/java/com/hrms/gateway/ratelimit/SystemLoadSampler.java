package com.hrms.gateway.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Feeds the rate limiter with the OS load average divided by the number of
 * processors. Platforms without a load average are skipped.
 */
@Slf4j
public class SystemLoadSampler {

    private final AdaptiveRateLimiter rateLimiter;
    private final OperatingSystemMXBean os;

    public SystemLoadSampler(AdaptiveRateLimiter rateLimiter) {
        this(rateLimiter, ManagementFactory.getOperatingSystemMXBean());
    }

    SystemLoadSampler(AdaptiveRateLimiter rateLimiter, OperatingSystemMXBean os) {
        this.rateLimiter = rateLimiter;
        this.os = os;
    }

    @Scheduled(fixedDelayString = "${hrms.gateway.rate-limiting.load-sampling.interval:PT15S}")
    public void sample() {
        double loadAverage = os.getSystemLoadAverage();
        if (loadAverage < 0) {
            log.debug("System load average not available on this platform");
            return;
        }
        rateLimiter.updateSystemLoad(loadAverage / Math.max(1, os.getAvailableProcessors()));
    }
}
