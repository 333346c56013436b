package com.hrms.gateway.config;

import com.hrms.gateway.discovery.LoadBalancingStrategy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway settings bound from {@code hrms.gateway.*} in application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "hrms.gateway")
public class GatewayProperties {

    /** Static path-prefix mapping table, first match by longest prefix. */
    private List<Route> routes = new ArrayList<>();

    /** Statically known instances per logical service. */
    private Map<String, Service> services = new LinkedHashMap<>();

    private Health health = new Health();
    private Discovery discovery = new Discovery();
    private LoadBalancing loadBalancing = new LoadBalancing();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private RateLimiting rateLimiting = new RateLimiting();
    private Proxy proxy = new Proxy();
    private Security security = new Security();

    @Getter
    @Setter
    public static class Route {
        /** Inbound path prefix, e.g. {@code /api/v1/employees}. */
        private String prefix;
        private String service;
        /** Prefix prepended to the stripped path on the upstream side. */
        private String targetPrefix = "";
    }

    @Getter
    @Setter
    public static class Service {
        private List<Instance> instances = new ArrayList<>();
        private String healthPath = "/health";
    }

    @Getter
    @Setter
    public static class Instance {
        private String id;
        private String url;
    }

    @Getter
    @Setter
    public static class Health {
        private Duration interval = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Discovery {
        /** Mirror discovery-client instances into the registry. */
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class LoadBalancing {
        /** lowest-load, round-robin, least-connections, fastest-response or random. */
        private LoadBalancingStrategy strategy = LoadBalancingStrategy.LOWEST_LOAD;
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(30);
        /** Percentage of the last {@code failureThreshold} calls that must fail to open the breaker. */
        private float failureRateThreshold = 100;
        /** Upstream statuses counted as failures. */
        private List<Integer> failureStatuses = new ArrayList<>(List.of(500, 502, 503, 504));
    }

    @Getter
    @Setter
    public static class RateLimiting {
        private boolean enabled = true;
        private Map<String, Window> categories = new LinkedHashMap<>();
        private List<CustomWindow> custom = new ArrayList<>();
        /** Paths never rate limited. */
        private List<String> skipPaths = new ArrayList<>(List.of("/health", "/actuator/**", "/metrics"));
        private Duration idleEviction = Duration.ofMinutes(30);
        private LoadSampling loadSampling = new LoadSampling();
    }

    @Getter
    @Setter
    public static class Window {
        private Duration window = Duration.ofMinutes(15);
        private int maxRequests = 100;
    }

    @Getter
    @Setter
    public static class CustomWindow extends Window {
        private String name;
        private String pathPattern;
    }

    @Getter
    @Setter
    public static class LoadSampling {
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(15);
    }

    @Getter
    @Setter
    public static class Proxy {
        private Duration responseTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Security {
        private List<String> publicEndpoints = new ArrayList<>();
        private List<String> adminEndpoints = new ArrayList<>(List.of("/admin/**"));
    }
}
