package com.hrms.gateway.config;

import com.hrms.gateway.circuitbreaker.CircuitBreakerManager;
import com.hrms.gateway.discovery.DiscoveryClientRegistrar;
import com.hrms.gateway.discovery.LoadAwareSelector;
import com.hrms.gateway.discovery.LoadBalancingStrategy;
import com.hrms.gateway.discovery.RegistryHealthIndicator;
import com.hrms.gateway.discovery.ServiceHealthMonitor;
import com.hrms.gateway.discovery.ServiceRegistry;
import com.hrms.gateway.exception.ErrorCode;
import com.hrms.gateway.ratelimit.AdaptiveRateLimiter;
import com.hrms.gateway.ratelimit.RateLimitPolicy;
import com.hrms.gateway.ratelimit.SystemLoadSampler;
import com.hrms.gateway.routing.RouteMapping;
import com.hrms.gateway.routing.RouteTable;
import com.hrms.gateway.routing.ServiceProxyFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.client.discovery.DiscoveryClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Composition root of the resilience layer: registry, selector, circuit
 * breakers, rate limiter and router are plain objects wired here, one instance
 * each per gateway process.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class ResilienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== DISCOVERY ====================

    @Bean
    public ServiceRegistry serviceRegistry(GatewayProperties properties, Clock clock) {
        ServiceRegistry registry = new ServiceRegistry(clock);
        properties.getServices().forEach((service, settings) -> {
            registry.setHealthPath(service, settings.getHealthPath());
            for (int i = 0; i < settings.getInstances().size(); i++) {
                GatewayProperties.Instance instance = settings.getInstances().get(i);
                String id = instance.getId() != null ? instance.getId() : service + "-" + (i + 1);
                registry.register(service, id, instance.getUrl());
            }
        });
        log.info("Service registry seeded with {} services", properties.getServices().size());
        return registry;
    }

    @Bean
    public LoadAwareSelector loadAwareSelector(ServiceRegistry serviceRegistry, GatewayProperties properties) {
        LoadBalancingStrategy strategy = properties.getLoadBalancing().getStrategy();
        log.info("Load balancing strategy: {}", strategy);
        return new LoadAwareSelector(serviceRegistry, strategy, new Random());
    }

    @Bean
    public ServiceHealthMonitor serviceHealthMonitor(ServiceRegistry serviceRegistry,
                                                     WebClient.Builder webClientBuilder,
                                                     GatewayProperties properties) {
        return new ServiceHealthMonitor(serviceRegistry, webClientBuilder.build(),
                properties.getHealth().getTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "hrms.gateway.discovery", name = "enabled", havingValue = "true")
    public DiscoveryClientRegistrar discoveryClientRegistrar(DiscoveryClient discoveryClient,
                                                             ServiceRegistry serviceRegistry) {
        return new DiscoveryClientRegistrar(discoveryClient, serviceRegistry);
    }

    @Bean
    public RegistryHealthIndicator registryHealthIndicator(ServiceRegistry serviceRegistry) {
        return new RegistryHealthIndicator(serviceRegistry);
    }

    // ==================== CIRCUIT BREAKERS ====================

    @Bean
    public CircuitBreakerManager circuitBreakerManager(GatewayProperties properties, Clock clock) {
        GatewayProperties.CircuitBreaker settings = properties.getCircuitBreaker();
        return new CircuitBreakerManager(settings.getFailureThreshold(), settings.getFailureRateThreshold(),
                settings.getCooldown(), clock);
    }

    // ==================== RATE LIMITING ====================

    @Bean
    public AdaptiveRateLimiter adaptiveRateLimiter(GatewayProperties properties, Clock clock) {
        GatewayProperties.RateLimiting settings = properties.getRateLimiting();
        return new AdaptiveRateLimiter(ratePolicies(settings), settings.getIdleEviction(), clock);
    }

    static List<RateLimitPolicy> ratePolicies(GatewayProperties.RateLimiting settings) {
        List<RateLimitPolicy> policies = new ArrayList<>();
        settings.getCustom().forEach(custom -> policies.add(new RateLimitPolicy(custom.getName(),
                custom.getWindow(), custom.getMaxRequests(), ErrorCode.CUSTOM_RATE_LIMIT_EXCEEDED,
                custom.getPathPattern())));

        Map<String, GatewayProperties.Window> categories = settings.getCategories();
        policies.add(policy(RateLimitPolicy.GLOBAL, categories, Duration.ofMinutes(15), 100,
                ErrorCode.RATE_LIMIT_EXCEEDED));
        policies.add(policy(RateLimitPolicy.USER, categories, Duration.ofMinutes(15), 50,
                ErrorCode.USER_RATE_LIMIT_EXCEEDED));
        policies.add(policy(RateLimitPolicy.API_KEY, categories, Duration.ofHours(1), 1000,
                ErrorCode.API_KEY_RATE_LIMIT_EXCEEDED));
        return policies;
    }

    private static RateLimitPolicy policy(String category, Map<String, GatewayProperties.Window> categories,
                                          Duration defaultWindow, int defaultMax, ErrorCode errorCode) {
        GatewayProperties.Window window = categories.get(category);
        return window != null
                ? new RateLimitPolicy(category, window.getWindow(), window.getMaxRequests(), errorCode, null)
                : new RateLimitPolicy(category, defaultWindow, defaultMax, errorCode, null);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hrms.gateway.rate-limiting.load-sampling", name = "enabled", havingValue = "true")
    public SystemLoadSampler systemLoadSampler(AdaptiveRateLimiter adaptiveRateLimiter) {
        return new SystemLoadSampler(adaptiveRateLimiter);
    }

    // ==================== ROUTING ====================

    @Bean
    public RouteTable routeTable(GatewayProperties properties) {
        List<RouteMapping> mappings = properties.getRoutes().stream()
                .map(route -> new RouteMapping(route.getPrefix(), route.getService(), route.getTargetPrefix()))
                .toList();
        mappings.forEach(mapping -> log.info("  Route {} -> {}{}", mapping.prefix(), mapping.service(),
                mapping.targetPrefix().isEmpty() ? "" : " (" + mapping.targetPrefix() + ")"));
        return new RouteTable(mappings);
    }

    @Bean
    public ServiceProxyFilter serviceProxyFilter(RouteTable routeTable,
                                                 CircuitBreakerManager circuitBreakerManager,
                                                 LoadAwareSelector loadAwareSelector,
                                                 GatewayProperties properties) {
        return new ServiceProxyFilter(routeTable, circuitBreakerManager, loadAwareSelector,
                properties.getCircuitBreaker().getFailureStatuses());
    }
}
