package com.hrms.gateway.filter;

/*
 * ============================================================================
 * ADAPTIVE RATE LIMIT FILTER - CODE FLOW
 * ============================================================================
 *
 *   REQUEST COMES IN (identity already resolved by GlobalAuthFilter)
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Health / metrics path?           │
 *   └─────────────────────────────────────┘
 *         │ YES → forward, never limited
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Custom categories on this path   │
 *   │    (e.g. auth on /api/v1/auth/**)   │
 *   ├─────────────────────────────────────┤
 *   │ 3. global  - identity > key > IP    │
 *   ├─────────────────────────────────────┤
 *   │ 4. user    - authenticated only     │
 *   ├─────────────────────────────────────┤
 *   │ 5. apikey  - X-API-Key requests     │
 *   └─────────────────────────────────────┘
 *         │ any category exhausted → 429 with
 *         │   category, retryAfter, loadFactor
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 6. X-RateLimit-Limit / -Remaining   │
 *   │    of the tightest category         │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   FORWARD TO ROUTER
 *
 * ============================================================================
 */

import com.hrms.gateway.config.GatewayProperties;
import com.hrms.gateway.exception.GatewayException;
import com.hrms.gateway.ratelimit.AdaptiveRateLimiter;
import com.hrms.gateway.ratelimit.ClientKeyResolver;
import com.hrms.gateway.ratelimit.RateDecision;
import com.hrms.gateway.ratelimit.RateLimitPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adaptive Rate Limiting Filter
 *
 * Checks every request against the adaptive limiter's categories. Limits shrink
 * and grow with the system load pushed into {@link AdaptiveRateLimiter}.
 */
@Slf4j
@Component
public class AdaptiveRateLimitFilter implements GlobalFilter, Ordered {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final AdaptiveRateLimiter rateLimiter;
    private final GatewayProperties.RateLimiting settings;

    public AdaptiveRateLimitFilter(AdaptiveRateLimiter rateLimiter, GatewayProperties properties) {
        this.rateLimiter = rateLimiter;
        this.settings = properties.getRateLimiting();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        String path = exchange.getRequest().getURI().getPath();

        if (!settings.isEnabled() || EndpointMatcher.matchesAny(path, settings.getSkipPaths())) {
            return chain.filter(exchange);
        }

        String clientKey = ClientKeyResolver.resolve(exchange);
        RateDecision tightest = null;

        for (RateLimitPolicy policy : rateLimiter.policies()) {
            String key = keyFor(policy, exchange, path, clientKey);
            if (key == null) {
                continue;
            }
            RateDecision decision = rateLimiter.tryAcquire(policy.category(), key);
            if (!decision.allowed()) {
                return Mono.error(rejection(policy, decision, path, key));
            }
            if (tightest == null || decision.remaining() < tightest.remaining()) {
                tightest = decision;
            }
        }

        if (tightest != null) {
            exchange.getResponse().getHeaders().set(LIMIT_HEADER, String.valueOf(tightest.limit()));
            exchange.getResponse().getHeaders().set(REMAINING_HEADER, String.valueOf(tightest.remaining()));
        }
        return chain.filter(exchange);
    }

    /**
     * Key the request is counted under for a category, or {@code null} when the
     * category does not apply to it.
     */
    private String keyFor(RateLimitPolicy policy, ServerWebExchange exchange, String path, String clientKey) {
        switch (policy.category()) {
            case RateLimitPolicy.GLOBAL:
                return clientKey;
            case RateLimitPolicy.USER:
                return ClientKeyResolver.identity(exchange);
            case RateLimitPolicy.API_KEY:
                return ClientKeyResolver.apiKey(exchange);
            default:
                return policy.pathPattern() != null && EndpointMatcher.matches(path, policy.pathPattern())
                        ? clientKey
                        : null;
        }
    }

    private GatewayException rejection(RateLimitPolicy policy, RateDecision decision, String path, String key) {
        log.warn("Rate limit exceeded: category={} key={} path={} limit={} loadFactor={}",
                policy.category(), mask(policy.category(), key), path, decision.limit(), decision.loadFactor());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", policy.category());
        details.put("limit", decision.limit());
        details.put("loadFactor", decision.loadFactor());
        return new GatewayException(policy.errorCode(), policy.errorCode().getMessage(),
                decision.retryAfter(), details);
    }

    private static String mask(String category, String key) {
        if (RateLimitPolicy.API_KEY.equals(category)) {
            return truncate(key);
        }
        if (key.startsWith("apikey:")) {
            return "apikey:" + truncate(key.substring("apikey:".length()));
        }
        return key;
    }

    private static String truncate(String apiKey) {
        return apiKey.length() > 8 ? apiKey.substring(0, 8) + "..." : apiKey;
    }

    @Override
    public int getOrder() {
        // after GlobalAuthFilter (-100) so the identity is known
        return -2;
    }
}
