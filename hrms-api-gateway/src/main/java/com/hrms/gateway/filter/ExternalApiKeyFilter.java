package com.hrms.gateway.filter;

import com.hrms.gateway.config.ExternalApiConfig;
import com.hrms.gateway.exception.UnauthorizedException;
import com.hrms.gateway.ratelimit.ClientKeyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * External API Key Filter
 *
 * Authenticates integrations on the external endpoints through the
 * {@code X-API-Key} header.
 *
 * Flow:
 * 1. Not an external endpoint → continue
 * 2. No key configured or none sent → continue to JWT validation
 * 3. Key sent but unknown → 401 Unauthorized
 * 4. Key accepted → mark the exchange so GlobalAuthFilter skips JWT validation
 */
@Slf4j
@Component
public class ExternalApiKeyFilter implements GlobalFilter, Ordered {

    public static final String API_KEY_AUTHENTICATED_ATTR = "hrms.apiKeyAuthenticated";

    private final ExternalApiConfig config;

    public ExternalApiKeyFilter(ExternalApiConfig config) {
        this.config = config;

        if (config.getApiKeys().isEmpty()) {
            log.info("ExternalApiKeyFilter disabled - no API keys configured");
        } else {
            log.info("ExternalApiKeyFilter initialized with {} keys for {} endpoints",
                    config.getApiKeys().size(), config.getEndpoints().size());
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        List<String> apiKeys = config.getApiKeys();
        String path = exchange.getRequest().getURI().getPath();

        if (apiKeys.isEmpty() || !EndpointMatcher.matchesAny(path, config.getEndpoints())) {
            return chain.filter(exchange);
        }

        String providedApiKey = ClientKeyResolver.apiKey(exchange);
        if (providedApiKey == null) {
            log.debug("No API key provided for: {}, falling through to JWT auth", path);
            return chain.filter(exchange);
        }

        if (apiKeys.stream().noneMatch(key -> constantTimeEquals(key, providedApiKey))) {
            log.warn("Invalid API key {}... for request to: {}", prefix(providedApiKey), path);
            return Mono.error(new UnauthorizedException("Invalid API key"));
        }

        log.debug("Valid API key {}... for request to: {}", prefix(providedApiKey), path);
        exchange.getAttributes().put(API_KEY_AUTHENTICATED_ATTR, Boolean.TRUE);
        return chain.filter(exchange);
    }

    @Override
    public int getOrder() {
        // before GlobalAuthFilter (-100)
        return -150;
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    private static String prefix(String apiKey) {
        return apiKey.length() > 8 ? apiKey.substring(0, 8) : apiKey;
    }
}
