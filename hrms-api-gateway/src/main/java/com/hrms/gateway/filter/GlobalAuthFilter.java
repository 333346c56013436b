package com.hrms.gateway.filter;

/*
 * ============================================================================
 * GLOBAL AUTH FILTER - CODE FLOW
 * ============================================================================
 *
 *   REQUEST COMES IN
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 0. Drop client-supplied X-User-*    │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Public endpoint, or API key      │
 *   │    already accepted upstream?       │
 *   └─────────────────────────────────────┘
 *         │ YES → forward without identity
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. TokenAuthenticator               │
 *   │    - Bearer header present          │
 *   │    - signature + expiry             │
 *   │    - revoked:<token> in Redis       │
 *   └─────────────────────────────────────┘
 *         │ any failure → 401
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. Admin endpoint needs ADMIN role  │
 *   └─────────────────────────────────────┘
 *         │ other role → 403
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 4. X-User-Id / -Email / -Role       │
 *   │    + identity attribute for the     │
 *   │      rate limiter                   │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   RATE LIMITING → ROUTER
 *
 * ============================================================================
 */

import com.hrms.gateway.config.GatewayProperties;
import com.hrms.gateway.exception.UnauthorizedException;
import com.hrms.gateway.ratelimit.ClientKeyResolver;
import com.hrms.gateway.security.AuthenticatedUser;
import com.hrms.gateway.security.TokenAuthenticator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Global Authentication Filter
 *
 * Applies bearer-token authentication to every proxied route and forwards the
 * caller's identity downstream as headers.
 * - Public endpoints: hrms.gateway.security.public-endpoints
 * - Admin endpoints: hrms.gateway.security.admin-endpoints
 */
@Slf4j
@Component
public class GlobalAuthFilter implements GlobalFilter, Ordered {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_EMAIL_HEADER = "X-User-Email";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    private final TokenAuthenticator authenticator;
    private final List<String> publicEndpoints;
    private final List<String> adminEndpoints;

    public GlobalAuthFilter(TokenAuthenticator authenticator, GatewayProperties properties) {
        this.authenticator = authenticator;
        this.publicEndpoints = List.copyOf(properties.getSecurity().getPublicEndpoints());
        this.adminEndpoints = List.copyOf(properties.getSecurity().getAdminEndpoints());

        log.info("GlobalAuthFilter initialized with {} public and {} admin endpoints",
                publicEndpoints.size(), adminEndpoints.size());
        publicEndpoints.forEach(endpoint -> log.info("  Public endpoint: {}", endpoint));
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> {
                    headers.remove(USER_ID_HEADER);
                    headers.remove(USER_EMAIL_HEADER);
                    headers.remove(USER_ROLE_HEADER);
                })
                .build();
        ServerWebExchange sanitized = exchange.mutate().request(request).build();
        String path = request.getURI().getPath();

        // ========== CHECK 1: Public endpoint or API-key request? ==========
        if (EndpointMatcher.matchesAny(path, publicEndpoints)) {
            log.debug("Public endpoint accessed: {}", path);
            return chain.filter(sanitized);
        }
        if (Boolean.TRUE.equals(exchange.getAttribute(ExternalApiKeyFilter.API_KEY_AUTHENTICATED_ATTR))) {
            return chain.filter(sanitized);
        }

        // ========== CHECK 2: Valid, unrevoked token? ==========
        return authenticator.authenticate(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
                .flatMap(user -> {
                    // ========== CHECK 3: Admin endpoint? ==========
                    if (EndpointMatcher.matchesAny(path, adminEndpoints) && !user.isAdmin()) {
                        log.warn("Non-admin user {} attempted to access admin endpoint: {}", user.userId(), path);
                        return Mono.error(UnauthorizedException.forbidden("Admin access required"));
                    }
                    return chain.filter(withIdentity(sanitized, user));
                });
    }

    private static ServerWebExchange withIdentity(ServerWebExchange exchange, AuthenticatedUser user) {
        ServerHttpRequest authenticated = exchange.getRequest().mutate()
                .header(USER_ID_HEADER, nullToEmpty(user.userId()))
                .header(USER_EMAIL_HEADER, nullToEmpty(user.email()))
                .header(USER_ROLE_HEADER, nullToEmpty(user.role()))
                .build();
        if (user.userId() != null) {
            exchange.getAttributes().put(ClientKeyResolver.IDENTITY_ATTR, user.userId());
        }
        return exchange.mutate().request(authenticated).build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
