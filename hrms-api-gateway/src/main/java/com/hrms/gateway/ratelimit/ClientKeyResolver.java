package com.hrms.gateway.ratelimit;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetSocketAddress;

/**
 * Derives the rate-limit key of a request: authenticated identity, then API key,
 * then client address. The first one present wins.
 */
public final class ClientKeyResolver {

    public static final String IDENTITY_ATTR = "hrms.identity";
    public static final String API_KEY_HEADER = "X-API-Key";

    private ClientKeyResolver() {
    }

    public static String resolve(ServerWebExchange exchange) {
        String identity = identity(exchange);
        if (identity != null) {
            return "user:" + identity;
        }
        String apiKey = apiKey(exchange);
        if (apiKey != null) {
            return "apikey:" + apiKey;
        }
        return "ip:" + clientIp(exchange.getRequest());
    }

    public static String identity(ServerWebExchange exchange) {
        String identity = exchange.getAttribute(IDENTITY_ATTR);
        return identity == null || identity.isBlank() ? null : identity;
    }

    public static String apiKey(ServerWebExchange exchange) {
        String apiKey = exchange.getRequest().getHeaders().getFirst(API_KEY_HEADER);
        return apiKey == null || apiKey.isBlank() ? null : apiKey;
    }

    public static String clientIp(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }

        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress == null) {
            return "unknown";
        }
        return remoteAddress.getAddress() != null
                ? remoteAddress.getAddress().getHostAddress()
                : remoteAddress.getHostString();
    }
}
