package com.hrms.gateway.filter;

import com.hrms.gateway.controller.HealthController;
import com.hrms.gateway.exception.UnauthorizedException;
import com.hrms.gateway.security.TokenAuthenticator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Guards the gateway's own admin endpoints, which are served by a controller and
 * so never pass through the gateway filter chain. Requires the ADMIN role.
 */
@Slf4j
@Component
public class AdminAccessWebFilter implements WebFilter, Ordered {

    private final TokenAuthenticator authenticator;

    public AdminAccessWebFilter(TokenAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getURI().getPath();
        if (!EndpointMatcher.matches(path, HealthController.ADMIN_PATH + "/**")) {
            return chain.filter(exchange);
        }

        return authenticator.authenticate(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
                .flatMap(user -> {
                    if (!user.isAdmin()) {
                        log.warn("Non-admin user {} attempted to access {}", user.userId(), path);
                        return Mono.error(UnauthorizedException.forbidden("Admin access required"));
                    }
                    return chain.filter(exchange);
                });
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }
}
