package com.hrms.gateway.filter;

import com.hrms.gateway.ratelimit.ClientKeyResolver;
import com.hrms.gateway.routing.ServiceProxyFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Logging Filter
 *
 * Access log for every request, plus the correlation id forwarded downstream
 * and echoed back to the client.
 */
@Slf4j
@Component
public class LoggingFilter implements GlobalFilter, Ordered {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();

        String correlationId = request.getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        long startedAt = System.nanoTime();

        ServerHttpRequest modifiedRequest = request.mutate()
                .header(CORRELATION_ID_HEADER, correlationId)
                .build();
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        log.info("Incoming request: {} {} - CorrelationId: {} - Client: {}",
                request.getMethod(),
                request.getURI().getPath(),
                correlationId,
                ClientKeyResolver.clientIp(request));

        String finalCorrelationId = correlationId;
        return chain.filter(exchange.mutate().request(modifiedRequest).build())
                .doFinally(signal -> {
                    String service = exchange.getAttribute(ServiceProxyFilter.SERVICE_ATTR);
                    log.info("Outgoing response: {} {} - Service: {} - Status: {} - Duration: {}ms - CorrelationId: {}",
                            request.getMethod(),
                            request.getURI().getPath(),
                            service != null ? service : "-",
                            exchange.getResponse().getStatusCode(),
                            (System.nanoTime() - startedAt) / 1_000_000,
                            finalCorrelationId);
                });
    }

    @Override
    public int getOrder() {
        // first of all gateway filters
        return -200;
    }
}
