package com.hrms.gateway.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global Exception Handler for API Gateway
 *
 * Renders every gateway error in one envelope:
 * <pre>
 * { "data": null, "errors": [ { "code", "message", "retryAfter"?, ...details } ] }
 * </pre>
 * and adds a {@code Retry-After} header (whole seconds, rounded up) when the
 * error carries a retry hint.
 */
@Slf4j
@Component
@Order(-2)
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private final ObjectMapper objectMapper;

    public GlobalExceptionHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.error(ex);
        }

        HttpStatusCode status;
        Map<String, Object> error = new LinkedHashMap<>();

        if (ex instanceof GatewayException gex) {
            status = gex.getErrorCode().getStatus();
            error.put("code", gex.getErrorCode().name());
            error.put("message", gex.getMessage());
            if (gex.getRetryAfter() != null) {
                long seconds = retryAfterSeconds(gex.getRetryAfter());
                error.put("retryAfter", seconds);
                response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
            }
            error.putAll(gex.getDetails());
        } else if (ex instanceof UnauthorizedException uex) {
            ErrorCode code = uex.isForbidden() ? ErrorCode.FORBIDDEN : ErrorCode.UNAUTHORIZED;
            status = code.getStatus();
            error.put("code", code.name());
            error.put("message", uex.getMessage());
        } else if (ex instanceof ResponseStatusException rse) {
            status = rse.getStatusCode();
            error.put("code", codeFor(status).name());
            error.put("message", rse.getReason() != null ? rse.getReason() : codeFor(status).getMessage());
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            error.put("code", ErrorCode.INTERNAL_ERROR.name());
            error.put("message", ErrorCode.INTERNAL_ERROR.getMessage());
            log.error("Unhandled exception in gateway for {}", exchange.getRequest().getURI().getPath(), ex);
        }

        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("data", null);
        body.put("errors", List.of(error));

        try {
            byte[] bytes = objectMapper.writeValueAsBytes(body);
            DataBuffer buffer = response.bufferFactory().wrap(bytes);
            return response.writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            log.error("Error serializing error response", e);
            return response.setComplete();
        }
    }

    static long retryAfterSeconds(Duration retryAfter) {
        long millis = Math.max(0, retryAfter.toMillis());
        return (millis + 999) / 1000;
    }

    private static ErrorCode codeFor(HttpStatusCode status) {
        return switch (status.value()) {
            case 400 -> ErrorCode.INVALID_REQUEST;
            case 401 -> ErrorCode.UNAUTHORIZED;
            case 403 -> ErrorCode.FORBIDDEN;
            case 404 -> ErrorCode.UNROUTABLE;
            case 429 -> ErrorCode.RATE_LIMIT_EXCEEDED;
            case 502 -> ErrorCode.UPSTREAM_UNREACHABLE;
            case 503 -> ErrorCode.SERVICE_UNAVAILABLE;
            case 504 -> ErrorCode.UPSTREAM_TIMEOUT;
            default -> ErrorCode.INTERNAL_ERROR;
        };
    }
}
