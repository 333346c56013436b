package com.hrms.gateway.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes rendered in the {@code errors[].code} field of gateway rejections.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Routing ──
    UNROUTABLE(HttpStatus.NOT_FOUND, "No service is mapped to this path"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "No healthy instance is available"),
    CIRCUIT_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "Service circuit breaker is open"),

    // ── Upstream ──
    UPSTREAM_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Upstream service timed out"),
    UPSTREAM_UNREACHABLE(HttpStatus.BAD_GATEWAY, "Upstream service is unreachable"),

    // ── Rate limiting, one code per category ──
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests, please try again later"),
    USER_RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests for this user"),
    API_KEY_RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests for this API key"),
    CUSTOM_RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests for this endpoint"),

    // ── Security ──
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Access denied"),

    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "Invalid request"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");

    private final HttpStatus status;
    private final String message;
}
