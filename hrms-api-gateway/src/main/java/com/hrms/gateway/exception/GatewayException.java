package com.hrms.gateway.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal rejection of an inbound request. Never retried inside the gateway;
 * the client is told when to retry through {@link #getRetryAfter()}.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Duration retryAfter;
    private final Map<String, Object> details;

    public GatewayException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage(), null, Map.of());
    }

    public GatewayException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, Map.of());
    }

    public GatewayException(ErrorCode errorCode, String message, Duration retryAfter, Map<String, ?> details) {
        super(message);
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryAfter = null;
        this.details = Map.of();
    }
}
