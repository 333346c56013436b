package com.hrms.messaging.rpc;

import lombok.Getter;

import java.util.concurrent.CompletionException;

/**
 * Failure of a correlated request. Callers branch on {@link #getCode()}.
 */
@Getter
public class RpcException extends RuntimeException {

    private final RpcErrorCode code;
    private final String correlationId;

    public RpcException(RpcErrorCode code, String correlationId, String message) {
        super(message);
        this.code = code;
        this.correlationId = correlationId;
    }

    public RpcException(RpcErrorCode code, String correlationId, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.correlationId = correlationId;
    }

    /**
     * Finds the {@code RpcException} behind a future's failure, unwrapping
     * {@link CompletionException}. Returns {@code null} for any other failure.
     */
    public static RpcException unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current instanceof RpcException rpc ? rpc : null;
    }
}
