package com.hrms.gateway.exception;

import lombok.Getter;

/**
 * Authentication or authorization failure raised by the security filters.
 */
@Getter
public class UnauthorizedException extends RuntimeException {

    private final boolean forbidden;

    public UnauthorizedException(String message) {
        this(message, false);
    }

    public UnauthorizedException(String message, boolean forbidden) {
        super(message);
        this.forbidden = forbidden;
    }

    public static UnauthorizedException forbidden(String message) {
        return new UnauthorizedException(message, true);
    }
}
