package com.hrms.messaging.event;

/**
 * Thrown when a bus payload cannot be read as an {@link EventEnvelope}
 * or does not have the shape its consumer expects.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
