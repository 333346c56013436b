package com.hrms.messaging.event;

/**
 * Event type names carried in {@link EventEnvelope#type()}.
 */
public final class EventTypes {

    public static final String EMPLOYEE_FETCH_REQUEST = "EMPLOYEE_FETCH_REQUEST";
    public static final String EMPLOYEE_FETCH_RESPONSE = "EMPLOYEE_FETCH_RESPONSE";

    private EventTypes() {
    }
}
