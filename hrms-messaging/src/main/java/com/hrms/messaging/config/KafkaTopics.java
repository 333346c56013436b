package com.hrms.messaging.config;

/**
 * Default topic names for the correlated request/response channels.
 */
public final class KafkaTopics {

    // Services that need employee records publish lookups here
    public static final String EMPLOYEE_REQUESTS = "employee-requests";

    // The employee service answers on this topic
    public static final String EMPLOYEE_RESPONSES = "employee-responses";

    private KafkaTopics() {
    }
}
