package com.hrms.messaging.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable envelope for every event exchanged on the bus.
 *
 * Wire format (JSON):
 * <pre>
 * { "id", "type", "source", "version", "correlationId", "timestamp", "data" }
 * </pre>
 *
 * The {@code type} distinguishes the REQUEST and RESPONSE variants of a domain
 * exchange (e.g. EMPLOYEE_FETCH_REQUEST / EMPLOYEE_FETCH_RESPONSE), and the
 * {@code correlationId} links a response to the request that caused it.
 */
public record EventEnvelope(
        String id,
        String type,
        String source,
        String version,
        String correlationId,
        Instant timestamp,
        JsonNode data
) {

    public static final String CURRENT_VERSION = "1.0";

    public EventEnvelope {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Event id cannot be null or empty");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be null or empty");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("Correlation id cannot be null or empty");
        }
        if (data == null || data.isNull()) {
            throw new IllegalArgumentException("Event data cannot be null");
        }
        if (version == null || version.isBlank()) {
            version = CURRENT_VERSION;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Creates a new envelope with a freshly generated event id.
     */
    public static EventEnvelope create(String type, String source, String correlationId,
                                       JsonNode data, Instant timestamp) {
        return new EventEnvelope(UUID.randomUUID().toString(), type, source, CURRENT_VERSION,
                correlationId, timestamp, data);
    }
}
