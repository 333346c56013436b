package com.hrms.messaging.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * JSON codec for {@link EventEnvelope}s.
 *
 * Reading performs shape checks only: the payload must be a JSON object carrying
 * the envelope fields. Domain payloads inside {@code data} are not validated here.
 */
public class EventEnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EventEnvelopeCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public EventEnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(EventEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Cannot serialize event " + envelope.id(), e);
        }
    }

    public EventEnvelope read(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedEventException("Empty event payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Event payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("Event payload is not a JSON object");
        }
        try {
            return objectMapper.treeToValue(root, EventEnvelope.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedEventException("Event payload does not have the envelope shape", e);
        }
    }

    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    /**
     * Converts a JSON array node into a list of {@code itemType}.
     */
    public <T> List<T> toList(JsonNode array, Class<T> itemType) {
        if (array == null || !array.isArray()) {
            throw new MalformedEventException("Expected a JSON array");
        }
        try {
            return objectMapper.convertValue(array,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, itemType));
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("Array items are not " + itemType.getSimpleName(), e);
        }
    }
}
