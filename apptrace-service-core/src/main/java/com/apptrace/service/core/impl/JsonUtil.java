package com.apptrace.service.core.impl;

import com.apptrace.telemetry.model.AttributeValue;
import com.apptrace.telemetry.model.TelemetryAttributes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;

/** Attribute maps as stored in the {@code attributes} JSON columns. */
public final class JsonUtil {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static {
        M.findAndRegisterModules();
        M.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    private JsonUtil() {}

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encode failed", e);
        }
    }

    /** {@code {"key": <json value>, ...}}; an empty or null map encodes as {@code {}}. */
    public static String attributesToJson(Map<String, AttributeValue> attributes) {
        return toJson(attributes == null ? Map.of() : attributes);
    }

    /** Inverse of {@link #attributesToJson(Map)}; byte values come back as hex strings. */
    public static Map<String, AttributeValue> attributesFromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return TelemetryAttributes.fromPlain(M.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON decode failed", e);
        }
    }
}
