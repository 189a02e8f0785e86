package com.apptrace.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Helpers for the attribute maps carried by {@link LogRecord}, {@link SpanRecord} and {@link MetricRecord}. */
public final class TelemetryAttributes {

    public static final String SERVICE_NAME = "service.name";
    public static final String UNKNOWN_SERVICE = "unknown";

    private TelemetryAttributes() {}

    /**
     * Immutable copy of {@code attributes} that is guaranteed to carry {@value #SERVICE_NAME}.
     * Null maps and null entries are tolerated.
     */
    public static Map<String, AttributeValue> normalize(Map<String, AttributeValue> attributes) {
        Map<String, AttributeValue> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        copy.putIfAbsent(SERVICE_NAME, AttributeValue.of(UNKNOWN_SERVICE));
        return Collections.unmodifiableMap(copy);
    }

    public static String serviceName(Map<String, AttributeValue> attributes) {
        if (attributes == null) return UNKNOWN_SERVICE;
        AttributeValue value = attributes.get(SERVICE_NAME);
        return value == null ? UNKNOWN_SERVICE : value.asText();
    }

    /**
     * Best-effort conversion of plain JSON values (as read back from storage) into attribute values.
     * Integral numbers become {@link AttributeValue.IntValue}, other numbers {@link AttributeValue.DoubleValue};
     * anything else falls back to its string form.
     */
    public static Map<String, AttributeValue> fromPlain(Map<String, ?> plain) {
        Map<String, AttributeValue> out = new LinkedHashMap<>();
        if (plain == null) return out;
        plain.forEach((k, v) -> {
            if (k != null && v != null) out.put(k, toValue(v));
        });
        return out;
    }

    private static AttributeValue toValue(Object v) {
        if (v instanceof AttributeValue av) return av;
        if (v instanceof String s) return AttributeValue.of(s);
        if (v instanceof Boolean b) return AttributeValue.of(b);
        if (v instanceof Integer i) return AttributeValue.of(i.longValue());
        if (v instanceof Long l) return AttributeValue.of(l);
        if (v instanceof Short s) return AttributeValue.of(s.longValue());
        if (v instanceof Float f) return AttributeValue.of(f.doubleValue());
        if (v instanceof Double d) return AttributeValue.of(d);
        if (v instanceof Number n) return AttributeValue.of(n.doubleValue());
        if (v instanceof byte[] bytes) return AttributeValue.of(bytes);
        return AttributeValue.of(String.valueOf(v)); // last resort
    }
}
