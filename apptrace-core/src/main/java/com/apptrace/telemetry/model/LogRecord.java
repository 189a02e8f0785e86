package com.apptrace.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One decoded log entry.
 *
 * <p>{@code traceId} and {@code spanId} are optional lowercase hex strings. The attribute map is
 * immutable and always carries {@value TelemetryAttributes#SERVICE_NAME}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogRecord(
        UUID id,
        Instant timestamp,
        String traceId,
        String spanId,
        String severity,
        String body,
        Map<String, AttributeValue> attributes) {

    public LogRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        severity = severity == null ? "" : severity;
        body = body == null ? "" : body;
        attributes = TelemetryAttributes.normalize(attributes);
    }

    public String serviceName() {
        return TelemetryAttributes.serviceName(attributes);
    }
}
