package com.apptrace.telemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/** One decoded span. {@code endTime} is never before {@code startTime}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpanRecord(
        UUID id,
        String traceId,
        String spanId,
        String parentSpanId,
        String name,
        Instant startTime,
        Instant endTime,
        Map<String, AttributeValue> attributes,
        String status) {

    public static final String STATUS_OK = "OK";
    public static final String STATUS_ERROR = "ERROR";

    public SpanRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(spanId, "spanId");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime " + endTime + " is before startTime " + startTime);
        }
        name = name == null ? "" : name;
        status = (status == null || status.isBlank()) ? STATUS_OK : status;
        attributes = TelemetryAttributes.normalize(attributes);
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    /** Duration in fractional milliseconds, matching the generated {@code duration_ms} column. */
    public double durationMillis() {
        return duration().toNanos() / 1_000_000.0;
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentSpanId == null || parentSpanId.isEmpty();
    }

    public String serviceName() {
        return TelemetryAttributes.serviceName(attributes);
    }
}
