package com.apptrace.telemetry.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/** One metric data point; integer sources are widened to {@code double}. */
public record MetricRecord(UUID id, String name, Instant timestamp, double value, Map<String, AttributeValue> attributes) {

    public static final String HISTOGRAM_SUFFIX = "_histogram";
    public static final String HISTOGRAM_COUNT = "histogram.count";
    public static final String HISTOGRAM_SUM = "histogram.sum";

    public MetricRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timestamp, "timestamp");
        attributes = TelemetryAttributes.normalize(attributes);
    }

    public String serviceName() {
        return TelemetryAttributes.serviceName(attributes);
    }
}
