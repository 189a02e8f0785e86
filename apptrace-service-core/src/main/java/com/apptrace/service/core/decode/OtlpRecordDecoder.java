package com.apptrace.service.core.decode;

import com.apptrace.telemetry.model.AttributeValue;
import com.apptrace.telemetry.model.LogRecord;
import com.apptrace.telemetry.model.MetricRecord;
import com.apptrace.telemetry.model.SpanRecord;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.logs.v1.SeverityNumber;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.proto.trace.v1.Status;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Flattens OTLP export requests into domain records.
 *
 * <p>Output order follows the request: resource, then scope, then entry. Every record gets a fresh
 * id and inherits the resource's {@code service.name}. Malformed values degrade to text; nothing
 * here throws for a well-formed protobuf message.
 */
@Component
@Slf4j
public class OtlpRecordDecoder {

    private static final String SEVERITY_NUMBER_PREFIX = "SEVERITY_NUMBER_";

    private final Clock clock;

    public OtlpRecordDecoder(Clock clock) {
        this.clock = clock;
    }

    public List<LogRecord> decodeLogs(ExportLogsServiceRequest request) {
        List<LogRecord> out = new ArrayList<>();
        for (ResourceLogs resourceLogs : request.getResourceLogsList()) {
            String serviceName = OtlpValues.serviceName(resourceLogs.getResource());
            for (ScopeLogs scopeLogs : resourceLogs.getScopeLogsList()) {
                for (io.opentelemetry.proto.logs.v1.LogRecord entry : scopeLogs.getLogRecordsList()) {
                    out.add(new LogRecord(
                            UUID.randomUUID(),
                            logTimestamp(entry),
                            OtlpValues.hexOrNull(entry.getTraceId()),
                            OtlpValues.hexOrNull(entry.getSpanId()),
                            severity(entry),
                            entry.hasBody() ? OtlpValues.render(entry.getBody()) : "",
                            OtlpValues.attributes(serviceName, entry.getAttributesList())));
                }
            }
        }
        return out;
    }

    public List<SpanRecord> decodeSpans(ExportTraceServiceRequest request) {
        List<SpanRecord> out = new ArrayList<>();
        for (ResourceSpans resourceSpans : request.getResourceSpansList()) {
            String serviceName = OtlpValues.serviceName(resourceSpans.getResource());
            for (ScopeSpans scopeSpans : resourceSpans.getScopeSpansList()) {
                for (Span span : scopeSpans.getSpansList()) {
                    Instant start = OtlpValues.toInstant(span.getStartTimeUnixNano());
                    Instant end = OtlpValues.toInstant(span.getEndTimeUnixNano());
                    if (end.isBefore(start)) {
                        log.debug("Span {} ends before it starts; clamping end to start", span.getName());
                        end = start;
                    }
                    out.add(new SpanRecord(
                            UUID.randomUUID(),
                            OtlpValues.hex(span.getTraceId()),
                            OtlpValues.hex(span.getSpanId()),
                            OtlpValues.hexOrNull(span.getParentSpanId()),
                            span.getName(),
                            start,
                            end,
                            OtlpValues.attributes(serviceName, span.getAttributesList()),
                            status(span)));
                }
            }
        }
        return out;
    }

    public List<MetricRecord> decodeMetrics(ExportMetricsServiceRequest request) {
        List<MetricRecord> out = new ArrayList<>();
        for (ResourceMetrics resourceMetrics : request.getResourceMetricsList()) {
            String serviceName = OtlpValues.serviceName(resourceMetrics.getResource());
            for (ScopeMetrics scopeMetrics : resourceMetrics.getScopeMetricsList()) {
                for (Metric metric : scopeMetrics.getMetricsList()) {
                    switch (metric.getDataCase()) {
                        case GAUGE -> metric.getGauge().getDataPointsList()
                                .forEach(dp -> out.add(numberPoint(metric.getName(), dp, serviceName)));
                        case SUM -> metric.getSum().getDataPointsList()
                                .forEach(dp -> out.add(numberPoint(metric.getName(), dp, serviceName)));
                        case HISTOGRAM -> metric.getHistogram().getDataPointsList()
                                .forEach(dp -> out.add(histogramPoint(metric.getName(), dp, serviceName)));
                        default -> log.debug(
                                "Skipping unsupported metric type {} for {}", metric.getDataCase(), metric.getName());
                    }
                }
            }
        }
        return out;
    }

    public long countLogRecords(ExportLogsServiceRequest request) {
        return request.getResourceLogsList().stream()
                .flatMap(rl -> rl.getScopeLogsList().stream())
                .mapToLong(ScopeLogs::getLogRecordsCount)
                .sum();
    }

    public long countSpans(ExportTraceServiceRequest request) {
        return request.getResourceSpansList().stream()
                .flatMap(rs -> rs.getScopeSpansList().stream())
                .mapToLong(ScopeSpans::getSpansCount)
                .sum();
    }

    /** Gauge, sum and histogram points; the metric types the decoder skips are not counted. */
    public long countDataPoints(ExportMetricsServiceRequest request) {
        return request.getResourceMetricsList().stream()
                .flatMap(rm -> rm.getScopeMetricsList().stream())
                .flatMap(sm -> sm.getMetricsList().stream())
                .mapToLong(m -> switch (m.getDataCase()) {
                    case GAUGE -> m.getGauge().getDataPointsCount();
                    case SUM -> m.getSum().getDataPointsCount();
                    case HISTOGRAM -> m.getHistogram().getDataPointsCount();
                    default -> 0;
                })
                .sum();
    }

    private Instant logTimestamp(io.opentelemetry.proto.logs.v1.LogRecord entry) {
        if (entry.getTimeUnixNano() != 0) {
            return OtlpValues.toInstant(entry.getTimeUnixNano());
        }
        if (entry.getObservedTimeUnixNano() != 0) {
            return OtlpValues.toInstant(entry.getObservedTimeUnixNano());
        }
        return clock.instant();
    }

    private static String severity(io.opentelemetry.proto.logs.v1.LogRecord entry) {
        if (!entry.getSeverityText().isEmpty()) {
            return entry.getSeverityText();
        }
        SeverityNumber number = entry.getSeverityNumber();
        if (number == SeverityNumber.SEVERITY_NUMBER_UNSPECIFIED || number == SeverityNumber.UNRECOGNIZED) {
            return "";
        }
        return number.name().substring(SEVERITY_NUMBER_PREFIX.length());
    }

    private static String status(Span span) {
        if (span.hasStatus() && span.getStatus().getCode() == Status.StatusCode.STATUS_CODE_ERROR) {
            return SpanRecord.STATUS_ERROR;
        }
        return SpanRecord.STATUS_OK;
    }

    private static MetricRecord numberPoint(String name, NumberDataPoint dp, String serviceName) {
        double value = switch (dp.getValueCase()) {
            case AS_DOUBLE -> dp.getAsDouble();
            case AS_INT -> (double) dp.getAsInt();
            default -> 0.0;
        };
        return new MetricRecord(
                UUID.randomUUID(),
                name,
                OtlpValues.toInstant(dp.getTimeUnixNano()),
                value,
                OtlpValues.attributes(serviceName, dp.getAttributesList()));
    }

    private static MetricRecord histogramPoint(String name, HistogramDataPoint dp, String serviceName) {
        double sum = dp.hasSum() ? dp.getSum() : 0.0;
        Map<String, AttributeValue> attributes = OtlpValues.attributes(serviceName, dp.getAttributesList());
        attributes.put(MetricRecord.HISTOGRAM_COUNT, AttributeValue.of(dp.getCount()));
        attributes.put(MetricRecord.HISTOGRAM_SUM, AttributeValue.of(sum));
        return new MetricRecord(
                UUID.randomUUID(),
                name + MetricRecord.HISTOGRAM_SUFFIX,
                OtlpValues.toInstant(dp.getTimeUnixNano()),
                sum,
                attributes);
    }
}
