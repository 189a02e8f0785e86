package com.apptrace.controller.otlp;

import com.apptrace.service.core.api.ErrorPayload;
import com.apptrace.service.core.ingest.ExportOutcome;
import com.apptrace.service.core.ingest.LogIngestService;
import com.apptrace.service.core.ingest.MetricIngestService;
import com.apptrace.service.core.ingest.TraceIngestService;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsPartialSuccess;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsPartialSuccess;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.ExportTracePartialSuccess;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OTLP/HTTP export endpoints (binary protobuf). A storage failure is reported in the response's
 * {@code partial_success}, never as an HTTP error; only an unparseable body is a 400.
 */
@RestController
@RequestMapping("/v1")
public class OtlpIngestController {

    public static final String APPLICATION_X_PROTOBUF = "application/x-protobuf";

    private static final MediaType PROTOBUF = MediaType.parseMediaType(APPLICATION_X_PROTOBUF);
    private static final Logger log = LoggerFactory.getLogger(OtlpIngestController.class);

    private final LogIngestService logs;
    private final TraceIngestService traces;
    private final MetricIngestService metrics;

    public OtlpIngestController(LogIngestService logs, TraceIngestService traces, MetricIngestService metrics) {
        this.logs = logs;
        this.traces = traces;
        this.metrics = metrics;
    }

    @PostMapping(value = "/logs", consumes = APPLICATION_X_PROTOBUF)
    public ResponseEntity<byte[]> logs(@RequestBody(required = false) byte[] body) throws InvalidProtocolBufferException {
        ExportOutcome outcome = logs.export(ExportLogsServiceRequest.parseFrom(payload(body)));
        ExportLogsServiceResponse.Builder response = ExportLogsServiceResponse.newBuilder();
        if (!outcome.isSuccess()) {
            response.setPartialSuccess(ExportLogsPartialSuccess.newBuilder()
                    .setRejectedLogRecords(outcome.rejectedCount())
                    .setErrorMessage(outcome.errorMessage()));
        }
        return protobuf(response.build());
    }

    @PostMapping(value = "/traces", consumes = APPLICATION_X_PROTOBUF)
    public ResponseEntity<byte[]> traces(@RequestBody(required = false) byte[] body) throws InvalidProtocolBufferException {
        ExportOutcome outcome = traces.export(ExportTraceServiceRequest.parseFrom(payload(body)));
        ExportTraceServiceResponse.Builder response = ExportTraceServiceResponse.newBuilder();
        if (!outcome.isSuccess()) {
            response.setPartialSuccess(ExportTracePartialSuccess.newBuilder()
                    .setRejectedSpans(outcome.rejectedCount())
                    .setErrorMessage(outcome.errorMessage()));
        }
        return protobuf(response.build());
    }

    @PostMapping(value = "/metrics", consumes = APPLICATION_X_PROTOBUF)
    public ResponseEntity<byte[]> metrics(@RequestBody(required = false) byte[] body) throws InvalidProtocolBufferException {
        ExportOutcome outcome = metrics.export(ExportMetricsServiceRequest.parseFrom(payload(body)));
        ExportMetricsServiceResponse.Builder response = ExportMetricsServiceResponse.newBuilder();
        if (!outcome.isSuccess()) {
            response.setPartialSuccess(ExportMetricsPartialSuccess.newBuilder()
                    .setRejectedDataPoints(outcome.rejectedCount())
                    .setErrorMessage(outcome.errorMessage()));
        }
        return protobuf(response.build());
    }

    @ExceptionHandler(InvalidProtocolBufferException.class)
    public ResponseEntity<ErrorPayload> handleCorruptPayload(
            InvalidProtocolBufferException ex, HttpServletRequest request) {
        log.warn("Rejected unparseable OTLP payload on {}: {}", request.getRequestURI(), ex.getMessage());
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ErrorPayload body = new ErrorPayload(
                Instant.now(), status.value(), status.getReasonPhrase(), ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }

    // a request with no entries encodes to zero bytes
    private static byte[] payload(byte[] body) {
        return body == null ? new byte[0] : body;
    }

    private static ResponseEntity<byte[]> protobuf(MessageLite message) {
        return ResponseEntity.ok().contentType(PROTOBUF).body(message.toByteArray());
    }
}
