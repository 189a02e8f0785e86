package com.apptrace.controller.rest;

import com.apptrace.service.core.spi.LogStorage;
import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.service.core.spi.RecordPage;
import com.apptrace.service.core.spi.TraceStorage;
import com.apptrace.telemetry.model.LogRecord;
import com.apptrace.telemetry.model.MetricRecord;
import com.apptrace.telemetry.model.SpanRecord;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side for the UI. Every list is newest first and paged with {@code limit} (default 100) and
 * {@code offset} (default 0).
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class TelemetryQueryController {

    private static final Logger log = LoggerFactory.getLogger(TelemetryQueryController.class);

    private final LogStorage logs;
    private final TraceStorage traces;
    private final MetricStorage metrics;

    public TelemetryQueryController(LogStorage logs, TraceStorage traces, MetricStorage metrics) {
        this.logs = logs;
        this.traces = traces;
        this.metrics = metrics;
    }

    /** With {@code search}, only logs whose body or attributes contain it, ignoring case. */
    @GetMapping("/logs")
    public List<LogRecord> logs(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) String search) {
        RecordPage page = RecordPage.of(limit, offset);
        log.debug("GET /api/logs limit={}, offset={}, search={}", page.limit(), page.offset(), search);
        if (hasText(search)) {
            return logs.search(search, page.limit(), page.offset());
        }
        return logs.getPage(page.limit(), page.offset());
    }

    @GetMapping("/traces")
    public List<SpanRecord> traces(
            @RequestParam(required = false) Integer limit, @RequestParam(required = false) Integer offset) {
        RecordPage page = RecordPage.of(limit, offset);
        return traces.getPage(page.limit(), page.offset());
    }

    /** All spans of one trace, oldest first. */
    @GetMapping("/traces/{traceId}")
    public List<SpanRecord> trace(@PathVariable String traceId) {
        return traces.getByTraceId(traceId);
    }

    /** {@code name} narrows by metric name only; {@code search} also looks at attributes. */
    @GetMapping("/metrics")
    public List<MetricRecord> metrics(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String name) {
        RecordPage page = RecordPage.of(limit, offset);
        if (hasText(name)) {
            return metrics.findByName(name, page.limit(), page.offset());
        }
        if (hasText(search)) {
            return metrics.search(search, page.limit(), page.offset());
        }
        return metrics.getPage(page.limit(), page.offset());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
