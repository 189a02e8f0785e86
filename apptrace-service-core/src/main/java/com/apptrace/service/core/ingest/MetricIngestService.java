package com.apptrace.service.core.ingest;

import com.apptrace.service.core.decode.OtlpRecordDecoder;
import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.telemetry.model.MetricRecord;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class MetricIngestService {

    private final OtlpRecordDecoder decoder;
    private final MetricStorage storage;

    /** Histogram points count once each, before flattening. */
    public ExportOutcome export(ExportMetricsServiceRequest request) {
        try {
            List<MetricRecord> metrics = decoder.decodeMetrics(request);
            storage.insertBatch(metrics);
            log.info("Processed {} metric data points", metrics.size());
            return ExportOutcome.success();
        } catch (Exception e) {
            long rejected = decoder.countDataPoints(request);
            log.error("Failed to store {} metric data points", rejected, e);
            return ExportOutcome.rejected(rejected, e);
        }
    }
}
