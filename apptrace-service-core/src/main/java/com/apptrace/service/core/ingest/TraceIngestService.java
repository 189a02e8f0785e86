package com.apptrace.service.core.ingest;

import com.apptrace.service.core.decode.OtlpRecordDecoder;
import com.apptrace.service.core.spi.TraceStorage;
import com.apptrace.telemetry.model.SpanRecord;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class TraceIngestService {

    private final OtlpRecordDecoder decoder;
    private final TraceStorage storage;

    public ExportOutcome export(ExportTraceServiceRequest request) {
        try {
            List<SpanRecord> spans = decoder.decodeSpans(request);
            storage.insertBatch(spans);
            log.info("Processed {} spans", spans.size());
            return ExportOutcome.success();
        } catch (Exception e) {
            long rejected = decoder.countSpans(request);
            log.error("Failed to store {} spans", rejected, e);
            return ExportOutcome.rejected(rejected, e);
        }
    }
}
