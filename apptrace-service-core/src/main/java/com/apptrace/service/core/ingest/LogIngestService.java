package com.apptrace.service.core.ingest;

import com.apptrace.service.core.decode.OtlpRecordDecoder;
import com.apptrace.service.core.spi.LogStorage;
import com.apptrace.telemetry.model.LogRecord;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class LogIngestService {

    private final OtlpRecordDecoder decoder;
    private final LogStorage storage;

    public ExportOutcome export(ExportLogsServiceRequest request) {
        try {
            List<LogRecord> records = decoder.decodeLogs(request);
            storage.insertBatch(records);
            log.info("Processed {} log records", records.size());
            return ExportOutcome.success();
        } catch (Exception e) {
            long rejected = decoder.countLogRecords(request);
            log.error("Failed to store {} log records", rejected, e);
            return ExportOutcome.rejected(rejected, e);
        }
    }
}
