package com.apptrace.service.storage.bulk;

import com.apptrace.service.core.spi.TraceStorage;
import com.apptrace.service.storage.jdbc.SpanTable;
import com.apptrace.telemetry.model.SpanRecord;
import java.util.List;

public class BulkTraceStorage implements TraceStorage {

    private final TraceStorage rows;
    private final FallbackBatchWriter<SpanRecord> writer;

    public BulkTraceStorage(TraceStorage rows, BatchWriter<SpanRecord> fastPath) {
        this.rows = rows;
        this.writer = new FallbackBatchWriter<>(SpanTable.DESCRIPTION, fastPath, rows::insertBatch);
    }

    @Override
    public void insertBatch(List<SpanRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        writer.write(records);
    }

    @Override
    public List<SpanRecord> getPage(int limit, int offset) {
        return rows.getPage(limit, offset);
    }

    @Override
    public List<SpanRecord> getByTraceId(String traceId) {
        return rows.getByTraceId(traceId);
    }
}
