package com.apptrace.service.storage.bulk;

import com.apptrace.service.core.spi.LogStorage;
import com.apptrace.service.storage.jdbc.LogTable;
import com.apptrace.telemetry.model.LogRecord;
import java.util.List;

/** Writes through the COPY fast path, falling back to {@code rows}; reads go to {@code rows}. */
public class BulkLogStorage implements LogStorage {

    private final LogStorage rows;
    private final FallbackBatchWriter<LogRecord> writer;

    public BulkLogStorage(LogStorage rows, BatchWriter<LogRecord> fastPath) {
        this.rows = rows;
        this.writer = new FallbackBatchWriter<>(LogTable.DESCRIPTION, fastPath, rows::insertBatch);
    }

    @Override
    public void insertBatch(List<LogRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        writer.write(records);
    }

    @Override
    public List<LogRecord> getPage(int limit, int offset) {
        return rows.getPage(limit, offset);
    }

    @Override
    public List<LogRecord> search(String term, int limit, int offset) {
        return rows.search(term, limit, offset);
    }
}
