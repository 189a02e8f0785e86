package com.apptrace.service.storage.bulk;

import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.service.storage.jdbc.MetricTable;
import com.apptrace.telemetry.model.MetricRecord;
import java.util.List;

public class BulkMetricStorage implements MetricStorage {

    private final MetricStorage rows;
    private final FallbackBatchWriter<MetricRecord> writer;

    public BulkMetricStorage(MetricStorage rows, BatchWriter<MetricRecord> fastPath) {
        this.rows = rows;
        this.writer = new FallbackBatchWriter<>(MetricTable.DESCRIPTION, fastPath, rows::insertBatch);
    }

    @Override
    public void insertBatch(List<MetricRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        writer.write(records);
    }

    @Override
    public List<MetricRecord> getPage(int limit, int offset) {
        return rows.getPage(limit, offset);
    }

    @Override
    public List<MetricRecord> search(String term, int limit, int offset) {
        return rows.search(term, limit, offset);
    }

    @Override
    public List<MetricRecord> findByName(String name, int limit, int offset) {
        return rows.findByName(name, limit, offset);
    }
}
