package com.apptrace.service.core.memory;

import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.service.core.spi.RecordPage;
import com.apptrace.telemetry.model.MetricRecord;
import java.util.Comparator;
import java.util.List;

public class InMemoryMetricStorage implements MetricStorage {

    private static final Comparator<MetricRecord> NEWEST_FIRST =
            Comparator.comparing(MetricRecord::timestamp).reversed();

    private final InMemoryRecordStore<MetricRecord> store;

    public InMemoryMetricStorage() {
        this(new InMemoryRecordStore<>());
    }

    InMemoryMetricStorage(InMemoryRecordStore<MetricRecord> store) {
        this.store = store;
    }

    @Override
    public void insertBatch(List<MetricRecord> records) {
        store.append(records);
    }

    @Override
    public List<MetricRecord> getPage(int limit, int offset) {
        return store.select(metric -> true, NEWEST_FIRST, RecordPage.of(limit, offset));
    }

    @Override
    public List<MetricRecord> search(String term, int limit, int offset) {
        String needle = TextMatch.normalize(term);
        return store.select(
                metric -> TextMatch.contains(metric.name(), needle)
                        || TextMatch.containsInAttributes(metric.attributes(), needle),
                NEWEST_FIRST,
                RecordPage.of(limit, offset));
    }

    @Override
    public List<MetricRecord> findByName(String name, int limit, int offset) {
        String needle = TextMatch.normalize(name);
        return store.select(
                metric -> TextMatch.contains(metric.name(), needle), NEWEST_FIRST, RecordPage.of(limit, offset));
    }
}
