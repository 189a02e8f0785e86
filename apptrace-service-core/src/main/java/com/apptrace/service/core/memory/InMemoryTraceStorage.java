package com.apptrace.service.core.memory;

import com.apptrace.service.core.spi.RecordPage;
import com.apptrace.service.core.spi.TraceStorage;
import com.apptrace.telemetry.model.SpanRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public class InMemoryTraceStorage implements TraceStorage {

    private static final Comparator<SpanRecord> OLDEST_FIRST = Comparator.comparing(SpanRecord::startTime);
    private static final Comparator<SpanRecord> NEWEST_FIRST = OLDEST_FIRST.reversed();

    private final InMemoryRecordStore<SpanRecord> store;

    public InMemoryTraceStorage() {
        this(new InMemoryRecordStore<>());
    }

    InMemoryTraceStorage(InMemoryRecordStore<SpanRecord> store) {
        this.store = store;
    }

    @Override
    public void insertBatch(List<SpanRecord> records) {
        store.append(records);
    }

    @Override
    public List<SpanRecord> getPage(int limit, int offset) {
        return store.select(span -> true, NEWEST_FIRST, RecordPage.of(limit, offset));
    }

    @Override
    public List<SpanRecord> getByTraceId(String traceId) {
        Objects.requireNonNull(traceId, "traceId");
        return store.selectAll(span -> traceId.equals(span.traceId()), OLDEST_FIRST);
    }
}
