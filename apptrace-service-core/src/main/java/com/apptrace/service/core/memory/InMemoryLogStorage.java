package com.apptrace.service.core.memory;

import com.apptrace.service.core.spi.LogStorage;
import com.apptrace.service.core.spi.RecordPage;
import com.apptrace.telemetry.model.LogRecord;
import java.util.Comparator;
import java.util.List;

/** Process-local log store for development and tests. Nothing survives a restart. */
public class InMemoryLogStorage implements LogStorage {

    private static final Comparator<LogRecord> NEWEST_FIRST =
            Comparator.comparing(LogRecord::timestamp).reversed();

    private final InMemoryRecordStore<LogRecord> store;

    public InMemoryLogStorage() {
        this(new InMemoryRecordStore<>());
    }

    InMemoryLogStorage(InMemoryRecordStore<LogRecord> store) {
        this.store = store;
    }

    @Override
    public void insertBatch(List<LogRecord> records) {
        store.append(records);
    }

    @Override
    public List<LogRecord> getPage(int limit, int offset) {
        return store.select(log -> true, NEWEST_FIRST, RecordPage.of(limit, offset));
    }

    @Override
    public List<LogRecord> search(String term, int limit, int offset) {
        String needle = TextMatch.normalize(term);
        return store.select(
                log -> TextMatch.contains(log.body(), needle)
                        || TextMatch.containsInAttributes(log.attributes(), needle),
                NEWEST_FIRST,
                RecordPage.of(limit, offset));
    }
}
