package com.apptrace.service.core.memory;

import com.apptrace.service.core.spi.RecordPage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Append-only list guarded by one lock. The lock covers the append and the snapshot copy only;
 * filtering, sorting and paging run on the copy.
 */
public class InMemoryRecordStore<R> {

    private final List<R> records = new ArrayList<>();
    private final Lock lock;

    public InMemoryRecordStore() {
        this(new ReentrantLock());
    }

    InMemoryRecordStore(Lock lock) {
        this.lock = lock;
    }

    public void append(List<R> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        List<R> copy = List.copyOf(batch);
        lock.lock();
        try {
            records.addAll(copy);
        } finally {
            lock.unlock();
        }
    }

    public List<R> select(Predicate<? super R> filter, Comparator<? super R> order, RecordPage page) {
        if (page.isEmpty()) {
            return List.of();
        }
        return snapshot().stream()
                .filter(filter)
                .sorted(order)
                .skip(page.offset())
                .limit(page.limit())
                .toList();
    }

    public List<R> selectAll(Predicate<? super R> filter, Comparator<? super R> order) {
        return snapshot().stream().filter(filter).sorted(order).toList();
    }

    private List<R> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(records);
        } finally {
            lock.unlock();
        }
    }
}
