package com.apptrace.service.core.spi;

import java.util.List;

/**
 * Storage contract shared by every record kind.
 *
 * @param <R> record type (log, span or metric)
 */
public interface RecordStorage<R> {

    /**
     * Persists every record of the batch. An empty batch is a no-op that acquires no lock or
     * connection. Records become visible to reads only once this method returns.
     *
     * @throws StorageFailure when a non-memory backend cannot store the batch
     */
    void insertBatch(List<R> records);

    /**
     * Newest first by the kind's time field, skipping {@code offset} and taking at most
     * {@code limit}. A zero limit or an offset past the end yields an empty list.
     *
     * @throws IllegalArgumentException for a negative limit or offset
     */
    List<R> getPage(int limit, int offset);
}
