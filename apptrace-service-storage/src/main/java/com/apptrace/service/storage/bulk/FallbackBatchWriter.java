package com.apptrace.service.storage.bulk;

import com.apptrace.service.core.spi.StorageFailure;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-stage write: the primary writer first, and on any failure the secondary. Only a failure of
 * the secondary reaches the caller, as a {@link StorageFailure}.
 *
 * <p>The primary must be all-or-nothing (a single COPY statement is), otherwise the secondary could
 * store rows twice.
 */
public class FallbackBatchWriter<R> implements BatchWriter<R> {

    private static final Logger log = LoggerFactory.getLogger(FallbackBatchWriter.class);

    private final String description;
    private final BatchWriter<R> primary;
    private final BatchWriter<R> secondary;

    public FallbackBatchWriter(String description, BatchWriter<R> primary, BatchWriter<R> secondary) {
        this.description = description;
        this.primary = primary;
        this.secondary = secondary;
    }

    @Override
    public void write(List<R> records) {
        try {
            primary.write(records);
            return;
        } catch (Exception e) {
            log.warn(
                    "Bulk copy of {} {} failed, falling back to row inserts: {}",
                    records.size(),
                    description,
                    e.getMessage(),
                    e);
        }
        try {
            secondary.write(records);
        } catch (Exception e) {
            throw StorageFailure.of("Failed to insert " + records.size() + " " + description, e);
        }
    }
}
