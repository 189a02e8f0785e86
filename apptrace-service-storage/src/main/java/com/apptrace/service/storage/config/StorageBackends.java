package com.apptrace.service.storage.config;

import com.apptrace.service.core.config.StorageType;
import com.apptrace.service.core.spi.LogStorage;
import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.service.core.spi.TraceStorage;
import com.zaxxer.hikari.HikariDataSource;

/**
 * The three storages chosen at startup, plus the pool they share.
 *
 * @param dataSource null for {@link StorageType#MEMORY}
 */
public record StorageBackends(
        StorageType type, LogStorage logs, TraceStorage traces, MetricStorage metrics, HikariDataSource dataSource)
        implements AutoCloseable {

    @Override
    public void close() {
        if (dataSource != null) {
            dataSource.close();
        }
    }
}
