package com.apptrace.service.storage.config;

import com.apptrace.service.core.config.StorageSettings;
import com.apptrace.service.core.config.StorageType;
import com.apptrace.service.core.memory.InMemoryLogStorage;
import com.apptrace.service.core.memory.InMemoryMetricStorage;
import com.apptrace.service.core.memory.InMemoryTraceStorage;
import com.apptrace.service.core.spi.StorageFailure;
import com.apptrace.service.storage.bulk.BulkLogStorage;
import com.apptrace.service.storage.bulk.BulkMetricStorage;
import com.apptrace.service.storage.bulk.BulkTraceStorage;
import com.apptrace.service.storage.bulk.PgCopyBatchWriter;
import com.apptrace.service.storage.jdbc.JdbcLogStorage;
import com.apptrace.service.storage.jdbc.JdbcMetricStorage;
import com.apptrace.service.storage.jdbc.JdbcTraceStorage;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

/** Builds the storages for one {@link StorageSettings}. The pool opens its first connection lazily. */
public class StorageBackendSelector {

    private static final Logger log = LoggerFactory.getLogger(StorageBackendSelector.class);

    static final String SCHEMA_SCRIPT = "db/apptrace-schema.sql";

    public StorageBackends select(StorageSettings settings) {
        log.info("Using {} telemetry storage", settings.type());
        if (settings.type() == StorageType.MEMORY) {
            return new StorageBackends(
                    StorageType.MEMORY,
                    new InMemoryLogStorage(),
                    new InMemoryTraceStorage(),
                    new InMemoryMetricStorage(),
                    null);
        }

        HikariDataSource dataSource = dataSource(settings.connection());
        if (settings.initializeSchema()) {
            initializeSchema(dataSource);
        }
        NamedParameterJdbcTemplate jdbc = new NamedParameterJdbcTemplate(dataSource);
        TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        JdbcLogStorage logs = new JdbcLogStorage(jdbc, tx);
        JdbcTraceStorage traces = new JdbcTraceStorage(jdbc, tx);
        JdbcMetricStorage metrics = new JdbcMetricStorage(jdbc, tx);

        if (settings.type() == StorageType.STANDARD) {
            return new StorageBackends(StorageType.STANDARD, logs, traces, metrics, dataSource);
        }
        return new StorageBackends(
                StorageType.BULK,
                new BulkLogStorage(logs, new PgCopyBatchWriter<>(dataSource, logs.table())),
                new BulkTraceStorage(traces, new PgCopyBatchWriter<>(dataSource, traces.table())),
                new BulkMetricStorage(metrics, new PgCopyBatchWriter<>(dataSource, metrics.table())),
                dataSource);
    }

    static HikariDataSource dataSource(StorageSettings.ConnectionSettings connection) {
        HikariDataSource ds = new HikariDataSource();
        ds.setPoolName("apptrace-storage");
        ds.setJdbcUrl(connection.url());
        ds.setUsername(connection.username());
        ds.setPassword(connection.password());
        ds.setMaximumPoolSize(connection.maximumPoolSize());
        return ds;
    }

    private static void initializeSchema(HikariDataSource dataSource) {
        try {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT)).execute(dataSource);
            log.info("Applied {}", SCHEMA_SCRIPT);
        } catch (DataAccessException e) {
            dataSource.close();
            throw StorageFailure.of("Failed to initialize schema from " + SCHEMA_SCRIPT, e);
        }
    }
}
