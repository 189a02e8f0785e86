package com.apptrace.service.storage.config;

import com.apptrace.service.core.config.StorageProperties;
import com.apptrace.service.core.config.StorageSettings;
import com.apptrace.service.core.spi.LogStorage;
import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.service.core.spi.TraceStorage;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resolves {@code apptrace.storage.*} once and exposes the chosen storages as singletons. */
@Configuration
public class StorageConfiguration {

    @Bean
    public StorageSettings storageSettings(StorageProperties properties) {
        return StorageSettings.resolve(properties);
    }

    @Bean(destroyMethod = "close")
    public StorageBackends storageBackends(StorageSettings settings) {
        return new StorageBackendSelector().select(settings);
    }

    @Bean
    public LogStorage logStorage(StorageBackends backends) {
        return backends.logs();
    }

    @Bean
    public TraceStorage traceStorage(StorageBackends backends) {
        return backends.traces();
    }

    @Bean
    public MetricStorage metricStorage(StorageBackends backends) {
        return backends.metrics();
    }
}
