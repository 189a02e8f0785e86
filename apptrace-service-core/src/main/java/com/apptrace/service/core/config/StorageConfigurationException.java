package com.apptrace.service.core.config;

/** Invalid storage configuration. Raised while the application context starts, so nothing is served. */
public class StorageConfigurationException extends IllegalStateException {

    public StorageConfigurationException(String message) {
        super(message);
    }
}
