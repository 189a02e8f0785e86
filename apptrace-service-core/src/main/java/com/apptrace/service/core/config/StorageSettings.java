package com.apptrace.service.core.config;

import java.util.Locale;

/**
 * Storage configuration resolved once at startup and handed to the backend selector. Immutable for
 * the lifetime of the process.
 *
 * @param connection null for {@link StorageType#MEMORY}
 */
public record StorageSettings(StorageType type, ConnectionSettings connection, boolean initializeSchema) {

    public record ConnectionSettings(String url, String username, String password, int maximumPoolSize) {}

    public static StorageSettings memory() {
        return new StorageSettings(StorageType.MEMORY, null, false);
    }

    /**
     * @throws StorageConfigurationException for an unknown type, or a persistent type without a
     *     connection url
     */
    public static StorageSettings resolve(StorageProperties props) {
        StorageType type = StorageType.fromConfig(props.getType());
        if (!type.requiresConnection()) {
            return memory();
        }
        StorageProperties.Connection c = props.getConnection();
        if (c == null || c.getUrl() == null || c.getUrl().isBlank()) {
            throw new StorageConfigurationException(
                    "apptrace.storage.connection.url is required for storage type " + type.name().toLowerCase(Locale.ROOT));
        }
        if (c.getMaximumPoolSize() < 1) {
            throw new StorageConfigurationException("apptrace.storage.connection.maximum-pool-size must be >= 1");
        }
        return new StorageSettings(
                type,
                new ConnectionSettings(c.getUrl().trim(), c.getUsername(), c.getPassword(), c.getMaximumPoolSize()),
                props.isInitializeSchema());
    }
}
