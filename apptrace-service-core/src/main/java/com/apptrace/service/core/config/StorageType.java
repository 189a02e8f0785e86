package com.apptrace.service.core.config;

import java.util.Locale;

/** Storage backend variants. Exactly one is chosen at startup. */
public enum StorageType {
    /** Process-local lists; development and tests only. */
    MEMORY,
    /** One parameterized multi-row insert per batch. */
    STANDARD,
    /** Binary COPY stream with a fallback to {@link #STANDARD} inserts. */
    BULK;

    /**
     * Maps a configured value to a variant: {@code memory} (or {@code inmemory}), {@code standard},
     * {@code bulk} (or {@code highperformance}). Blank means {@code standard}.
     *
     * @throws StorageConfigurationException for any other value
     */
    public static StorageType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "memory", "inmemory" -> MEMORY;
            case "standard" -> STANDARD;
            case "bulk", "highperformance" -> BULK;
            default -> throw new StorageConfigurationException("Unknown storage type: " + value);
        };
    }

    public boolean requiresConnection() {
        return this != MEMORY;
    }
}
