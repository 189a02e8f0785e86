package com.apptrace.service.core.spi;

/** A read or write against a persistent backend failed. The message carries the underlying cause. */
public class StorageFailure extends RuntimeException {

    public StorageFailure(String message, Throwable cause) {
        super(message, cause);
    }

    /** Wraps {@code cause} with a message of the form {@code "<action>: <cause message>"}. */
    public static StorageFailure of(String action, Throwable cause) {
        if (cause instanceof StorageFailure failure) {
            return failure;
        }
        String detail = (cause.getMessage() == null || cause.getMessage().isBlank())
                ? cause.getClass().getSimpleName()
                : cause.getMessage();
        return new StorageFailure(action + ": " + detail, cause);
    }
}
