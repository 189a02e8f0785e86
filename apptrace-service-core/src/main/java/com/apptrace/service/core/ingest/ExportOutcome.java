package com.apptrace.service.core.ingest;

/**
 * Result of one export call. A failed batch is rejected as a whole: {@code rejectedCount} is the
 * number of entries in the request and {@code errorMessage} the cause.
 */
public record ExportOutcome(long rejectedCount, String errorMessage) {

    private static final ExportOutcome SUCCESS = new ExportOutcome(0, "");

    public ExportOutcome {
        errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public static ExportOutcome success() {
        return SUCCESS;
    }

    public static ExportOutcome rejected(long rejectedCount, Exception cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        return new ExportOutcome(rejectedCount, message);
    }

    public boolean isSuccess() {
        return rejectedCount == 0 && errorMessage.isEmpty();
    }
}
