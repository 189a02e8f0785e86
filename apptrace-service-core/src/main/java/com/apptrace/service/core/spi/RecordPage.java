package com.apptrace.service.core.spi;

/**
 * Limit/offset window used by every read. {@code offset} is 0-based; a zero limit is a valid,
 * empty page.
 */
public record RecordPage(int limit, int offset) {

    public static final int DEFAULT_LIMIT = 100;

    public RecordPage {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0 but was " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0 but was " + offset);
    }

    public static RecordPage of(int limit, int offset) {
        return new RecordPage(limit, offset);
    }

    /** Nulls fall back to the defaults (limit 100, offset 0). */
    public static RecordPage of(Integer limit, Integer offset) {
        return new RecordPage(limit == null ? DEFAULT_LIMIT : limit, offset == null ? 0 : offset);
    }

    public boolean isEmpty() {
        return limit == 0;
    }
}
