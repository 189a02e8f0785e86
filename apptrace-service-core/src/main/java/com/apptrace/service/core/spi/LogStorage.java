package com.apptrace.service.core.spi;

import com.apptrace.telemetry.model.LogRecord;
import java.util.List;

public interface LogStorage extends RecordStorage<LogRecord> {

    /**
     * Case-insensitive substring match on the body or the serialized attributes, ordered and paged
     * like {@link #getPage(int, int)}.
     */
    List<LogRecord> search(String term, int limit, int offset);
}
