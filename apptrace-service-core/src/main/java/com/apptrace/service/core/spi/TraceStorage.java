package com.apptrace.service.core.spi;

import com.apptrace.telemetry.model.SpanRecord;
import java.util.List;

public interface TraceStorage extends RecordStorage<SpanRecord> {

    /** Every span of the trace, oldest start time first (root-to-leaf order). */
    List<SpanRecord> getByTraceId(String traceId);
}
