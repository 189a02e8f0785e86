package com.apptrace.service.core.spi;

import com.apptrace.telemetry.model.MetricRecord;
import java.util.List;

public interface MetricStorage extends RecordStorage<MetricRecord> {

    /** Case-insensitive substring match on the metric name or the serialized attributes. */
    List<MetricRecord> search(String term, int limit, int offset);

    /** Case-insensitive substring match on the metric name only. */
    List<MetricRecord> findByName(String name, int limit, int offset);
}
