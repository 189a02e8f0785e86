package com.apptrace.service.storage.jdbc;

import com.apptrace.service.core.spi.TraceStorage;
import com.apptrace.telemetry.model.SpanRecord;
import java.util.List;
import java.util.Objects;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

public class JdbcTraceStorage extends JdbcRecordStorage<SpanRecord> implements TraceStorage {

    public JdbcTraceStorage(NamedParameterJdbcTemplate jdbc, TransactionTemplate tx) {
        super(jdbc, tx, new SpanTable());
    }

    @Override
    public List<SpanRecord> getByTraceId(String traceId) {
        Objects.requireNonNull(traceId, "traceId");
        return query(
                table().selectSql() + " WHERE trace_id = :trace_id ORDER BY start_time ASC",
                new MapSqlParameterSource("trace_id", traceId));
    }
}
