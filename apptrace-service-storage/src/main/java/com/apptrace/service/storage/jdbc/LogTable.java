package com.apptrace.service.storage.jdbc;

import com.apptrace.service.core.impl.JsonUtil;
import com.apptrace.service.storage.bulk.PgBinaryCopyEncoder;
import com.apptrace.telemetry.model.LogRecord;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

public final class LogTable extends RecordTable<LogRecord> {

    public static final String DESCRIPTION = "log records";

    private static final String INSERT_SQL =
            """
            insert into logs (id, timestamp, trace_id, span_id, severity, body, attributes, service_name)
            values (:id, :timestamp, :trace_id, :span_id, :severity, :body, cast(:attributes as jsonb), :service_name)
            """;

    public LogTable() {
        super(
                "logs",
                DESCRIPTION,
                "timestamp",
                List.of("id", "timestamp", "trace_id", "span_id", "severity", "body", "attributes", "service_name"));
    }

    @Override
    public String insertSql() {
        return INSERT_SQL;
    }

    @Override
    public SqlParameterSource parameters(LogRecord log) {
        return new MapSqlParameterSource()
                .addValue("id", log.id())
                .addValue("timestamp", utc(log.timestamp()), TIMESTAMPTZ)
                .addValue("trace_id", log.traceId())
                .addValue("span_id", log.spanId())
                .addValue("severity", log.severity())
                .addValue("body", log.body())
                .addValue("attributes", JsonUtil.attributesToJson(log.attributes()))
                .addValue("service_name", log.serviceName());
    }

    @Override
    public RowMapper<LogRecord> rowMapper() {
        return (rs, rowNum) -> new LogRecord(
                rs.getObject("id", UUID.class),
                instant(rs, "timestamp"),
                rs.getString("trace_id"),
                rs.getString("span_id"),
                rs.getString("severity"),
                rs.getString("body"),
                JsonUtil.attributesFromJson(rs.getString("attributes")));
    }

    @Override
    public void writeCopyRow(LogRecord log, PgBinaryCopyEncoder encoder) throws IOException {
        encoder.startRow(columns().size());
        encoder.writeUuid(log.id());
        encoder.writeTimestamp(log.timestamp());
        encoder.writeText(log.traceId());
        encoder.writeText(log.spanId());
        encoder.writeText(log.severity());
        encoder.writeText(log.body());
        encoder.writeJsonb(JsonUtil.attributesToJson(log.attributes()));
        encoder.writeText(log.serviceName());
    }
}
