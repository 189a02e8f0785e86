package com.apptrace.service.storage.jdbc;

import com.apptrace.service.core.impl.JsonUtil;
import com.apptrace.service.storage.bulk.PgBinaryCopyEncoder;
import com.apptrace.telemetry.model.SpanRecord;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

/** The {@code traces} table. {@code duration_ms} is generated by the database and never written. */
public final class SpanTable extends RecordTable<SpanRecord> {

    public static final String DESCRIPTION = "spans";

    private static final String INSERT_SQL =
            """
            insert into traces (id, trace_id, span_id, parent_span_id, name, start_time, end_time, attributes, status, service_name)
            values (:id, :trace_id, :span_id, :parent_span_id, :name, :start_time, :end_time, cast(:attributes as jsonb), :status, :service_name)
            """;

    public SpanTable() {
        super(
                "traces",
                DESCRIPTION,
                "start_time",
                List.of(
                        "id",
                        "trace_id",
                        "span_id",
                        "parent_span_id",
                        "name",
                        "start_time",
                        "end_time",
                        "attributes",
                        "status",
                        "service_name"));
    }

    @Override
    public String insertSql() {
        return INSERT_SQL;
    }

    @Override
    public SqlParameterSource parameters(SpanRecord span) {
        return new MapSqlParameterSource()
                .addValue("id", span.id())
                .addValue("trace_id", span.traceId())
                .addValue("span_id", span.spanId())
                .addValue("parent_span_id", span.parentSpanId())
                .addValue("name", span.name())
                .addValue("start_time", utc(span.startTime()), TIMESTAMPTZ)
                .addValue("end_time", utc(span.endTime()), TIMESTAMPTZ)
                .addValue("attributes", JsonUtil.attributesToJson(span.attributes()))
                .addValue("status", span.status())
                .addValue("service_name", span.serviceName());
    }

    @Override
    public RowMapper<SpanRecord> rowMapper() {
        return (rs, rowNum) -> new SpanRecord(
                rs.getObject("id", UUID.class),
                rs.getString("trace_id"),
                rs.getString("span_id"),
                rs.getString("parent_span_id"),
                rs.getString("name"),
                instant(rs, "start_time"),
                instant(rs, "end_time"),
                JsonUtil.attributesFromJson(rs.getString("attributes")),
                rs.getString("status"));
    }

    @Override
    public void writeCopyRow(SpanRecord span, PgBinaryCopyEncoder encoder) throws IOException {
        encoder.startRow(columns().size());
        encoder.writeUuid(span.id());
        encoder.writeText(span.traceId());
        encoder.writeText(span.spanId());
        encoder.writeText(span.parentSpanId());
        encoder.writeText(span.name());
        encoder.writeTimestamp(span.startTime());
        encoder.writeTimestamp(span.endTime());
        encoder.writeJsonb(JsonUtil.attributesToJson(span.attributes()));
        encoder.writeText(span.status());
        encoder.writeText(span.serviceName());
    }
}
