package com.apptrace.service.storage.jdbc;

import com.apptrace.service.core.impl.JsonUtil;
import com.apptrace.service.storage.bulk.PgBinaryCopyEncoder;
import com.apptrace.telemetry.model.MetricRecord;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

public final class MetricTable extends RecordTable<MetricRecord> {

    public static final String DESCRIPTION = "metric data points";

    private static final String INSERT_SQL =
            """
            insert into metrics (id, name, timestamp, value, attributes, service_name)
            values (:id, :name, :timestamp, :value, cast(:attributes as jsonb), :service_name)
            """;

    public MetricTable() {
        super(
                "metrics",
                DESCRIPTION,
                "timestamp",
                List.of("id", "name", "timestamp", "value", "attributes", "service_name"));
    }

    @Override
    public String insertSql() {
        return INSERT_SQL;
    }

    @Override
    public SqlParameterSource parameters(MetricRecord metric) {
        return new MapSqlParameterSource()
                .addValue("id", metric.id())
                .addValue("name", metric.name())
                .addValue("timestamp", utc(metric.timestamp()), TIMESTAMPTZ)
                .addValue("value", metric.value())
                .addValue("attributes", JsonUtil.attributesToJson(metric.attributes()))
                .addValue("service_name", metric.serviceName());
    }

    @Override
    public RowMapper<MetricRecord> rowMapper() {
        return (rs, rowNum) -> new MetricRecord(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                instant(rs, "timestamp"),
                rs.getDouble("value"),
                JsonUtil.attributesFromJson(rs.getString("attributes")));
    }

    @Override
    public void writeCopyRow(MetricRecord metric, PgBinaryCopyEncoder encoder) throws IOException {
        encoder.startRow(columns().size());
        encoder.writeUuid(metric.id());
        encoder.writeText(metric.name());
        encoder.writeTimestamp(metric.timestamp());
        encoder.writeDouble(metric.value());
        encoder.writeJsonb(JsonUtil.attributesToJson(metric.attributes()));
        encoder.writeText(metric.serviceName());
    }
}
