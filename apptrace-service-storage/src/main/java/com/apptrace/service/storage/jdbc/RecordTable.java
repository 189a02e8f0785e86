package com.apptrace.service.storage.jdbc;

import com.apptrace.service.storage.bulk.PgBinaryCopyEncoder;
import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

/**
 * Everything the row and bulk writers need to know about one table: its columns, the insert and
 * select statements, parameter binding, row mapping and the binary COPY row layout. The column
 * order of {@link #columns()} is the order {@link #writeCopyRow} writes fields in.
 */
public abstract class RecordTable<R> {

    static final int TIMESTAMPTZ = Types.TIMESTAMP_WITH_TIMEZONE;

    private final String name;
    private final String description;
    private final String timeColumn;
    private final List<String> columns;

    protected RecordTable(String name, String description, String timeColumn, List<String> columns) {
        this.name = name;
        this.description = description;
        this.timeColumn = timeColumn;
        this.columns = List.copyOf(columns);
    }

    public String name() {
        return name;
    }

    /** Plural noun used in log lines and failure messages, e.g. {@code "log records"}. */
    public String description() {
        return description;
    }

    public String timeColumn() {
        return timeColumn;
    }

    public List<String> columns() {
        return columns;
    }

    public String copySql() {
        return "COPY " + name + " (" + String.join(", ", columns) + ") FROM STDIN (FORMAT BINARY)";
    }

    /** {@code SELECT <columns> FROM <table>} without any clause. */
    public String selectSql() {
        return "SELECT " + String.join(", ", columns) + " FROM " + name;
    }

    public abstract String insertSql();

    public abstract SqlParameterSource parameters(R record);

    public abstract RowMapper<R> rowMapper();

    public abstract void writeCopyRow(R record, PgBinaryCopyEncoder encoder) throws IOException;

    static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
