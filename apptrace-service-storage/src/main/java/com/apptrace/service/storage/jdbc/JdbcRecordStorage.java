package com.apptrace.service.storage.jdbc;

import com.apptrace.service.core.spi.RecordPage;
import com.apptrace.service.core.spi.RecordStorage;
import com.apptrace.service.core.spi.StorageFailure;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Row backend: one parameterized insert per record, sent as a single JDBC batch inside one
 * transaction, so a batch is stored completely or not at all.
 */
public abstract class JdbcRecordStorage<R> implements RecordStorage<R> {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStorage.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final RecordTable<R> table;

    protected JdbcRecordStorage(NamedParameterJdbcTemplate jdbc, TransactionTemplate tx, RecordTable<R> table) {
        this.jdbc = jdbc;
        this.tx = tx;
        this.table = table;
    }

    public RecordTable<R> table() {
        return table;
    }

    @Override
    public void insertBatch(List<R> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch =
                records.stream().map(table::parameters).toArray(SqlParameterSource[]::new);
        try {
            tx.executeWithoutResult(status -> jdbc.batchUpdate(table.insertSql(), batch));
        } catch (DataAccessException | TransactionException e) {
            throw StorageFailure.of("Failed to insert " + records.size() + " " + table.description(), e);
        }
        log.debug("Inserted {} {} into {}", records.size(), table.description(), table.name());
    }

    @Override
    public List<R> getPage(int limit, int offset) {
        return queryPage(null, new MapSqlParameterSource(), RecordPage.of(limit, offset));
    }

    /**
     * Newest first by the table's time column.
     *
     * @param where optional condition over {@code params}, without the {@code WHERE} keyword
     */
    protected List<R> queryPage(String where, MapSqlParameterSource params, RecordPage page) {
        if (page.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder(table.selectSql());
        if (where != null) {
            sql.append(" WHERE ").append(where);
        }
        sql.append(" ORDER BY ").append(table.timeColumn()).append(" DESC LIMIT :limit OFFSET :offset");
        params.addValue("limit", page.limit()).addValue("offset", page.offset());
        return query(sql.toString(), params);
    }

    protected List<R> query(String sql, SqlParameterSource params) {
        try {
            return jdbc.query(sql, params, table.rowMapper());
        } catch (DataAccessException e) {
            throw StorageFailure.of("Failed to read " + table.description(), e);
        }
    }

    /** {@code ILIKE} pattern matching {@code term} anywhere, with wildcards in the term escaped. */
    protected static String containsPattern(String term) {
        String raw = term == null ? "" : term;
        String escaped = raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
