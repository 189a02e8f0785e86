package com.apptrace.service.storage.jdbc;

import com.apptrace.service.core.spi.LogStorage;
import com.apptrace.service.core.spi.RecordPage;
import com.apptrace.telemetry.model.LogRecord;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

public class JdbcLogStorage extends JdbcRecordStorage<LogRecord> implements LogStorage {

    public JdbcLogStorage(NamedParameterJdbcTemplate jdbc, TransactionTemplate tx) {
        super(jdbc, tx, new LogTable());
    }

    @Override
    public List<LogRecord> search(String term, int limit, int offset) {
        return queryPage(
                "(body ILIKE :term OR attributes::text ILIKE :term)",
                new MapSqlParameterSource("term", containsPattern(term)),
                RecordPage.of(limit, offset));
    }
}
