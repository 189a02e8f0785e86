package com.apptrace.service.storage.jdbc;

import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.service.core.spi.RecordPage;
import com.apptrace.telemetry.model.MetricRecord;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

public class JdbcMetricStorage extends JdbcRecordStorage<MetricRecord> implements MetricStorage {

    public JdbcMetricStorage(NamedParameterJdbcTemplate jdbc, TransactionTemplate tx) {
        super(jdbc, tx, new MetricTable());
    }

    @Override
    public List<MetricRecord> search(String term, int limit, int offset) {
        return queryPage(
                "(name ILIKE :term OR attributes::text ILIKE :term)",
                new MapSqlParameterSource("term", containsPattern(term)),
                RecordPage.of(limit, offset));
    }

    @Override
    public List<MetricRecord> findByName(String name, int limit, int offset) {
        return queryPage(
                "name ILIKE :term", new MapSqlParameterSource("term", containsPattern(name)), RecordPage.of(limit, offset));
    }
}
