package com.apptrace.service.storage.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.apptrace.service.core.spi.StorageFailure;
import com.apptrace.telemetry.model.AttributeValue;
import com.apptrace.telemetry.model.LogRecord;
import com.apptrace.telemetry.model.SpanRecord;
import java.sql.ResultSet;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class JdbcStorageTest {

    private static final Instant TS = Instant.parse("2024-02-10T10:15:30.123456Z");

    private NamedParameterJdbcTemplate jdbc;
    private PlatformTransactionManager txManager;
    private JdbcLogStorage logs;
    private JdbcTraceStorage traces;

    @BeforeEach
    void setUp() {
        jdbc = mock(NamedParameterJdbcTemplate.class);
        txManager = mock(PlatformTransactionManager.class);
        TransactionTemplate tx = new TransactionTemplate(txManager);
        logs = new JdbcLogStorage(jdbc, tx);
        traces = new JdbcTraceStorage(jdbc, tx);
    }

    @Test
    void emptyBatchTouchesNothing() {
        logs.insertBatch(List.of());
        traces.insertBatch(List.of());

        verifyNoInteractions(jdbc, txManager);
    }

    @Test
    void batchIsSentAsOneJdbcBatchInOneTransaction() {
        LogRecord log = new LogRecord(
                UUID.randomUUID(),
                TS,
                "abc",
                null,
                "INFO",
                "hello",
                Map.of("service.name", AttributeValue.of("checkout"), "retries", AttributeValue.of(2L)));

        logs.insertBatch(List.of(log, log));

        ArgumentCaptor<SqlParameterSource[]> batch = ArgumentCaptor.forClass(SqlParameterSource[].class);
        verify(jdbc).batchUpdate(eq(new LogTable().insertSql()), batch.capture());
        verify(txManager).commit(any());
        SqlParameterSource first = batch.getValue()[0];
        assertThat(batch.getValue()).hasSize(2);
        assertThat(first.getValue("service_name")).isEqualTo("checkout");
        assertThat(first.getValue("timestamp")).isEqualTo(OffsetDateTime.ofInstant(TS, ZoneOffset.UTC));
        assertThat((String) first.getValue("attributes")).contains("\"retries\":2").contains("\"service.name\":\"checkout\"");
        assertThat(first.getValue("span_id")).isNull();
    }

    @Test
    void databaseErrorBecomesStorageFailureAndRollsBack() {
        when(jdbc.batchUpdate(anyString(), any(SqlParameterSource[].class)))
                .thenThrow(new DataAccessResourceFailureException("Database connection failed"));
        LogRecord log = new LogRecord(UUID.randomUUID(), TS, null, null, "ERROR", "boom", Map.of());

        assertThatThrownBy(() -> logs.insertBatch(List.of(log, log)))
                .isInstanceOf(StorageFailure.class)
                .hasMessage("Failed to insert 2 log records: Database connection failed");
        verify(txManager).rollback(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void pagesAreOrderedNewestFirstWithLimitAndOffset() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class))).thenReturn(List.of());

        logs.getPage(25, 50);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).query(sql.capture(), params.capture(), any(RowMapper.class));
        assertThat(sql.getValue())
                .startsWith("SELECT id, timestamp, trace_id")
                .endsWith("FROM logs ORDER BY timestamp DESC LIMIT :limit OFFSET :offset");
        assertThat(params.getValue().getValue("limit")).isEqualTo(25);
        assertThat(params.getValue().getValue("offset")).isEqualTo(50);
    }

    @Test
    @SuppressWarnings("unchecked")
    void searchEscapesWildcards() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class))).thenReturn(List.of());

        logs.search("50%_off", 10, 0);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).query(sql.capture(), params.capture(), any(RowMapper.class));
        assertThat(sql.getValue()).contains("WHERE (body ILIKE :term OR attributes::text ILIKE :term)");
        assertThat(params.getValue().getValue("term")).isEqualTo("%50\\%\\_off%");
    }

    @Test
    void zeroLimitSkipsTheDatabase() {
        assertThat(logs.getPage(0, 0)).isEmpty();
        verifyNoInteractions(jdbc);
    }

    @Test
    @SuppressWarnings("unchecked")
    void traceLookupIsAscendingByStart() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class))).thenReturn(List.of());

        traces.getByTraceId("0af7651916cd43dd8448eb211c80319c");

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbc).query(sql.capture(), any(SqlParameterSource.class), any(RowMapper.class));
        assertThat(sql.getValue())
                .contains("FROM traces WHERE trace_id = :trace_id")
                .endsWith("ORDER BY start_time ASC")
                .doesNotContain("duration_ms");
    }

    @Test
    void readFailureBecomesStorageFailure() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(() -> traces.getPage(10, 0))
                .isInstanceOf(StorageFailure.class)
                .hasMessage("Failed to read spans: timeout");
    }

    @Test
    void spanRowsMapBackToRecords() throws Exception {
        UUID id = UUID.randomUUID();
        ResultSet rs = mock(ResultSet.class);
        when(rs.getObject("id", UUID.class)).thenReturn(id);
        when(rs.getString("trace_id")).thenReturn("t1");
        when(rs.getString("span_id")).thenReturn("s1");
        when(rs.getString("parent_span_id")).thenReturn(null);
        when(rs.getString("name")).thenReturn("GET /");
        when(rs.getObject("start_time", OffsetDateTime.class)).thenReturn(OffsetDateTime.ofInstant(TS, ZoneOffset.UTC));
        when(rs.getObject("end_time", OffsetDateTime.class))
                .thenReturn(OffsetDateTime.ofInstant(TS.plusMillis(40), ZoneOffset.UTC));
        when(rs.getString("attributes")).thenReturn("{\"service.name\":\"web\",\"http.status\":200}");
        when(rs.getString("status")).thenReturn("ERROR");

        SpanRecord span = new SpanTable().rowMapper().mapRow(rs, 0);

        assertThat(span.id()).isEqualTo(id);
        assertThat(span.serviceName()).isEqualTo("web");
        assertThat(span.attributes()).containsEntry("http.status", AttributeValue.of(200L));
        assertThat(span.durationMillis()).isEqualTo(40.0);
        assertThat(span.status()).isEqualTo("ERROR");
        assertThat(span.isRoot()).isTrue();
    }

    @Test
    void copyColumnsNeverIncludeGeneratedDuration() {
        assertThat(new SpanTable().copySql())
                .isEqualTo("COPY traces (id, trace_id, span_id, parent_span_id, name, start_time, end_time, attributes,"
                        + " status, service_name) FROM STDIN (FORMAT BINARY)");
    }
}
