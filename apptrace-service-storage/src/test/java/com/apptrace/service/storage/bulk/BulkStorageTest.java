package com.apptrace.service.storage.bulk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.apptrace.service.core.decode.OtlpRecordDecoder;
import com.apptrace.service.core.ingest.ExportOutcome;
import com.apptrace.service.core.ingest.LogIngestService;
import com.apptrace.service.core.memory.InMemoryLogStorage;
import com.apptrace.service.core.memory.InMemoryTraceStorage;
import com.apptrace.service.core.spi.MetricStorage;
import com.apptrace.service.core.spi.StorageFailure;
import com.apptrace.telemetry.model.LogRecord;
import com.apptrace.telemetry.model.MetricRecord;
import com.apptrace.telemetry.model.SpanRecord;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BulkStorageTest {

    private static final Instant TS = Instant.parse("2024-06-01T00:00:00Z");

    private static final BatchWriter<LogRecord> BROKEN_COPY = records -> {
        throw new SQLException("COPY not supported");
    };

    @Test
    void failedCopyFallsBackToRowsAndRecordsAreReadable() {
        InMemoryLogStorage rows = new InMemoryLogStorage();
        BulkLogStorage storage = new BulkLogStorage(rows, BROKEN_COPY);

        storage.insertBatch(List.of(log("one"), log("two")));

        assertThat(storage.getPage(10, 0)).extracting(LogRecord::body).containsExactlyInAnyOrder("one", "two");
        assertThat(storage.search("TWO", 10, 0)).hasSize(1);
    }

    @Test
    void ingestOverFallbackReportsSuccess() {
        BulkLogStorage storage = new BulkLogStorage(new InMemoryLogStorage(), BROKEN_COPY);
        LogIngestService service = new LogIngestService(new OtlpRecordDecoder(Clock.systemUTC()), storage);

        ExportOutcome outcome = service.export(ExportLogsServiceRequest.newBuilder()
                .addResourceLogs(ResourceLogs.newBuilder()
                        .addScopeLogs(ScopeLogs.newBuilder()
                                .addLogRecords(io.opentelemetry.proto.logs.v1.LogRecord.newBuilder()
                                        .setTimeUnixNano(1_717_200_000_000_000_000L)
                                        .setBody(AnyValue.newBuilder().setStringValue("fell back")))))
                .build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(storage.getPage(10, 0)).extracting(LogRecord::body).containsExactly("fell back");
    }

    @Test
    void successfulCopySkipsTheRowPath() throws Exception {
        InMemoryTraceStorage rows = new InMemoryTraceStorage();
        @SuppressWarnings("unchecked")
        BatchWriter<SpanRecord> copy = mock(BatchWriter.class);
        BulkTraceStorage storage = new BulkTraceStorage(rows, copy);
        List<SpanRecord> spans = List.of(new SpanRecord(UUID.randomUUID(), "t", "s", null, "op", TS, TS, Map.of(), null));

        storage.insertBatch(spans);

        verify(copy).write(spans);
        assertThat(rows.getPage(10, 0)).isEmpty();
    }

    @Test
    void failureOfBothStagesIsAStorageFailure() {
        MetricStorage rows = mock(MetricStorage.class);
        doThrow(new StorageFailure("Failed to insert 1 metric data points: Database connection failed", null))
                .when(rows)
                .insertBatch(anyList());
        BulkMetricStorage storage = new BulkMetricStorage(rows, records -> {
            throw new IOException("stream closed");
        });

        assertThatThrownBy(() -> storage.insertBatch(
                        List.of(new MetricRecord(UUID.randomUUID(), "m", TS, 1.0, Map.of()))))
                .isInstanceOf(StorageFailure.class)
                .hasMessageContaining("Database connection failed");
    }

    @Test
    void emptyBatchReachesNeitherStage() throws Exception {
        MetricStorage rows = mock(MetricStorage.class);
        @SuppressWarnings("unchecked")
        BatchWriter<MetricRecord> copy = mock(BatchWriter.class);

        new BulkMetricStorage(rows, copy).insertBatch(List.of());

        verifyNoInteractions(rows, copy);
    }

    @Test
    void fallbackWrapsNonStorageErrorsOfTheSecondary() {
        FallbackBatchWriter<String> writer = new FallbackBatchWriter<>(
                "items",
                records -> {
                    throw new SQLException("primary down");
                },
                records -> {
                    throw new IllegalStateException("secondary down");
                });

        assertThatThrownBy(() -> writer.write(List.of("a", "b")))
                .isInstanceOf(StorageFailure.class)
                .hasMessage("Failed to insert 2 items: secondary down")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void primarySuccessNeverCallsSecondary() throws Exception {
        @SuppressWarnings("unchecked")
        BatchWriter<String> secondary = mock(BatchWriter.class);
        FallbackBatchWriter<String> writer = new FallbackBatchWriter<>("items", records -> {}, secondary);

        writer.write(List.of("a"));

        verify(secondary, never()).write(anyList());
    }

    private static LogRecord log(String body) {
        return new LogRecord(UUID.randomUUID(), TS, null, null, "INFO", body, Map.of());
    }
}
