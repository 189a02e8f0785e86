package com.apptrace.service.storage.bulk;

import com.apptrace.service.storage.jdbc.RecordTable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import javax.sql.DataSource;
import org.postgresql.PGConnection;
import org.postgresql.copy.PGCopyOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a batch through one {@code COPY <table> FROM STDIN (FORMAT BINARY)} statement. The copy
 * is a single statement, so either every row lands or none does.
 */
public class PgCopyBatchWriter<R> implements BatchWriter<R> {

    private static final Logger log = LoggerFactory.getLogger(PgCopyBatchWriter.class);

    private final DataSource dataSource;
    private final RecordTable<R> table;

    public PgCopyBatchWriter(DataSource dataSource, RecordTable<R> table) {
        this.dataSource = dataSource;
        this.table = table;
    }

    @Override
    public void write(List<R> records) throws SQLException, IOException {
        try (Connection connection = dataSource.getConnection()) {
            PGConnection pg = connection.unwrap(PGConnection.class);
            PGCopyOutputStream stream = new PGCopyOutputStream(pg, table.copySql());
            try {
                PgBinaryCopyEncoder encoder = new PgBinaryCopyEncoder(stream);
                encoder.writeHeader();
                for (R record : records) {
                    table.writeCopyRow(record, encoder);
                }
                encoder.writeTrailer();
                long copied = stream.endCopy();
                log.debug("Copied {} {} into {}", copied, table.description(), table.name());
            } catch (SQLException | IOException | RuntimeException e) {
                cancel(stream, e);
                throw e;
            }
        }
    }

    private static void cancel(PGCopyOutputStream stream, Exception failure) {
        try {
            if (stream.isActive()) {
                stream.cancelCopy();
            }
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }
}
