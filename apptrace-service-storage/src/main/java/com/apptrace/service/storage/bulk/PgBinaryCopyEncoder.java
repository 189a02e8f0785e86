package com.apptrace.service.storage.bulk;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes PostgreSQL {@code COPY ... (FORMAT BINARY)} streams: a fixed header, then per row a 16-bit
 * field count followed by length-prefixed fields, then a {@code -1} trailer. All integers are
 * big-endian.
 */
public class PgBinaryCopyEncoder {

    private static final byte[] SIGNATURE = {'P', 'G', 'C', 'O', 'P', 'Y', '\n', (byte) 0xFF, '\r', '\n', 0};
    private static final byte JSONB_VERSION = 1;
    private static final int NULL_LENGTH = -1;

    /** 2000-01-01T00:00:00Z, the PostgreSQL timestamp epoch, in Unix microseconds. */
    static final long PG_EPOCH_MICROS = 946_684_800_000_000L;

    private final DataOutputStream out;

    public PgBinaryCopyEncoder(OutputStream out) {
        this.out = new DataOutputStream(out);
    }

    public void writeHeader() throws IOException {
        out.write(SIGNATURE);
        out.writeInt(0); // flags
        out.writeInt(0); // header extension length
    }

    public void startRow(int fieldCount) throws IOException {
        out.writeShort(fieldCount);
    }

    public void writeUuid(UUID value) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }
        out.writeInt(16);
        out.writeLong(value.getMostSignificantBits());
        out.writeLong(value.getLeastSignificantBits());
    }

    /** {@code timestamptz}; sub-microsecond precision is truncated. */
    public void writeTimestamp(Instant value) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }
        out.writeInt(8);
        out.writeLong(toPgMicros(value));
    }

    public void writeText(String value) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    public void writeDouble(double value) throws IOException {
        out.writeInt(8);
        out.writeDouble(value);
    }

    public void writeJsonb(String json) throws IOException {
        if (json == null) {
            writeNull();
            return;
        }
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length + 1);
        out.writeByte(JSONB_VERSION);
        out.write(bytes);
    }

    public void writeNull() throws IOException {
        out.writeInt(NULL_LENGTH);
    }

    public void writeTrailer() throws IOException {
        out.writeShort(-1);
        out.flush();
    }

    static long toPgMicros(Instant instant) {
        long unixMicros = Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000);
        return unixMicros - PG_EPOCH_MICROS;
    }
}
