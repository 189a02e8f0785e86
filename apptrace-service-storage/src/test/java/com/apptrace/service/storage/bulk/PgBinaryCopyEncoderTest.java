package com.apptrace.service.storage.bulk;

import static org.assertj.core.api.Assertions.assertThat;

import com.apptrace.service.storage.jdbc.MetricTable;
import com.apptrace.telemetry.model.MetricRecord;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class PgBinaryCopyEncoderTest {

    @Test
    void headerIsSignatureFlagsAndExtension() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new PgBinaryCopyEncoder(bytes).writeHeader();

        byte[] expected = {
            'P', 'G', 'C', 'O', 'P', 'Y', '\n', (byte) 0xFF, '\r', '\n', 0, 0, 0, 0, 0, 0, 0, 0, 0
        };
        assertThat(bytes.toByteArray()).isEqualTo(expected);
    }

    @Test
    void timestampsCountMicrosFromTheYear2000() {
        assertThat(PgBinaryCopyEncoder.toPgMicros(Instant.parse("2000-01-01T00:00:00Z"))).isZero();
        assertThat(PgBinaryCopyEncoder.toPgMicros(Instant.parse("2000-01-01T00:00:01.000001999Z")))
                .isEqualTo(1_000_001L);
        assertThat(PgBinaryCopyEncoder.toPgMicros(Instant.parse("1999-12-31T23:59:59Z"))).isEqualTo(-1_000_000L);
    }

    @Test
    void metricRowIsLengthPrefixedFieldByField() throws Exception {
        UUID id = new UUID(0x0102030405060708L, 0x090A0B0C0D0E0F10L);
        MetricRecord metric = new MetricRecord(id, "cpu", Instant.parse("2000-01-01T00:00:02Z"), 0.5, Map.of());
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PgBinaryCopyEncoder encoder = new PgBinaryCopyEncoder(bytes);

        new MetricTable().writeCopyRow(metric, encoder);
        encoder.writeTrailer();

        DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes.toByteArray()));
        assertThat(in.readShort()).isEqualTo((short) 6);

        assertThat(in.readInt()).isEqualTo(16);
        assertThat(in.readLong()).isEqualTo(0x0102030405060708L);
        assertThat(in.readLong()).isEqualTo(0x090A0B0C0D0E0F10L);

        assertThat(in.readInt()).isEqualTo(3);
        assertThat(new String(in.readNBytes(3), StandardCharsets.UTF_8)).isEqualTo("cpu");

        assertThat(in.readInt()).isEqualTo(8);
        assertThat(in.readLong()).isEqualTo(2_000_000L);

        assertThat(in.readInt()).isEqualTo(8);
        assertThat(in.readDouble()).isEqualTo(0.5);

        String json = "{\"service.name\":\"unknown\"}";
        assertThat(in.readInt()).isEqualTo(json.length() + 1);
        assertThat(in.readByte()).isEqualTo((byte) 1);
        assertThat(new String(in.readNBytes(json.length()), StandardCharsets.UTF_8)).isEqualTo(json);

        assertThat(in.readInt()).isEqualTo(7);
        assertThat(new String(in.readNBytes(7), StandardCharsets.UTF_8)).isEqualTo("unknown");

        assertThat(in.readShort()).isEqualTo((short) -1);
        assertThat(in.available()).isZero();
    }

    @Test
    void nullsAreMinusOneWithoutPayload() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PgBinaryCopyEncoder encoder = new PgBinaryCopyEncoder(bytes);

        encoder.writeText(null);
        encoder.writeUuid(null);

        byte[] minusOne = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
        byte[] out = bytes.toByteArray();
        assertThat(Arrays.copyOfRange(out, 0, 4)).isEqualTo(minusOne);
        assertThat(Arrays.copyOfRange(out, 4, 8)).isEqualTo(minusOne);
        assertThat(out).hasSize(8);
    }
}
