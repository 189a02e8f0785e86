package com.apptrace.service.core.decode;

import com.apptrace.telemetry.model.AttributeValue;
import com.apptrace.telemetry.model.TelemetryAttributes;
import com.google.protobuf.ByteString;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.resource.v1.Resource;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Conversions from OTLP wire values. None of them throw for odd input; they degrade to text. */
final class OtlpValues {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final HexFormat HEX = HexFormat.of();

    private OtlpValues() {}

    /** {@code fixed64} nanoseconds since the Unix epoch, read as unsigned. */
    static Instant toInstant(long unixNano) {
        return Instant.ofEpochSecond(
                Long.divideUnsigned(unixNano, NANOS_PER_SECOND), Long.remainderUnsigned(unixNano, NANOS_PER_SECOND));
    }

    static String hex(ByteString bytes) {
        return HEX.formatHex(bytes.toByteArray());
    }

    static String hexOrNull(ByteString bytes) {
        return bytes.isEmpty() ? null : hex(bytes);
    }

    static String serviceName(Resource resource) {
        for (KeyValue kv : resource.getAttributesList()) {
            if (TelemetryAttributes.SERVICE_NAME.equals(kv.getKey())) {
                String name = render(kv.getValue());
                return name.isBlank() ? TelemetryAttributes.UNKNOWN_SERVICE : name;
            }
        }
        return TelemetryAttributes.UNKNOWN_SERVICE;
    }

    /** Resource service name first, then the record's own attributes (which may override it). */
    static Map<String, AttributeValue> attributes(String serviceName, List<KeyValue> keyValues) {
        Map<String, AttributeValue> out = new LinkedHashMap<>();
        out.put(TelemetryAttributes.SERVICE_NAME, AttributeValue.of(serviceName));
        for (KeyValue kv : keyValues) {
            if (!kv.getKey().isEmpty()) {
                out.put(kv.getKey(), toAttributeValue(kv.getValue()));
            }
        }
        return out;
    }

    static AttributeValue toAttributeValue(AnyValue value) {
        return switch (value.getValueCase()) {
            case STRING_VALUE -> AttributeValue.of(value.getStringValue());
            case BOOL_VALUE -> AttributeValue.of(value.getBoolValue());
            case INT_VALUE -> AttributeValue.of(value.getIntValue());
            case DOUBLE_VALUE -> AttributeValue.of(value.getDoubleValue());
            case BYTES_VALUE -> AttributeValue.of(value.getBytesValue().toByteArray());
            default -> AttributeValue.of(render(value));
        };
    }

    /** Text form of any value: arrays as {@code [a, b]}, key-value lists as {@code {k=v}}, unset as empty. */
    static String render(AnyValue value) {
        return switch (value.getValueCase()) {
            case STRING_VALUE -> value.getStringValue();
            case BOOL_VALUE -> Boolean.toString(value.getBoolValue());
            case INT_VALUE -> Long.toString(value.getIntValue());
            case DOUBLE_VALUE -> Double.toString(value.getDoubleValue());
            case BYTES_VALUE -> hex(value.getBytesValue());
            case ARRAY_VALUE -> value.getArrayValue().getValuesList().stream()
                    .map(OtlpValues::render)
                    .collect(Collectors.joining(", ", "[", "]"));
            case KVLIST_VALUE -> value.getKvlistValue().getValuesList().stream()
                    .map(kv -> kv.getKey() + "=" + render(kv.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
            default -> "";
        };
    }
}
