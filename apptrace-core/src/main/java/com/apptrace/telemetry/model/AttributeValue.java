package com.apptrace.telemetry.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Scalar attribute value carried by every telemetry record.
 *
 * <p>The variant set mirrors the OTLP {@code AnyValue} scalars: string, bool, int64, float64 and
 * byte sequence. Anything richer is degraded to a {@link StringValue} by the decoder.
 */
public sealed interface AttributeValue
        permits AttributeValue.StringValue,
                AttributeValue.BoolValue,
                AttributeValue.IntValue,
                AttributeValue.DoubleValue,
                AttributeValue.BytesValue {

    /** Value as written to JSON: String, Boolean, Long, Double, or lowercase hex for bytes. */
    @JsonValue
    Object jsonValue();

    /** Human readable form, used for service name projection and text search. */
    String asText();

    static AttributeValue of(String value) {
        return new StringValue(value);
    }

    static AttributeValue of(boolean value) {
        return new BoolValue(value);
    }

    static AttributeValue of(long value) {
        return new IntValue(value);
    }

    static AttributeValue of(double value) {
        return new DoubleValue(value);
    }

    static AttributeValue of(byte[] value) {
        return new BytesValue(value);
    }

    record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object jsonValue() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record BoolValue(boolean value) implements AttributeValue {
        @Override
        public Object jsonValue() {
            return value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record IntValue(long value) implements AttributeValue {
        @Override
        public Object jsonValue() {
            return value;
        }

        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record DoubleValue(double value) implements AttributeValue {
        @Override
        public Object jsonValue() {
            return value;
        }

        @Override
        public String asText() {
            return Double.toString(value);
        }
    }

    /** Byte sequence; compared by content, rendered as lowercase hex. */
    record BytesValue(byte[] value) implements AttributeValue {
        public BytesValue {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public Object jsonValue() {
            return asText();
        }

        @Override
        public String asText() {
            return HexFormat.of().formatHex(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[" + asText() + "]";
        }
    }
}
