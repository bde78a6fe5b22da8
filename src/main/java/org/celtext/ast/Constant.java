package org.celtext.ast;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Typed literal value held by {@link Expr.Const}.
 */
public sealed interface Constant {

    record BoolValue(boolean value) implements Constant {}

    /**
     * Byte string. The array is copied on the way in and on the way out.
     */
    record BytesValue(byte[] value) implements Constant {
        public BytesValue {
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public int size() {
            return value.length;
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
            return "BytesValue[" + HexFormat.of()
                                            .formatHex(value) + "]";
        }
    }

    record DoubleValue(double value) implements Constant {}

    record Int64Value(long value) implements Constant {}

    /**
     * Unsigned 64-bit integer; the bits are carried in a signed {@code long}.
     */
    record Uint64Value(long value) implements Constant {
        @Override
        public String toString() {
            return "Uint64Value[" + Long.toUnsignedString(value) + "]";
        }
    }

    enum NullValue implements Constant {
        INSTANCE
    }

    record StringValue(String value) implements Constant {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }
}
