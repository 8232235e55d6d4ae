package io.jsonstream.serialiser;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Closed sum type over everything the {@link JsonWriter} can emit as a scalar value. The writer dispatches on
 * {@link #kind()} in a single place instead of relying on overload resolution.
 *
 * N.B. {@code char}, {@code short} and {@code byte} are written as (signed) integers.
 */
public final class WritableValue {
    public enum Kind {
        SIGNED_INTEGER,
        UNSIGNED_INTEGER,
        FLOAT,
        DOUBLE,
        BOOLEAN,
        TEXT,
        NULL,
        NUMBER
    }

    private static final WritableValue NULL_VALUE = new WritableValue(Kind.NULL, 0L, 0.0, null);
    private static final WritableValue TRUE_VALUE = new WritableValue(Kind.BOOLEAN, 1L, 0.0, null);
    private static final WritableValue FALSE_VALUE = new WritableValue(Kind.BOOLEAN, 0L, 0.0, null);
    private final Kind kind;
    private final long bits;
    private final double floating;
    private final Object reference;

    private WritableValue(final Kind kind, final long bits, final double floating, final Object reference) {
        this.kind = kind;
        this.bits = bits;
        this.floating = floating;
        this.reference = reference;
    }

    public static WritableValue of(final long value) {
        return new WritableValue(Kind.SIGNED_INTEGER, value, 0.0, null);
    }

    public static WritableValue of(final char value) {
        return of((long) value);
    }

    public static WritableValue ofUnsigned(final long value) {
        return new WritableValue(Kind.UNSIGNED_INTEGER, value, 0.0, null);
    }

    public static WritableValue ofUnsigned(final int value) {
        return ofUnsigned(Integer.toUnsignedLong(value));
    }

    public static WritableValue of(final float value) {
        return new WritableValue(Kind.FLOAT, 0L, value, null);
    }

    public static WritableValue of(final double value) {
        return new WritableValue(Kind.DOUBLE, 0L, value, null);
    }

    public static WritableValue of(final boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    /**
     * @param value text to be written, {@code null} is mapped to the JSON {@code null} literal
     * @return the corresponding value
     */
    public static WritableValue of(final CharSequence value) {
        return value == null ? NULL_VALUE : new WritableValue(Kind.TEXT, 0L, 0.0, value);
    }

    public static WritableValue of(final @NotNull NumberValue value) {
        return new WritableValue(Kind.NUMBER, 0L, 0.0, Objects.requireNonNull(value, "value"));
    }

    public static WritableValue nullValue() {
        return NULL_VALUE;
    }

    public @NotNull Kind kind() {
        return kind;
    }

    /**
     * @return signed value for {@link Kind#SIGNED_INTEGER}, raw 64-bit pattern for {@link Kind#UNSIGNED_INTEGER}
     */
    public long longValue() {
        checkKind(Kind.SIGNED_INTEGER, Kind.UNSIGNED_INTEGER);
        return bits;
    }

    public float floatValue() {
        checkKind(Kind.FLOAT, Kind.FLOAT);
        return (float) floating;
    }

    public double doubleValue() {
        checkKind(Kind.DOUBLE, Kind.DOUBLE);
        return floating;
    }

    public boolean booleanValue() {
        checkKind(Kind.BOOLEAN, Kind.BOOLEAN);
        return bits != 0L;
    }

    public CharSequence textValue() {
        checkKind(Kind.TEXT, Kind.TEXT);
        return (CharSequence) reference;
    }

    public NumberValue numberValue() {
        checkKind(Kind.NUMBER, Kind.NUMBER);
        return (NumberValue) reference;
    }

    /**
     * @return {@code true} if this is a floating point value (directly or wrapped) that JSON cannot represent
     */
    public boolean isNonFinite() {
        switch (kind) {
        case FLOAT:
        case DOUBLE:
            return !Double.isFinite(floating);
        case NUMBER:
            final NumberValue number = (NumberValue) reference;
            if (number.type() == NumberValue.Type.FLOAT) {
                return !Float.isFinite(number.floatValue());
            }
            return number.type() == NumberValue.Type.DOUBLE && !Double.isFinite(number.doubleValue());
        default:
            return false;
        }
    }

    private void checkKind(final Kind kindA, final Kind kindB) {
        if (kind != kindA && kind != kindB) {
            throw new IllegalStateException("value holds " + kind + ", requested " + kindA);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
        case NULL:
            return "WritableValue{NULL}";
        case FLOAT:
        case DOUBLE:
            return "WritableValue{" + kind + '=' + floating + '}';
        case TEXT:
        case NUMBER:
            return "WritableValue{" + kind + '=' + reference + '}';
        case UNSIGNED_INTEGER:
            return "WritableValue{" + kind + '=' + Long.toUnsignedString(bits) + '}';
        default:
            return "WritableValue{" + kind + '=' + (kind == Kind.BOOLEAN ? String.valueOf(bits != 0L) : String.valueOf(bits)) + '}';
        }
    }
}
