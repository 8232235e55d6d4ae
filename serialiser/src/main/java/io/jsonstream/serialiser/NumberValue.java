package io.jsonstream.serialiser;

import org.jetbrains.annotations.NotNull;

/**
 * Number whose encoded kind is only known at runtime: a closed union over {@code float}, {@code double}, signed and
 * unsigned 64-bit integers. Created by the caller, read once by the writer and never retained.
 */
public final class NumberValue {
    public enum Type {
        FLOAT,
        DOUBLE,
        SIGNED,
        UNSIGNED
    }

    private final Type type;
    private final long bits;
    private final double floating;

    private NumberValue(final Type type, final long bits, final double floating) {
        this.type = type;
        this.bits = bits;
        this.floating = floating;
    }

    public static NumberValue of(final float value) {
        return new NumberValue(Type.FLOAT, 0L, value);
    }

    public static NumberValue of(final double value) {
        return new NumberValue(Type.DOUBLE, 0L, value);
    }

    public static NumberValue of(final long value) {
        return new NumberValue(Type.SIGNED, value, 0.0);
    }

    /**
     * @param value 64-bit pattern interpreted as an unsigned integer
     * @return new unsigned number
     */
    public static NumberValue ofUnsigned(final long value) {
        return new NumberValue(Type.UNSIGNED, value, 0.0);
    }

    public @NotNull Type type() {
        return type;
    }

    public float floatValue() {
        checkType(Type.FLOAT);
        return (float) floating;
    }

    public double doubleValue() {
        checkType(Type.DOUBLE);
        return floating;
    }

    public long longValue() {
        checkType(Type.SIGNED);
        return bits;
    }

    /**
     * @return the raw 64-bit pattern, to be interpreted as unsigned (see {@link Long#toUnsignedString(long)})
     */
    public long unsignedLongValue() {
        checkType(Type.UNSIGNED);
        return bits;
    }

    private void checkType(final Type requested) {
        if (type != requested) {
            throw new IllegalStateException("number holds " + type + ", requested " + requested);
        }
    }

    @Override
    public String toString() {
        switch (type) {
        case FLOAT:
            return "NumberValue{FLOAT=" + (float) floating + '}';
        case DOUBLE:
            return "NumberValue{DOUBLE=" + floating + '}';
        case SIGNED:
            return "NumberValue{SIGNED=" + bits + '}';
        default:
            return "NumberValue{UNSIGNED=" + Long.toUnsignedString(bits) + '}';
        }
    }
}
