package io.jsonstream.serialiser.spi;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import io.jsonstream.serialiser.ByteSink;
import io.jsonstream.serialiser.utils.AssertUtils;

/**
 * In-memory {@link ByteSink} backed by a byte array.
 *
 * When there is not enough space for a write operation, the behaviour depends on the autoResize flag. If it is false,
 * the operation throws an {@link IndexOutOfBoundsException} and nothing is written. If it is true, the underlying
 * array is replaced by a bigger one which is at least 1 KiB or 12,5% , but at max 100 KiB bigger than the requested
 * size.
 */
public class ByteArraySink implements ByteSink {
    private static final int DEFAULT_INITIAL_CAPACITY = 1 << 10;
    private static final int DEFAULT_MIN_CAPACITY_INCREASE = 1 << 10;
    private static final int DEFAULT_MAX_CAPACITY_INCREASE = 100 * (1 << 10);
    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;
    private final boolean autoResize;
    private byte[] buffer;
    private int intPos;

    /**
     * construct new auto-resizing ByteArraySink backed by a default length array
     */
    public ByteArraySink() {
        this(DEFAULT_INITIAL_CAPACITY, true);
    }

    /**
     * @param size initial capacity of the buffer
     * @param autoResize whether the buffer should be resized automatically when trying to write past capacity
     */
    public ByteArraySink(final int size, final boolean autoResize) {
        AssertUtils.gtEqThanZero("size", size);
        buffer = new byte[size];
        this.autoResize = autoResize;
    }

    public int capacity() {
        return buffer.length;
    }

    /**
     * @return access to internal storage array (N.B. this is volatile and may be replaced in case of auto-grow)
     */
    public byte[] elements() {
        return buffer; // NOPMD -- allow public access to internal array
    }

    public void ensureAdditionalCapacity(final int capacity) {
        if (capacity <= capacity() - intPos) {
            return;
        }
        final long newCapacity = (long) intPos + capacity;
        if (!autoResize) {
            throw new IndexOutOfBoundsException("required capacity: " + newCapacity + " out of bounds: " + capacity() + " and autoResize is disabled");
        }
        if (newCapacity > MAX_ARRAY_SIZE) {
            throw new IndexOutOfBoundsException("required capacity: " + newCapacity + " exceeds maximum array size: " + MAX_ARRAY_SIZE);
        }
        final long addCapacity = Math.min(Math.max(DEFAULT_MIN_CAPACITY_INCREASE, newCapacity >> 3), DEFAULT_MAX_CAPACITY_INCREASE); // min, +12.5%, max
        buffer = Arrays.copyOf(buffer, (int) Math.min(newCapacity + addCapacity, MAX_ARRAY_SIZE));
    }

    @Override
    public void flush() {
        // nothing buffered
    }

    @Override
    public long position() {
        return intPos;
    }

    @Override
    public void put(final byte value) {
        ensureAdditionalCapacity(1);
        buffer[intPos++] = value;
    }

    @Override
    public void put(final byte value, final int count) {
        AssertUtils.gtEqThanZero("count", count);
        ensureAdditionalCapacity(count);
        Arrays.fill(buffer, intPos, intPos + count, value);
        intPos += count;
    }

    /**
     * discards the written content, the capacity is retained
     */
    public void reset() {
        intPos = 0;
    }

    /**
     * @return copy of the written content
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, intPos);
    }

    /**
     * @return written content decoded as UTF-8
     */
    public String toUtf8String() {
        return new String(buffer, 0, intPos, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return ByteArraySink.class.getSimpleName() + "{position=" + intPos + ", capacity=" + capacity() + ", autoResize=" + autoResize + '}';
    }

    @Override
    public void write(final byte[] values, final int offset, final int length) {
        AssertUtils.rangeInBounds(offset, length, values.length);
        ensureAdditionalCapacity(length);
        System.arraycopy(values, offset, buffer, intPos, length);
        intPos += length;
    }
}
