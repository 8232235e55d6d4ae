package io.jsonstream.serialiser.spi;

import java.util.NoSuchElementException;

import io.jsonstream.serialiser.ByteSource;
import io.jsonstream.serialiser.utils.AssertUtils;

/**
 * {@link ByteSource} over a range of a byte array (stored directly, not copied).
 */
public final class ByteArraySource implements ByteSource {
    private final byte[] values;
    private final int end;
    private int position;

    public ByteArraySource(final byte[] values) {
        this(values, 0, values.length);
    }

    @SuppressWarnings("PMD.ArrayIsStoredDirectly")
    public ByteArraySource(final byte[] values, final int offset, final int length) {
        AssertUtils.notNull("values", values);
        AssertUtils.rangeInBounds(offset, length, values.length);
        this.values = values;
        this.position = offset;
        this.end = offset + length;
    }

    @Override
    public boolean hasMore() {
        return position < end;
    }

    @Override
    public byte takeNext() {
        if (position >= end) {
            throw new NoSuchElementException("source exhausted at position " + position);
        }
        return values[position++];
    }
}
