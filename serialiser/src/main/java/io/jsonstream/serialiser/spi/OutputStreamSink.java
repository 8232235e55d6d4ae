package io.jsonstream.serialiser.spi;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import io.jsonstream.serialiser.ByteSink;
import io.jsonstream.serialiser.utils.AssertUtils;

/**
 * Buffered {@link ByteSink} on top of an {@link OutputStream}. {@link #flush()} forwards the buffered bytes and flushes
 * the stream; the stream itself is never closed by this sink.
 */
public class OutputStreamSink implements ByteSink {
    private final OutputStream out;
    private final byte[] buffer;
    private int count;
    private long flushed;

    /**
     * @param out destination stream
     * @param bufferSize number of bytes buffered before they are forwarded to the stream
     */
    public OutputStreamSink(final @NotNull OutputStream out, final int bufferSize) {
        AssertUtils.gtThanZero("bufferSize", bufferSize);
        this.out = Objects.requireNonNull(out, "out");
        this.buffer = new byte[bufferSize];
    }

    @Override
    public void flush() throws IOException {
        drain();
        out.flush();
    }

    @Override
    public long position() {
        return flushed + count;
    }

    @Override
    public void put(final byte value) throws IOException {
        if (count == buffer.length) {
            drain();
        }
        buffer[count++] = value;
    }

    @Override
    public void put(final byte value, final int repetitions) throws IOException {
        AssertUtils.gtEqThanZero("count", repetitions);
        int remaining = repetitions;
        while (remaining > 0) {
            if (count == buffer.length) {
                drain();
            }
            final int chunk = Math.min(remaining, buffer.length - count);
            Arrays.fill(buffer, count, count + chunk, value);
            count += chunk;
            remaining -= chunk;
        }
    }

    @Override
    public void write(final byte[] values, final int offset, final int length) throws IOException {
        AssertUtils.rangeInBounds(offset, length, values.length);
        if (length >= buffer.length) {
            // larger than the buffer: bypass it
            drain();
            out.write(values, offset, length);
            flushed += length;
            return;
        }
        if (length > buffer.length - count) {
            drain();
        }
        System.arraycopy(values, offset, buffer, count, length);
        count += length;
    }

    private void drain() throws IOException {
        if (count > 0) {
            out.write(buffer, 0, count);
            flushed += count;
            count = 0;
        }
    }
}
