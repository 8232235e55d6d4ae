package io.jsonstream.serialiser;

import java.io.IOException;

/**
 * Write-only byte destination targeted by the {@link JsonWriter}.
 *
 * All operations are synchronous and either complete or fail with an {@link IOException}. Implementations that cannot
 * fail (e.g. in-memory sinks) may drop the checked exception from their signatures.
 */
public interface ByteSink {
    /**
     * @param value single byte to be appended
     * @throws IOException in case the underlying destination failed
     */
    void put(byte value) throws IOException;

    /**
     * @param value byte to be appended
     * @param count number of repetitions (&gt;= 0)
     * @throws IOException in case the underlying destination failed
     */
    void put(byte value, int count) throws IOException;

    /**
     * @param values source array
     * @param offset index of the first byte to be written
     * @param length number of bytes to be written
     * @throws IOException in case the underlying destination failed
     */
    void write(byte[] values, int offset, int length) throws IOException;

    void flush() throws IOException;

    /**
     * @return number of bytes written to this sink so far
     */
    long position();
}
