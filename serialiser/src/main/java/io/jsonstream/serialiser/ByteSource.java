package io.jsonstream.serialiser;

/**
 * Finite, single-pass byte sequence feeding string content into the string escaper.
 */
public interface ByteSource {
    boolean hasMore();

    /**
     * @return the next byte of the sequence
     * @throws java.util.NoSuchElementException if {@link #hasMore()} is false
     */
    byte takeNext();
}
