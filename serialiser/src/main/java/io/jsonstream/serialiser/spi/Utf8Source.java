package io.jsonstream.serialiser.spi;

import java.util.NoSuchElementException;

import io.jsonstream.serialiser.ByteSource;

/**
 * Lazily UTF-8 encoding {@link ByteSource} over a {@link CharSequence}. At most one code point is encoded ahead, so
 * the working memory does not depend on the length of the text.
 */
public final class Utf8Source implements ByteSource {
    private final CharSequence sequence;
    private final byte[] pending = new byte[3]; // continuation bytes of the current code point
    private int pendingPos;
    private int pendingEnd;
    private int index;

    public Utf8Source(final CharSequence sequence) {
        this.sequence = sequence;
    }

    /**
     * Checks up front that {@code sequence} has a UTF-8 encoding, i.e. that {@link #takeNext()} will not fail part-way.
     *
     * @param sequence text to be encoded
     * @throws IllegalArgumentException if the text contains an unpaired surrogate
     */
    public static void checkEncodable(final CharSequence sequence) {
        final int length = sequence.length();
        for (int i = 0; i < length; i++) {
            final char c = sequence.charAt(i);
            if (!Character.isSurrogate(c)) {
                continue;
            }
            if (!Character.isHighSurrogate(c) || i + 1 == length || !Character.isLowSurrogate(sequence.charAt(i + 1))) {
                throw unpairedSurrogate(i);
            }
            i++; // NOPMD -- skip the low surrogate of the pair
        }
    }

    @Override
    public boolean hasMore() {
        return pendingPos < pendingEnd || index < sequence.length();
    }

    @Override
    public byte takeNext() {
        if (pendingPos < pendingEnd) {
            return pending[pendingPos++];
        }
        if (index >= sequence.length()) {
            throw new NoSuchElementException("source exhausted at index " + index);
        }
        final char c = sequence.charAt(index++);
        if (c < 0x80) {
            return (byte) c;
        }
        pendingPos = 0;
        if (c < 0x800) { // 11 bits, two UTF-8 bytes
            pending[0] = (byte) (0x80 | (0x3F & c));
            pendingEnd = 1;
            return (byte) (0xC0 | (c >>> 6));
        }
        if (!Character.isSurrogate(c)) { // 16 bits, three UTF-8 bytes
            pending[0] = (byte) (0x80 | (0x3F & (c >>> 6)));
            pending[1] = (byte) (0x80 | (0x3F & c));
            pendingEnd = 2;
            return (byte) (0xE0 | (c >>> 12));
        }
        if (!Character.isHighSurrogate(c) || index == sequence.length() || !Character.isLowSurrogate(sequence.charAt(index))) {
            throw unpairedSurrogate(index - 1);
        }
        // surrogate pair, 21 bits, four UTF-8 bytes
        final int codePoint = Character.toCodePoint(c, sequence.charAt(index++));
        pending[0] = (byte) (0x80 | (0x3F & (codePoint >>> 12)));
        pending[1] = (byte) (0x80 | (0x3F & (codePoint >>> 6)));
        pending[2] = (byte) (0x80 | (0x3F & codePoint));
        pendingEnd = 3;
        return (byte) (0xF0 | (codePoint >>> 18));
    }

    private static IllegalArgumentException unpairedSurrogate(final int index) {
        return new IllegalArgumentException("Unpaired surrogate at index " + index);
    }
}
