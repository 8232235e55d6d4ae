package io.jsonstream.serialiser.spi;

import java.io.IOException;

import io.jsonstream.serialiser.ByteSink;
import io.jsonstream.serialiser.ByteSource;

/**
 * One-pass JSON string escaping from a {@link ByteSource} into a {@link ByteSink}.
 *
 * <p>
 * Bytes are passed through unchanged except for '"', '\' and the control characters 0x00-0x1F: these are replaced by
 * their two-character escapes ('\b', '\f', '\n', '\r', '\t', '\"', '\\') or, lacking one, by a six-character unicode
 * escape ('u00' and two hex digits after the backslash). Bytes &gt;= 0x80 are copied as-is, i.e. UTF-8 input yields
 * UTF-8 output. Working memory is constant.
 */
public final class StringEscaper {
    private static final byte QUOTE = '"';
    private static final byte BACKSLASH = '\\';
    private static final byte UNICODE_ESCAPE = 'u';
    private static final byte[] HEX_DIGITS = { '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f' };
    /** character following the backslash, 0: no escape needed */
    private static final byte[] ESCAPES = new byte[BACKSLASH + 1];
    static {
        for (int i = 0; i < 0x20; i++) {
            ESCAPES[i] = UNICODE_ESCAPE;
        }
        ESCAPES['\b'] = 'b';
        ESCAPES['\f'] = 'f';
        ESCAPES['\n'] = 'n';
        ESCAPES['\r'] = 'r';
        ESCAPES['\t'] = 't';
        ESCAPES[QUOTE] = QUOTE;
        ESCAPES[BACKSLASH] = BACKSLASH;
    }

    private StringEscaper() {
        // utility class
    }

    /**
     * @param source bytes to be escaped, consumed completely
     * @param sink destination
     * @param quoted whether the output is delimited by '"'
     * @throws IOException in case the sink failed
     */
    public static void escape(final ByteSource source, final ByteSink sink, final boolean quoted) throws IOException {
        if (quoted) {
            sink.put(QUOTE);
        }
        while (source.hasMore()) {
            final byte value = source.takeNext();
            if (!needsEscape(value)) {
                sink.put(value);
                continue;
            }
            final byte escape = ESCAPES[value];
            sink.put(BACKSLASH);
            sink.put(escape);
            if (escape == UNICODE_ESCAPE) {
                sink.put((byte) '0');
                sink.put((byte) '0');
                sink.put(HEX_DIGITS[value >> 4]);
                sink.put(HEX_DIGITS[value & 0xF]);
            }
        }
        if (quoted) {
            sink.put(QUOTE);
        }
    }

    /**
     * @param value byte to be checked
     * @return {@code true} if the byte is not copied verbatim
     */
    public static boolean needsEscape(final byte value) {
        return value >= 0 && value < ESCAPES.length && ESCAPES[value] != 0;
    }
}
