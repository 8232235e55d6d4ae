package io.jsonstream.serialiser.spi;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class StringEscaperTests {
    private final ByteArraySink sink = new ByteArraySink(16, true);

    @Test
    void testQuoteEscaping() throws IOException {
        assertEquals("\"a\\\"b\"", escape("a\"b", true));
        assertEquals("a\\\"b", escape("a\"b", false));
        assertEquals("\"\"", escape("", true));
        assertEquals("", escape("", false));
    }

    @Test
    void testShortEscapes() throws IOException {
        assertEquals("\\b\\f\\n\\r\\t\\\"\\\\", escape("\b\f\n\r\t\"\\", false));
        assertEquals("\"path\\\\to\\\\file\"", escape("path\\to\\file", true));
        assertEquals("/", escape("/", false), "solidus is not escaped");
    }

    @ParameterizedTest(name = "control character {0}")
    @CsvSource({ "0, \\u0000", "1, \\u0001", "11, \\u000b", "27, \\u001b", "31, \\u001f" })
    void testUnicodeEscapes(final int controlCharacter, final String expected) throws IOException {
        assertEquals(expected, escape(String.valueOf((char) controlCharacter), false));
    }

    @Test
    void testNonAsciiPassThrough() throws IOException {
        final String text = "Grüße, 日本, 😀, \u007F";
        assertEquals('"' + text + '"', escape(text, true));
        final byte[] raw = { (byte) 0xC3, (byte) 0xA4, (byte) 0xFF };
        StringEscaper.escape(new ByteArraySource(raw), sink, false);
        assertArrayEquals(raw, sink.toByteArray(), "arbitrary bytes >= 0x80 are copied verbatim");
    }

    @Test
    void testDeterministic() throws IOException {
        final String text = "line1\nline2\t\"quoted\"";
        assertEquals(escape(text, true), escape(text, true));
    }

    @Test
    void testNeedsEscape() {
        assertTrue(StringEscaper.needsEscape((byte) '"'));
        assertTrue(StringEscaper.needsEscape((byte) '\\'));
        assertTrue(StringEscaper.needsEscape((byte) 0x1F));
        assertFalse(StringEscaper.needsEscape((byte) 0x20));
        assertFalse(StringEscaper.needsEscape((byte) 'a'));
        assertFalse(StringEscaper.needsEscape((byte) 0xE2));
    }

    @ParameterizedTest(name = "UTF-8 encoding of \"{0}\"")
    @ValueSource(strings = { "", "ascii", "ä", "€", "😀", "mixed ä€😀 text", "߿ࠀ￿" })
    void testUtf8Source(final String text) {
        final Utf8Source source = new Utf8Source(text);
        final byte[] expected = text.getBytes(StandardCharsets.UTF_8);
        for (final byte b : expected) {
            assertTrue(source.hasMore());
            assertEquals(b, source.takeNext());
        }
        assertFalse(source.hasMore());
        assertThrows(NoSuchElementException.class, source::takeNext);
    }

    @Test
    void testUnpairedSurrogates() {
        assertThrows(IllegalArgumentException.class, () -> drainSource(new Utf8Source("a\uD83D")));
        assertThrows(IllegalArgumentException.class, () -> drainSource(new Utf8Source("\uDE00b")));
        assertThrows(IllegalArgumentException.class, () -> drainSource(new Utf8Source("\uD83Dx")));

        assertThrows(IllegalArgumentException.class, () -> Utf8Source.checkEncodable("a\uD83D"));
        assertThrows(IllegalArgumentException.class, () -> Utf8Source.checkEncodable("\uDE00b"));
        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Utf8Source.checkEncodable("ok\uD83D\uDE00\uD83Dx"));
        assertEquals("Unpaired surrogate at index 4", e.getMessage());
        assertDoesNotThrow(() -> Utf8Source.checkEncodable("\uD83D\uDE00 grüße"));
        assertDoesNotThrow(() -> Utf8Source.checkEncodable(""));
    }

    @Test
    void testByteArraySource() {
        final byte[] data = { 1, 2, 3, 4, 5 };
        final ByteArraySource source = new ByteArraySource(data, 1, 3);
        assertEquals(2, source.takeNext());
        assertEquals(3, source.takeNext());
        assertEquals(4, source.takeNext());
        assertFalse(source.hasMore());
        assertThrows(NoSuchElementException.class, source::takeNext);

        assertThrows(IndexOutOfBoundsException.class, () -> new ByteArraySource(data, 3, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> new ByteArraySource(data, -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new ByteArraySource(null, 0, 0));
    }

    private static void drainSource(final Utf8Source source) {
        while (source.hasMore()) {
            source.takeNext();
        }
    }

    private String escape(final String text, final boolean quoted) throws IOException {
        sink.reset();
        StringEscaper.escape(new Utf8Source(text), sink, quoted);
        return sink.toUtf8String();
    }
}
