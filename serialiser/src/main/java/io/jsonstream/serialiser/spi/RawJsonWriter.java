package io.jsonstream.serialiser.spi;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import io.jsonstream.serialiser.ByteSink;
import io.jsonstream.serialiser.ByteSource;
import io.jsonstream.serialiser.NumberValue;
import io.jsonstream.serialiser.WritableValue;

/**
 * Low-level JSON token writer: emits brackets, separators and encoded values to a {@link ByteSink} without any
 * structural checks. {@link io.jsonstream.serialiser.JsonWriter} layers the grammar on top of it.
 *
 * Not thread-safe.
 */
public class RawJsonWriter {
    private static final byte[] TRUE = "true".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FALSE = "false".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL = "null".getBytes(StandardCharsets.US_ASCII);
    private final ByteSink sink;
    private final NumberEncoder numberEncoder = new NumberEncoder();

    public RawJsonWriter(final @NotNull ByteSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ByteSink getSink() {
        return sink;
    }

    public void writeStartObject() throws IOException {
        sink.put((byte) '{');
    }

    public void writeEndObject() throws IOException {
        sink.put((byte) '}');
    }

    public void writeStartArray() throws IOException {
        sink.put((byte) '[');
    }

    public void writeEndArray() throws IOException {
        sink.put((byte) ']');
    }

    public void writeKeySeparator() throws IOException {
        sink.put(JsonGrammar.Separator.KEY.getSymbol());
    }

    public void writeItemSeparator() throws IOException {
        sink.put(JsonGrammar.Separator.ITEM.getSymbol());
    }

    /**
     * @param separator separator to be written, {@link JsonGrammar.Separator#NONE} writes nothing
     * @throws IOException in case the sink failed
     */
    public void writeSeparator(final JsonGrammar.Separator separator) throws IOException {
        if (separator != JsonGrammar.Separator.NONE) {
            sink.put(separator.getSymbol());
        }
    }

    public void writeLong(final long value) throws IOException {
        numberEncoder.writeLong(sink, value);
    }

    public void writeUnsignedLong(final long value) throws IOException {
        numberEncoder.writeUnsignedLong(sink, value);
    }

    public void writeFloat(final float value) throws IOException {
        numberEncoder.writeFloat(sink, value);
    }

    public void writeDouble(final double value) throws IOException {
        numberEncoder.writeDouble(sink, value);
    }

    public void writeNumber(final @NotNull NumberValue value) throws IOException {
        numberEncoder.writeNumber(sink, value);
    }

    public void writeBoolean(final boolean value) throws IOException {
        final byte[] literal = value ? TRUE : FALSE;
        sink.write(literal, 0, literal.length);
    }

    public void writeNull() throws IOException {
        sink.write(NULL, 0, NULL.length);
    }

    /**
     * Writes an escaped, quoted string or {@code null}.
     *
     * @param value text to be written
     * @throws IOException in case the sink failed
     */
    public void writeString(final CharSequence value) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }
        writeStringFrom(new Utf8Source(value), true);
    }

    /**
     * Writes an escaped, quoted string from UTF-8 encoded bytes or {@code null}.
     *
     * @param value UTF-8 bytes
     * @param offset index of the first byte
     * @param length number of bytes
     * @throws IOException in case the sink failed
     */
    public void writeString(final byte[] value, final int offset, final int length) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }
        writeStringFrom(new ByteArraySource(value, offset, length), true);
    }

    /**
     * @param source string content, consumed completely
     * @param quoted whether the string is delimited by quotes
     * @throws IOException in case the sink failed
     */
    public void writeStringFrom(final @NotNull ByteSource source, final boolean quoted) throws IOException {
        StringEscaper.escape(source, sink, quoted);
    }

    /**
     * Writes a scalar value of any supported kind.
     *
     * @param value value to be written
     * @throws IOException in case the sink failed
     */
    public void write(final @NotNull WritableValue value) throws IOException {
        switch (value.kind()) {
        case SIGNED_INTEGER:
            writeLong(value.longValue());
            break;
        case UNSIGNED_INTEGER:
            writeUnsignedLong(value.longValue());
            break;
        case FLOAT:
            writeFloat(value.floatValue());
            break;
        case DOUBLE:
            writeDouble(value.doubleValue());
            break;
        case BOOLEAN:
            writeBoolean(value.booleanValue());
            break;
        case TEXT:
            writeString(value.textValue());
            break;
        case NULL:
            writeNull();
            break;
        case NUMBER:
            writeNumber(value.numberValue());
            break;
        default:
            throw new AssertionError("unknown value kind: " + value.kind());
        }
    }

    public void writeNewline() throws IOException {
        sink.put((byte) '\n');
    }

    /**
     * @param count number of spaces (&gt;= 0)
     * @throws IOException in case the sink failed
     */
    public void writeWhitespace(final int count) throws IOException {
        sink.put((byte) ' ', count);
    }
}
