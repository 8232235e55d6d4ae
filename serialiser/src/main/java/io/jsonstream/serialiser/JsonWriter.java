package io.jsonstream.serialiser;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.jsonstream.serialiser.spi.ByteArraySource;
import io.jsonstream.serialiser.spi.JsonGrammar;
import io.jsonstream.serialiser.spi.NumberEncoder;
import io.jsonstream.serialiser.spi.OutputStreamSink;
import io.jsonstream.serialiser.spi.RawJsonWriter;
import io.jsonstream.serialiser.spi.Utf8Source;

/**
 * Streaming JSON writer: emits a document incrementally to a {@link ByteSink} without building a tree in memory.
 *
 * <p>
 * Every structural or value-writing call is first checked against the JSON grammar; illegal sequences (a second
 * top-level value, a key outside of an object, a value where a key is expected, a mismatched close) fail with a
 * {@link JsonGrammarException} before any byte of the offending call is written. Hence, for any sequence of calls
 * accepted without error the output is valid JSON with exactly one top-level value, e.g.:
 *
 * <pre>{@code
 * try (JsonWriter writer = new JsonWriter(sink)) {
 *     writer.startObject();
 *     writer.writeKeyValue("x", 5);
 *     writer.writeKey("list");
 *     writer.startArray();
 *     writer.writeValue(1.5);
 *     writer.writeValue("text");
 *     writer.endArray();
 *     writer.endObject();
 * }
 * }</pre>
 *
 * <p>
 * Errors are terminal: after any exception (including an {@link IOException} of the sink) the structural state is
 * unspecified and the writer must be discarded. The sink is flushed by {@link #close()}, which never throws.
 *
 * <p>
 * N.B. instances are not thread-safe; concurrent use requires external synchronisation.
 */
public class JsonWriter implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriter.class);
    private final ByteSink sink;
    private final RawJsonWriter raw;
    private final JsonGrammar grammar;

    /**
     * @param sink the destination, flushed but not otherwise released by {@link #close()}
     */
    public JsonWriter(final @NotNull ByteSink sink) {
        this(sink, JsonWriterSettings.DEFAULT);
    }

    /**
     * @param sink the destination, flushed but not otherwise released by {@link #close()}
     * @param settings book-keeping configuration
     */
    public JsonWriter(final @NotNull ByteSink sink, final @NotNull JsonWriterSettings settings) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.raw = new RawJsonWriter(sink);
        this.grammar = new JsonGrammar(Objects.requireNonNull(settings, "settings").getInitialNestingCapacity());
    }

    /**
     * @param out destination stream, wrapped in a buffered sink of {@link JsonWriterSettings#getOutputBufferSize()}
     * @param settings writer configuration
     * @return new writer
     */
    public static JsonWriter toStream(final @NotNull OutputStream out, final @NotNull JsonWriterSettings settings) {
        return new JsonWriter(new OutputStreamSink(out, settings.getOutputBufferSize()), settings);
    }

    /**
     * @return kind of the innermost open node, e.g. {@link NodeKind#OBJECT} after {@link #startObject()} until the next
     *         call to {@link #endObject()}, {@link #startArray()} or {@link #writeKey(CharSequence)}
     */
    public NodeKind parentNode() {
        return grammar.parentNode();
    }

    /**
     * @return {@code true} once the single top-level value has been completely written
     */
    public boolean isComplete() {
        return grammar.isComplete();
    }

    /**
     * @return number of bytes written to the sink so far
     */
    public long position() {
        return sink.position();
    }

    public void startObject() throws IOException {
        raw.writeSeparator(grammar.enter(NodeKind.OBJECT));
        raw.writeStartObject();
    }

    public void startArray() throws IOException {
        raw.writeSeparator(grammar.enter(NodeKind.ARRAY));
        raw.writeStartArray();
    }

    public void endObject() throws IOException {
        grammar.exit(NodeKind.OBJECT);
        raw.writeEndObject();
    }

    public void endArray() throws IOException {
        grammar.exit(NodeKind.ARRAY);
        raw.writeEndArray();
    }

    /**
     * @param key object key, escaped and quoted
     * @throws NullKeyException if the key is {@code null}
     * @throws JsonGrammarException if no object is open or the previous key still awaits its value
     * @throws IOException in case the sink failed
     */
    public void writeKey(final CharSequence key) throws IOException {
        if (key == null) {
            throw new NullKeyException();
        }
        Utf8Source.checkEncodable(key);
        writeKeyFrom(new Utf8Source(key));
    }

    /**
     * @param key UTF-8 encoded object key
     * @param offset index of the first key byte
     * @param length number of key bytes
     * @throws IOException in case the sink failed
     */
    public void writeKey(final byte[] key, final int offset, final int length) throws IOException {
        if (key == null) {
            throw new NullKeyException();
        }
        writeKeyFrom(new ByteArraySource(key, offset, length));
    }

    /**
     * @param key source of the UTF-8 encoded object key, consumed completely
     * @throws IOException in case the sink failed
     */
    public void writeKey(final ByteSource key) throws IOException {
        if (key == null) {
            throw new NullKeyException();
        }
        writeKeyFrom(key);
    }

    public void writeValue(final long value) throws IOException {
        beginValue();
        raw.writeLong(value);
        grammar.endChild();
    }

    /**
     * @param value 64-bit pattern written as unsigned integer
     * @throws IOException in case the sink failed
     */
    public void writeUnsignedValue(final long value) throws IOException {
        beginValue();
        raw.writeUnsignedLong(value);
        grammar.endChild();
    }

    /**
     * @param value 32-bit pattern written as unsigned integer
     * @throws IOException in case the sink failed
     */
    public void writeUnsignedValue(final int value) throws IOException {
        writeUnsignedValue(Integer.toUnsignedLong(value));
    }

    /**
     * @param value finite value, written with 9 significant digits at most
     * @throws InvalidNumericValueException for NaN or infinity, nothing is written in this case
     * @throws IOException in case the sink failed
     */
    public void writeValue(final float value) throws IOException {
        NumberEncoder.checkFinite(value);
        beginValue();
        raw.writeFloat(value);
        grammar.endChild();
    }

    /**
     * @param value finite value, written with 17 significant digits at most
     * @throws InvalidNumericValueException for NaN or infinity, nothing is written in this case
     * @throws IOException in case the sink failed
     */
    public void writeValue(final double value) throws IOException {
        NumberEncoder.checkFinite(value);
        beginValue();
        raw.writeDouble(value);
        grammar.endChild();
    }

    public void writeValue(final boolean value) throws IOException {
        beginValue();
        raw.writeBoolean(value);
        grammar.endChild();
    }

    /**
     * @param value text (escaped and quoted) or {@code null} for the null literal
     * @throws IOException in case the sink failed
     */
    public void writeValue(final CharSequence value) throws IOException {
        if (value != null) {
            Utf8Source.checkEncodable(value);
        }
        beginValue();
        raw.writeString(value);
        grammar.endChild();
    }

    /**
     * @param value source of UTF-8 encoded string content (escaped and quoted) or {@code null} for the null literal
     * @throws IOException in case the sink failed
     */
    public void writeValue(final ByteSource value) throws IOException {
        beginValue();
        if (value == null) {
            raw.writeNull();
        } else {
            raw.writeStringFrom(value, true);
        }
        grammar.endChild();
    }

    public void writeValue(final @NotNull NumberValue value) throws IOException {
        writeValue(WritableValue.of(value));
    }

    public void writeValue(final @NotNull WritableValue value) throws IOException {
        checkValue(value);
        beginValue();
        raw.write(value);
        grammar.endChild();
    }

    public void writeNull() throws IOException {
        writeValue(WritableValue.nullValue());
    }

    /**
     * Writes an object member. Equivalent to {@link #writeKey(CharSequence)} followed by
     * {@link #writeValue(WritableValue)} but all checks are performed before the first byte is written.
     *
     * @param key object key
     * @param value member value
     * @throws NullKeyException if the key is {@code null}
     * @throws InvalidNumericValueException for non-finite floating point values
     * @throws IllegalArgumentException if key or text value contain an unpaired surrogate
     * @throws JsonGrammarException if no object is open or a key is pending
     * @throws IOException in case the sink failed
     */
    public void writeKeyValue(final CharSequence key, final @NotNull WritableValue value) throws IOException {
        if (key == null) {
            throw new NullKeyException();
        }
        Utf8Source.checkEncodable(key);
        checkValue(value);
        writeKeyValueFrom(new Utf8Source(key), value);
    }

    /**
     * Writes an object member with a UTF-8 encoded key, all checks are performed before the first byte is written.
     *
     * @param key UTF-8 encoded object key
     * @param offset index of the first key byte
     * @param length number of key bytes
     * @param value member value
     * @throws NullKeyException if the key is {@code null}
     * @throws InvalidNumericValueException for non-finite floating point values
     * @throws JsonGrammarException if no object is open or a key is pending
     * @throws IOException in case the sink failed
     */
    public void writeKeyValue(final byte[] key, final int offset, final int length, final @NotNull WritableValue value) throws IOException {
        if (key == null) {
            throw new NullKeyException();
        }
        final ByteArraySource source = new ByteArraySource(key, offset, length);
        checkValue(value);
        writeKeyValueFrom(source, value);
    }

    public void writeKeyValue(final CharSequence key, final long value) throws IOException {
        writeKeyValue(key, WritableValue.of(value));
    }

    public void writeKeyValue(final CharSequence key, final float value) throws IOException {
        writeKeyValue(key, WritableValue.of(value));
    }

    public void writeKeyValue(final CharSequence key, final double value) throws IOException {
        writeKeyValue(key, WritableValue.of(value));
    }

    public void writeKeyValue(final CharSequence key, final boolean value) throws IOException {
        writeKeyValue(key, WritableValue.of(value));
    }

    public void writeKeyValue(final CharSequence key, final CharSequence value) throws IOException {
        writeKeyValue(key, WritableValue.of(value));
    }

    public void writeKeyValue(final CharSequence key, final @NotNull NumberValue value) throws IOException {
        writeKeyValue(key, WritableValue.of(value));
    }

    /**
     * writes a line break, has no effect on the document structure
     *
     * @throws IOException in case the sink failed
     */
    public void writeNewline() throws IOException {
        raw.writeNewline();
    }

    /**
     * writes indentation, has no effect on the document structure
     *
     * @param count number of spaces
     * @throws IOException in case the sink failed
     */
    public void writeWhitespace(final int count) throws IOException {
        raw.writeWhitespace(count);
    }

    public void flush() throws IOException {
        sink.flush();
    }

    /**
     * Flushes the sink. A failing flush is logged and not propagated.
     */
    @Override
    public void close() {
        if (!grammar.isComplete()) {
            LOGGER.atDebug().addArgument(grammar).log("closing writer with incomplete document: {}");
        }
        try {
            sink.flush();
        } catch (IOException | RuntimeException e) { // NOPMD -- teardown must not raise
            LOGGER.atWarn().setCause(e).addArgument(sink).log("could not flush sink '{}' on close");
        }
    }

    @Override
    public String toString() {
        return JsonWriter.class.getSimpleName() + "{grammar=" + grammar + ", position=" + sink.position() + '}';
    }

    private void beginValue() throws IOException {
        raw.writeSeparator(grammar.enter(NodeKind.VALUE));
    }

    private void writeKeyFrom(final ByteSource key) throws IOException {
        raw.writeSeparator(grammar.enter(NodeKind.KEY));
        raw.writeStringFrom(key, true);
        // key stays open until its value has been written
    }

    private void writeKeyValueFrom(final ByteSource key, final WritableValue value) throws IOException {
        raw.writeSeparator(grammar.enter(NodeKind.KEY));
        raw.writeStringFrom(key, true);
        raw.writeSeparator(grammar.enter(NodeKind.VALUE)); // cannot fail once the key has been accepted
        raw.write(value);
        grammar.endChild();
    }

    private static void checkValue(final WritableValue value) {
        if (value.kind() == WritableValue.Kind.TEXT) {
            Utf8Source.checkEncodable(value.textValue());
        }
        if (value.isNonFinite()) {
            switch (value.kind()) {
            case FLOAT:
                throw new InvalidNumericValueException(value.floatValue());
            case DOUBLE:
                throw new InvalidNumericValueException(value.doubleValue());
            default:
                throw new InvalidNumericValueException(value.numberValue().type() == NumberValue.Type.FLOAT ? value.numberValue().floatValue() : value.numberValue().doubleValue());
            }
        }
    }
}
