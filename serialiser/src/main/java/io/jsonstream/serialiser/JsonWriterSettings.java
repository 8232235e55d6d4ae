package io.jsonstream.serialiser;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.jsonstream.serialiser.utils.AssertUtils;

/**
 * Construction-time configuration of a {@link JsonWriter} and its default sinks.
 *
 * <p>
 * Values may be overridden through JVM properties following the '&lt;class-name&gt;.&lt;field-name&gt;' scheme:
 * <ul>
 * <li>'JsonWriterSettings.initialNestingCapacity' []: default (16) initially reserved container nesting levels; the
 * book-keeping grows beyond this on demand</li>
 * <li>'JsonWriterSettings.outputBufferSize' [bytes]: default (8192) buffer size used by stream backed sinks</li>
 * </ul>
 */
public final class JsonWriterSettings {
    public static final int DEFAULT_INITIAL_NESTING_CAPACITY = 16;
    public static final int DEFAULT_OUTPUT_BUFFER_SIZE = 8192;
    public static final JsonWriterSettings DEFAULT = new JsonWriterSettings(DEFAULT_INITIAL_NESTING_CAPACITY, DEFAULT_OUTPUT_BUFFER_SIZE);
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriterSettings.class);
    private static final String PROPERTY_PREFIX = JsonWriterSettings.class.getSimpleName() + '.';
    private final int initialNestingCapacity;
    private final int outputBufferSize;

    /**
     * @param initialNestingCapacity initially reserved nesting levels (&gt;= 0)
     * @param outputBufferSize buffer size in bytes of stream backed sinks (&gt; 0)
     */
    public JsonWriterSettings(final int initialNestingCapacity, final int outputBufferSize) {
        AssertUtils.gtEqThanZero("initialNestingCapacity", initialNestingCapacity);
        AssertUtils.gtThanZero("outputBufferSize", outputBufferSize);
        this.initialNestingCapacity = initialNestingCapacity;
        this.outputBufferSize = outputBufferSize;
    }

    /**
     * @return settings with class defaults overridden by matching (non-blank) JVM properties
     */
    public static JsonWriterSettings fromSystemProperties() {
        final int nesting = getValue("initialNestingCapacity", DEFAULT_INITIAL_NESTING_CAPACITY);
        final int bufferSize = getValue("outputBufferSize", DEFAULT_OUTPUT_BUFFER_SIZE);
        LOGGER.atDebug().addArgument(nesting).addArgument(bufferSize).log("resolved settings: initialNestingCapacity={}, outputBufferSize={}");
        return new JsonWriterSettings(nesting, bufferSize);
    }

    public int getInitialNestingCapacity() {
        return initialNestingCapacity;
    }

    public int getOutputBufferSize() {
        return outputBufferSize;
    }

    public JsonWriterSettings withInitialNestingCapacity(final int capacity) {
        return new JsonWriterSettings(capacity, outputBufferSize);
    }

    public JsonWriterSettings withOutputBufferSize(final int bufferSize) {
        return new JsonWriterSettings(initialNestingCapacity, bufferSize);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JsonWriterSettings)) {
            return false;
        }
        final JsonWriterSettings other = (JsonWriterSettings) obj;
        return initialNestingCapacity == other.initialNestingCapacity && outputBufferSize == other.outputBufferSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialNestingCapacity, outputBufferSize);
    }

    @Override
    public String toString() {
        return "JsonWriterSettings{initialNestingCapacity=" + initialNestingCapacity + ", outputBufferSize=" + outputBufferSize + '}';
    }

    private static int getValue(final String fieldName, final int defaultValue) {
        final String value = System.getProperty(PROPERTY_PREFIX + fieldName);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        final String trimmed = value.trim();
        if (!NumberUtils.isDigits(trimmed)) {
            throw new IllegalArgumentException("could not parse property '" + PROPERTY_PREFIX + fieldName + "': " + value);
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("property '" + PROPERTY_PREFIX + fieldName + "' out of range: " + value, e);
        }
    }
}
