package io.jsonstream.serialiser.spi;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import io.jsonstream.serialiser.ByteSink;
import io.jsonstream.serialiser.InvalidNumericValueException;
import io.jsonstream.serialiser.NumberValue;

/**
 * Locale-independent decimal ASCII encoding of integer and floating point values, written directly to a
 * {@link ByteSink}.
 *
 * <p>
 * Floating point values are written with the maximum number of significant digits needed to recover the binary value
 * exactly (9 for {@code float}, 17 for {@code double}) in the layout of C's {@code %g} conversion: fixed notation for
 * decimal exponents in [-4, digits), scientific notation ('1.5e+20', at least two exponent digits) otherwise, trailing
 * fractional zeros removed.
 *
 * N.B. instances keep a small scratch buffer and are not thread-safe.
 */
public class NumberEncoder {
    /** significant decimal digits needed for an exact round-trip of IEEE 754 binary32 */
    public static final int FLOAT_DIGITS = 9;
    /** significant decimal digits needed for an exact round-trip of IEEE 754 binary64 */
    public static final int DOUBLE_DIGITS = 17;
    /** max decimal digits of a 64-bit unsigned integer, 18446744073709551615 */
    public static final int MAX_INTEGER_CHARS = 20;
    /** sign, digits, decimal point and exponent, e.g. '-1.2345678901234567e-308' */
    public static final int MAX_FLOATING_CHARS = 1 + DOUBLE_DIGITS + 1 + 5;
    private static final MathContext FLOAT_CONTEXT = new MathContext(FLOAT_DIGITS, RoundingMode.HALF_EVEN);
    private static final MathContext DOUBLE_CONTEXT = new MathContext(DOUBLE_DIGITS, RoundingMode.HALF_EVEN);
    private static final int MIN_FIXED_EXPONENT = -4;
    private final byte[] scratch = new byte[Math.max(MAX_INTEGER_CHARS, MAX_FLOATING_CHARS)];

    /**
     * @param sink destination
     * @param value signed value (byte, short, char and int widen losslessly)
     * @throws IOException in case the sink failed
     */
    public void writeLong(final ByteSink sink, final long value) throws IOException {
        // two's complement negation yields the correct unsigned magnitude also for Long.MIN_VALUE
        final long magnitude = value < 0 ? -value : value;
        int start = fillUnsignedDigits(magnitude);
        if (value < 0) {
            scratch[--start] = '-';
        }
        sink.write(scratch, start, scratch.length - start);
    }

    /**
     * @param sink destination
     * @param value 64-bit pattern interpreted as unsigned integer
     * @throws IOException in case the sink failed
     */
    public void writeUnsignedLong(final ByteSink sink, final long value) throws IOException {
        final int start = fillUnsignedDigits(value);
        sink.write(scratch, start, scratch.length - start);
    }

    public void writeUnsignedInt(final ByteSink sink, final int value) throws IOException {
        writeUnsignedLong(sink, Integer.toUnsignedLong(value));
    }

    /**
     * @param sink destination
     * @param value finite value
     * @throws InvalidNumericValueException for NaN or infinity, nothing is written in this case
     * @throws IOException in case the sink failed
     */
    public void writeFloat(final ByteSink sink, final float value) throws IOException {
        checkFinite(value);
        writeFloating(sink, value, FLOAT_CONTEXT);
    }

    /**
     * @param sink destination
     * @param value finite value
     * @throws InvalidNumericValueException for NaN or infinity, nothing is written in this case
     * @throws IOException in case the sink failed
     */
    public void writeDouble(final ByteSink sink, final double value) throws IOException {
        checkFinite(value);
        writeFloating(sink, value, DOUBLE_CONTEXT);
    }

    /**
     * Writes a number whose kind is only known at runtime.
     *
     * @param sink destination
     * @param value tagged number
     * @throws IOException in case the sink failed
     */
    public void writeNumber(final ByteSink sink, final NumberValue value) throws IOException {
        switch (value.type()) {
        case FLOAT:
            writeFloat(sink, value.floatValue());
            break;
        case DOUBLE:
            writeDouble(sink, value.doubleValue());
            break;
        case SIGNED:
            writeLong(sink, value.longValue());
            break;
        case UNSIGNED:
            writeUnsignedLong(sink, value.unsignedLongValue());
            break;
        default:
            // closed union, reaching this is a programming error rather than a recoverable condition
            throw new AssertionError("unknown number type: " + value.type());
        }
    }

    public static void checkFinite(final double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidNumericValueException(value);
        }
    }

    /**
     * fills the scratch buffer from its end backwards, units first
     *
     * @return index of the most significant digit
     */
    private int fillUnsignedDigits(final long value) {
        long remaining = value;
        int pos = scratch.length;
        do {
            scratch[--pos] = (byte) ('0' + Long.remainderUnsigned(remaining, 10));
            remaining = Long.divideUnsigned(remaining, 10);
        } while (remaining != 0);
        return pos;
    }

    private void writeFloating(final ByteSink sink, final double value, final MathContext context) throws IOException {
        int pos = 0;
        if (Double.doubleToRawLongBits(value) < 0) {
            scratch[pos++] = '-';
        }
        if (value == 0.0) {
            scratch[pos++] = '0';
            sink.write(scratch, 0, pos);
            return;
        }

        final BigDecimal rounded = new BigDecimal(Math.abs(value)).round(context);
        final String digits = rounded.unscaledValue().toString();
        final int exponent = rounded.precision() - rounded.scale() - 1;
        int nDigits = digits.length();
        while (nDigits > 1 && digits.charAt(nDigits - 1) == '0') {
            nDigits--;
        }

        if (exponent >= MIN_FIXED_EXPONENT && exponent < context.getPrecision()) {
            pos = fillFixed(digits, nDigits, exponent, pos);
        } else {
            pos = fillScientific(digits, nDigits, exponent, pos);
        }
        sink.write(scratch, 0, pos);
    }

    private int fillFixed(final String digits, final int nDigits, final int exponent, final int start) {
        int pos = start;
        if (exponent < 0) {
            scratch[pos++] = '0';
            scratch[pos++] = '.';
            for (int i = -1; i > exponent; i--) {
                scratch[pos++] = '0';
            }
            for (int i = 0; i < nDigits; i++) {
                scratch[pos++] = (byte) digits.charAt(i);
            }
            return pos;
        }
        for (int i = 0; i <= exponent; i++) {
            scratch[pos++] = i < nDigits ? (byte) digits.charAt(i) : (byte) '0';
        }
        if (nDigits > exponent + 1) {
            scratch[pos++] = '.';
            for (int i = exponent + 1; i < nDigits; i++) {
                scratch[pos++] = (byte) digits.charAt(i);
            }
        }
        return pos;
    }

    private int fillScientific(final String digits, final int nDigits, final int exponent, final int start) {
        int pos = start;
        scratch[pos++] = (byte) digits.charAt(0);
        if (nDigits > 1) {
            scratch[pos++] = '.';
            for (int i = 1; i < nDigits; i++) {
                scratch[pos++] = (byte) digits.charAt(i);
            }
        }
        scratch[pos++] = 'e';
        scratch[pos++] = exponent < 0 ? (byte) '-' : (byte) '+';
        final int magnitude = Math.abs(exponent);
        if (magnitude >= 100) {
            scratch[pos++] = (byte) ('0' + magnitude / 100);
        }
        scratch[pos++] = (byte) ('0' + (magnitude / 10) % 10);
        scratch[pos++] = (byte) ('0' + magnitude % 10);
        return pos;
    }
}
