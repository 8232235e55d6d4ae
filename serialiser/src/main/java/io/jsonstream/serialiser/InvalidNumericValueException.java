package io.jsonstream.serialiser;

/**
 * Thrown if a floating point value has no JSON representation (NaN or infinity).
 */
public class InvalidNumericValueException extends IllegalArgumentException {
    private static final long serialVersionUID = -1510546318003151286L;

    public InvalidNumericValueException(final double value) {
        super("value is NaN or infinity: " + value);
    }
}
