package io.jsonstream.serialiser.utils;

/**
 * Utility class used to examine function parameters. All the methods throw <code>IllegalArgumentException</code> or
 * <code>IndexOutOfBoundsException</code> if the argument doesn't fulfil constraints.
 */
public final class AssertUtils {
    private static final String MUST_BE_GREATER_THAN_OR_EQUAL_TO_0 = " must be greater than or equal to 0!";

    private AssertUtils() {
    }

    /**
     * Checks if the int value is &gt;= 0
     *
     * @param name name to be included in the exception message
     * @param value to be checked
     */
    public static void gtEqThanZero(final String name, final int value) {
        if (value < 0) {
            throw new IllegalArgumentException("The " + name + MUST_BE_GREATER_THAN_OR_EQUAL_TO_0);
        }
    }

    /**
     * Checks if the int value is &gt; 0
     *
     * @param name name to be included in the exception message
     * @param value to be checked
     */
    public static void gtThanZero(final String name, final int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("The " + name + " must be greater than 0!");
        }
    }

    /**
     * Checks that [offset, offset + length) is a valid range of an array of size 'bounds'
     *
     * @param offset first index of the range
     * @param length number of elements in the range
     * @param bounds array size
     */
    public static void rangeInBounds(final int offset, final int length, final int bounds) {
        if (offset < 0 || length < 0 || offset > bounds - length) {
            throw new IndexOutOfBoundsException("range [" + offset + ", " + offset + " + " + length + ") out of bounds for size " + bounds);
        }
    }

    public static <T> void notNull(final String name, final T obj) {
        if (obj == null) {
            throw new IllegalArgumentException("The " + name + " must be non-null!");
        }
    }
}
