package io.jsonstream.serialiser.utils;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AssertUtilsTests {
    @Test
    void testChecks() {
        assertDoesNotThrow(() -> AssertUtils.gtEqThanZero("value", 0));
        assertThrows(IllegalArgumentException.class, () -> AssertUtils.gtEqThanZero("value", -1));
        assertDoesNotThrow(() -> AssertUtils.gtThanZero("value", 1));
        assertThrows(IllegalArgumentException.class, () -> AssertUtils.gtThanZero("value", 0));
        assertDoesNotThrow(() -> AssertUtils.notNull("obj", new Object()));
        assertThrows(IllegalArgumentException.class, () -> AssertUtils.notNull("obj", null));
    }

    @Test
    void testRangeInBounds() {
        assertDoesNotThrow(() -> AssertUtils.rangeInBounds(0, 0, 0));
        assertDoesNotThrow(() -> AssertUtils.rangeInBounds(2, 3, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> AssertUtils.rangeInBounds(3, 3, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> AssertUtils.rangeInBounds(-1, 1, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> AssertUtils.rangeInBounds(0, -1, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> AssertUtils.rangeInBounds(Integer.MAX_VALUE, 2, 5), "no overflow");
    }
}
