package org.scharp.psrwriter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "arg"));
        assertEquals("arg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkFitsString(String, int, String)} */
    @Test
    void testCheckFitsString() {
        // empty string fits into 0 characters.
        ArgumentUtil.checkFitsString("", 0, "arg");

        ArgumentUtil.checkFitsString("J1713+0747", 10, "arg");
        ArgumentUtil.checkFitsString(" ~", 2, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkFitsString("hello", 4, "arg"));
        assertEquals("arg must not be longer than 4 characters", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkFitsString("hi", 1, "myArg"));
        assertEquals("myArg must not be longer than 1 character", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkFitsString("σ", 68, "observer"));
        assertEquals("observer must only contain printable ASCII characters", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkFitsString("tab\there", 68, "arg"));
        assertEquals("arg must only contain printable ASCII characters", exception.getMessage());
    }

    /** Tests that {@link ArgumentUtil#checkFitsString(String, int, String)} counts apostrophes twice. */
    @Test
    void testCheckFitsStringWithApostrophes() {
        ArgumentUtil.checkFitsString("O'Brien", 8, "observer");
        ArgumentUtil.checkFitsString("A'" + "B".repeat(65), 68, "observer");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkFitsString("O'Brien", 7, "observer"));
        assertEquals("observer must not be longer than 7 characters when apostrophes are doubled",
            exception.getMessage());

        // 67 characters, but 69 once the apostrophes are doubled.
        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkFitsString("A'" + "B".repeat(64) + "'", 68, "projectId"));
        assertEquals("projectId must not be longer than 68 characters when apostrophes are doubled",
            exception.getMessage());
    }

    @Test
    void testCheckPositive() {
        ArgumentUtil.checkPositive(1L, "arg");
        ArgumentUtil.checkPositive(0.001, "arg");

        Exception exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkPositive(0L, "nchans"));
        assertEquals("nchans must be positive", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkPositive(0.0, "tsamp"));
        assertEquals("tsamp must be a finite positive number", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkPositive(Double.NaN, "tsamp"));
        assertEquals("tsamp must be a finite positive number", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkPositive(Double.POSITIVE_INFINITY, "tsamp"));
        assertEquals("tsamp must be a finite positive number", exception.getMessage());
    }

    @Test
    void testCheckNotNegative() {
        ArgumentUtil.checkNotNegative(0, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(-1, "offset"));
        assertEquals("offset must not be negative", exception.getMessage());
    }

    @Test
    void testCheckFinite() {
        ArgumentUtil.checkFinite(-1.5, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkFinite(Double.NEGATIVE_INFINITY, "fch1"));
        assertEquals("fch1 must be a finite number", exception.getMessage());
    }
}
