package org.scharp.psrwriter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/** Unit tests for {@link AstroUtil}. */
public class AstroUtilTest {

    @Test
    void testSplitMjd() {
        assertEquals(58000, AstroUtil.integerDay(58000.75));
        assertEquals(64800.0, AstroUtil.secondsOfDay(58000.75), 1e-6);

        assertEquals(60000, AstroUtil.integerDay(60000.0));
        assertEquals(0.0, AstroUtil.secondsOfDay(60000.0));

        // A sub-millisecond offset survives because the day is removed before scaling.
        double mjd = 59000.0 + 0.0001 / AstroUtil.SECONDS_PER_DAY;
        assertEquals(59000, AstroUtil.integerDay(mjd));
        assertEquals(0.0001, AstroUtil.secondsOfDay(mjd), 1e-6);
    }

    @Test
    void testLocalSiderealTime() {
        // At J2000.0 GMST is 280.46061837 degrees, which is 18h41m50.548s.
        assertEquals(67310.548, AstroUtil.localSiderealTime(51544.5, 0.0), 1e-3);

        // 90 degrees east adds six hours, wrapping past midnight.
        assertEquals(67310.548 + 21600 - 86400, AstroUtil.localSiderealTime(51544.5, 90.0), 1e-3);

        // West longitudes subtract.
        assertEquals(67310.548 - 21600, AstroUtil.localSiderealTime(51544.5, -90.0), 1e-3);

        // One solar day later, sidereal time has advanced by 3m56.555s.
        double advance = AstroUtil.localSiderealTime(51545.5, 0.0) - AstroUtil.localSiderealTime(51544.5, 0.0);
        assertEquals(236.555, advance, 1e-2);
    }

    @Test
    void testFormatRightAscension() {
        assertEquals("00:00:00.0000", AstroUtil.formatRightAscension(0.0));
        assertEquals("12:00:00.0000", AstroUtil.formatRightAscension(180.0));
        assertEquals("05:34:31.9392", AstroUtil.formatRightAscension(83.63308));

        // Rounding carries all the way up and wraps at 24 hours.
        assertEquals("00:00:00.0000", AstroUtil.formatRightAscension(359.9999999999));
        assertEquals("01:00:00.0000", AstroUtil.formatRightAscension(14.9999999999));
    }

    @Test
    void testFormatDeclination() {
        assertEquals("+00:00:00.000", AstroUtil.formatDeclination(0.0));
        assertEquals("+22:00:52.200", AstroUtil.formatDeclination(22.0145));
        assertEquals("-00:30:00.000", AstroUtil.formatDeclination(-0.5));
        assertEquals("-90:00:00.000", AstroUtil.formatDeclination(-90.0));

        // Rounding carries into the minutes and degrees.
        assertEquals("+11:00:00.000", AstroUtil.formatDeclination(10.99999999999));

        // A value that rounds to zero has no sign.
        assertEquals("+00:00:00.000", AstroUtil.formatDeclination(-1e-12));
    }

    @Test
    void testSigprocCoordinates() {
        assertEquals(53431.9392, AstroUtil.sigprocRightAscension(83.63308), 1e-6);
        assertEquals(120000.0, AstroUtil.sigprocRightAscension(180.0), 1e-9);

        assertEquals(220052.2, AstroUtil.sigprocDeclination(22.0145), 1e-6);
        assertEquals(-3000.0, AstroUtil.sigprocDeclination(-0.5), 1e-9);
    }
}
