///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.util.Locale;

/**
 * Time and angle conversions used by the header writers.
 */
final class AstroUtil {

    static final double SECONDS_PER_DAY = 86400.0;

    /** The MJD of the J2000.0 epoch (2000-01-01T12:00:00 TT, treated here as UT1). */
    private static final double J2000_MJD = 51544.5;

    private static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    // private constructor to prevent anyone from instantiating the class.
    private AstroUtil() {
    }

    /**
     * Gets the integer part of a Modified Julian Date.
     *
     * @param mjd
     *     The MJD.
     *
     * @return The MJD of the day that contains {@code mjd}.
     */
    static long integerDay(double mjd) {
        return (long) Math.floor(mjd);
    }

    /**
     * Gets the time of day of a Modified Julian Date in seconds.
     * <p>
     * The integer day is removed before the fraction is scaled to seconds, so that no precision of the fraction is
     * lost to the magnitude of the day number.
     * </p>
     *
     * @param mjd
     *     The MJD.
     *
     * @return The number of seconds since the start of the day, in {@code [0, 86400)}.
     */
    static double secondsOfDay(double mjd) {
        double fractionOfDay = mjd - Math.floor(mjd);
        return fractionOfDay * SECONDS_PER_DAY;
    }

    /**
     * Computes the local mean sidereal time.
     * <p>
     * This uses the IAU 1982 expression for Greenwich mean sidereal time and treats UTC as UT1, which is accurate
     * to better than a second.
     * </p>
     *
     * @param mjd
     *     The MJD (UTC).
     * @param eastLongitude
     *     The observer's longitude in degrees, positive to the east.
     *
     * @return The local sidereal time in seconds, in {@code [0, 86400)}.
     */
    static double localSiderealTime(double mjd, double eastLongitude) {
        final double daysSinceJ2000 = mjd - J2000_MJD;
        final double centuries = daysSinceJ2000 / DAYS_PER_JULIAN_CENTURY;
        final double greenwichDegrees = 280.46061837 + 360.98564736629 * daysSinceJ2000 +
            0.000387933 * centuries * centuries - centuries * centuries * centuries / 38710000.0;
        final double localDegrees = MathUtil.positiveModulo(greenwichDegrees + eastLongitude, 360.0);
        return MathUtil.positiveModulo(localDegrees / 15.0 * 3600.0, SECONDS_PER_DAY);
    }

    /**
     * Formats a right ascension as {@code hh:mm:ss.ssss}.
     *
     * @param degrees
     *     The right ascension in degrees.
     *
     * @return The sexagesimal string.
     */
    static String formatRightAscension(double degrees) {
        long[] hms = sexagesimal(MathUtil.positiveModulo(degrees, 360.0) / 15.0, 10_000, 24);
        return String.format(Locale.ROOT, "%02d:%02d:%02d.%04d", hms[0], hms[1], hms[2], hms[3]);
    }

    /**
     * Formats a declination as {@code +dd:mm:ss.sss}.
     *
     * @param degrees
     *     The declination in degrees.
     *
     * @return The sexagesimal string, always with a sign.
     */
    static String formatDeclination(double degrees) {
        long[] dms = sexagesimal(Math.abs(degrees), 1_000, Long.MAX_VALUE);
        char sign = degrees < 0 && (dms[0] | dms[1] | dms[2] | dms[3]) != 0 ? '-' : '+';
        return String.format(Locale.ROOT, "%c%02d:%02d:%02d.%03d", sign, dms[0], dms[1], dms[2], dms[3]);
    }

    /**
     * Encodes a right ascension in SIGPROC's {@code hhmmss.s} convention.
     *
     * @param degrees
     *     The right ascension in degrees.
     *
     * @return The right ascension as a number whose digits read as hours, minutes, and seconds.
     */
    static double sigprocRightAscension(double degrees) {
        long[] hms = sexagesimal(MathUtil.positiveModulo(degrees, 360.0) / 15.0, 10_000, 24);
        return hms[0] * 10000.0 + hms[1] * 100.0 + hms[2] + hms[3] / 10_000.0;
    }

    /**
     * Encodes a declination in SIGPROC's {@code ddmmss.s} convention.
     *
     * @param degrees
     *     The declination in degrees.
     *
     * @return The declination as a number whose digits read as degrees, arcminutes, and arcseconds.
     */
    static double sigprocDeclination(double degrees) {
        long[] dms = sexagesimal(Math.abs(degrees), 1_000, Long.MAX_VALUE);
        double magnitude = dms[0] * 10000.0 + dms[1] * 100.0 + dms[2] + dms[3] / 1_000.0;
        return degrees < 0 ? -magnitude : magnitude;
    }

    /**
     * Splits a non-negative value into whole units, sixtieths, and three-thousand-six-hundredths, rounding the
     * last field to a fixed number of fractional digits.  Rounding carries into the larger fields, so a field
     * never reads 60.
     *
     * @param value
     *     The value in its largest unit (hours or degrees).
     * @param fractionScale
     *     The number of fractional steps per second of the last field (for example, 10000 for four digits).
     * @param wrap
     *     The value at which the largest field wraps to zero (24 for hours).
     *
     * @return {@code [whole, minutes, seconds, fraction]}.
     */
    private static long[] sexagesimal(double value, long fractionScale, long wrap) {
        assert 0 <= value;

        final long stepsPerSecond = fractionScale;
        final long stepsPerMinute = 60 * stepsPerSecond;
        final long stepsPerUnit = 60 * stepsPerMinute;

        long steps = Math.round(value * stepsPerUnit);
        long whole = steps / stepsPerUnit;
        if (whole == wrap) {
            whole = 0;
        }
        steps %= stepsPerUnit;
        long minutes = steps / stepsPerMinute;
        steps %= stepsPerMinute;
        long seconds = steps / stepsPerSecond;
        long fraction = steps % stepsPerSecond;
        return new long[] { whole, minutes, seconds, fraction };
    }
}
