package org.scharp.psrwriter;

/**
 * A class for holding utility methods.
 */
abstract class MathUtil {

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes dividend / divisor, but instead of truncating any remainder, it always rounds up.
     *
     * @param dividend
     *     the dividend
     * @param divisor
     *     the divisor
     *
     * @return The result of the calculation.
     */
    // This can be replaced by Math.ceilDiv() in Java 18
    static long divideAndRoundUp(long dividend, long divisor) {
        assert 0 < divisor : "divideAndRoundUp doesn't handle non-positive divisors";
        assert 0 <= dividend : "divideAndRoundUp doesn't handle negative numbers";

        return (dividend + divisor - 1) / divisor;
    }

    /**
     * Computes the non-negative remainder of {@code value / modulus}.
     *
     * @param value
     *     the value to reduce
     * @param modulus
     *     the modulus, which must be positive
     *
     * @return A number in {@code [0, modulus)}.
     */
    static double positiveModulo(double value, double modulus) {
        assert 0 < modulus : "modulus must be positive";

        double remainder = value % modulus;
        if (remainder < 0) {
            remainder += modulus;
        }
        // adding the modulus to a tiny negative remainder can round to exactly modulus
        return remainder == modulus ? 0 : remainder;
    }
}
