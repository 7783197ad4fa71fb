package org.scharp.psrwriter;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {
    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} can't be a FITS header string value of a given length.  FITS header
     * values are restricted to printable ASCII and each apostrophe is written as two, so apostrophes count twice
     * toward {@code maximumLength}.
     *
     * @param argument
     *     The string to check
     * @param maximumLength
     *     The maximum number of characters that {@code argument} may have once its apostrophes are doubled.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is not printable ASCII or is longer than {@code maximumLength}.
     */
    static void checkFitsString(String argument, int maximumLength, String argumentName) {
        assert 0 <= maximumLength : "maximumLength must not be negative";
        assert argumentName != null : "argumentName must not be null";

        if (!argument.matches("^[\\x20-\\x7E]*$")) {
            throw new IllegalArgumentException(argumentName + " must only contain printable ASCII characters");
        }
        if (maximumLength < FitsHeaderUtil.quotedLength(argument)) {
            String suffix = argument.indexOf('\'') < 0 ? "" : " when apostrophes are doubled";
            if (maximumLength == 1) {
                throw new IllegalArgumentException(
                    argumentName + " must not be longer than " + maximumLength + " character" + suffix);
            } else {
                throw new IllegalArgumentException(
                    argumentName + " must not be longer than " + maximumLength + " characters" + suffix);
            }
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(long argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }

    /**
     * Throws an exception if {@code argument} is not positive (greater than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is zero or negative
     */
    static void checkPositive(long argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument <= 0) {
            throw new IllegalArgumentException(argumentName + " must be positive");
        }
    }

    /**
     * Throws an exception if {@code argument} is not a finite, positive number.
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is zero, negative, infinite, or NaN.
     */
    static void checkPositive(double argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (!(0 < argument) || Double.isInfinite(argument)) {
            throw new IllegalArgumentException(argumentName + " must be a finite positive number");
        }
    }

    /**
     * Throws an exception if {@code argument} is infinite or NaN.
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is infinite or NaN.
     */
    static void checkFinite(double argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (!Double.isFinite(argument)) {
            throw new IllegalArgumentException(argumentName + " must be a finite number");
        }
    }
}
