///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

/**
 * The on-disk representations of a sample, by bit depth.
 */
enum SampleEncoding {
    ONE_BIT(1, 'B'),
    TWO_BIT(2, 'B'),
    FOUR_BIT(4, 'B'),
    UNSIGNED_8(8, 'B'),
    UNSIGNED_16(16, 'I'),
    FLOAT_32(32, 'E');

    private final int nbits;
    private final char fitsColumnType;

    SampleEncoding(int nbits, char fitsColumnType) {
        this.nbits = nbits;
        this.fitsColumnType = fitsColumnType;
    }

    /**
     * Gets the encoding for a bit depth.
     *
     * @param nbits
     *     The number of bits per sample.
     * @param formatName
     *     The name of the output format.  This is used to create a more informative exception message.
     *
     * @return The encoding.
     *
     * @throws UnsupportedBitDepthException
     *     if there is no encoding for {@code nbits}.
     */
    static SampleEncoding forBits(int nbits, String formatName) {
        for (SampleEncoding encoding : values()) {
            if (encoding.nbits == nbits) {
                return encoding;
            }
        }
        throw new UnsupportedBitDepthException(nbits, formatName);
    }

    int nbits() {
        return nbits;
    }

    /**
     * Gets the FITS binary table type code of the column that holds samples of this encoding.  Sub-byte samples
     * are packed into unsigned bytes.
     *
     * @return 'B', 'I', or 'E'.
     */
    char fitsColumnType() {
        return fitsColumnType;
    }

    /**
     * Gets the TZERO of the FITS column that holds samples of this encoding.  FITS has no unsigned 16-bit type,
     * so 16-bit samples are stored as signed shorts offset by 32768.
     *
     * @return The value a FITS reader adds to each stored value.
     */
    long fitsZero() {
        return this == UNSIGNED_16 ? 32768 : 0;
    }

    /**
     * Gets whether more than one sample is packed into each byte.
     *
     * @return {@code true} for depths of 1, 2, and 4 bits.
     */
    boolean isPacked() {
        return nbits < 8;
    }

    /**
     * Computes how many bytes are needed to hold a number of samples, rounding up to a whole byte.
     *
     * @param samples
     *     The number of samples.
     *
     * @return The number of bytes.
     */
    long bytesFor(long samples) {
        return MathUtil.divideAndRoundUp(samples * nbits, 8);
    }
}
