///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

/**
 * Thrown when an output format has no representation for a sample bit depth.
 */
public class UnsupportedBitDepthException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int nbits;

    UnsupportedBitDepthException(int nbits, String formatName) {
        super(formatName + " cannot encode " + nbits + "-bit samples");
        this.nbits = nbits;
    }

    /**
     * Gets the bit depth that could not be encoded.
     *
     * @return The number of bits per sample.
     */
    public int nbits() {
        return nbits;
    }
}
