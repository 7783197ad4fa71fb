///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.FitsOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Utility methods for building FITS headers with nom.tam.fits.
 */
final class FitsHeaderUtil {

    /**
     * The maximum length of a string value that fits on a single header card, with each apostrophe counted twice
     * because FITS escapes it by doubling it.
     */
    static final int MAX_STRING_LENGTH = 68;

    // private constructor to prevent anyone from instantiating the class.
    private FitsHeaderUtil() {
    }

    /**
     * Computes the number of characters a string value occupies on a header card once its apostrophes are doubled.
     *
     * @param value
     *     The string value.
     *
     * @return The quoted length, not counting the enclosing quotes.
     */
    static int quotedLength(String value) {
        int length = value.length();
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '\'') {
                length++;
            }
        }
        return length;
    }

    /**
     * Converts an arbitrary string into one that can be a single-card FITS string value.  Characters that aren't
     * printable ASCII are replaced with '?' and the string is cut at the last character that keeps its quoted
     * length within {@value #MAX_STRING_LENGTH}.
     *
     * @param value
     *     The string.
     *
     * @return A valid FITS string value.
     */
    static String sanitize(String value) {
        String ascii = value.replaceAll("[^\\x20-\\x7E]", "?");
        int end = 0;
        int length = 0;
        while (end < ascii.length()) {
            int width = ascii.charAt(end) == '\'' ? 2 : 1;
            if (MAX_STRING_LENGTH < length + width) {
                break;
            }
            length += width;
            end++;
        }
        return ascii.substring(0, end);
    }

    /**
     * Serializes a header, including its END card and the padding to a whole FITS block.
     *
     * @param header
     *     The header.
     *
     * @return The header's bytes.
     *
     * @throws FitsException
     *     if the header is not valid.
     */
    static byte[] toBytes(Header header) throws FitsException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (FitsOutputStream output = new FitsOutputStream(bytes)) {
            header.write(output);
        } catch (IOException exception) {
            throw new FitsException("Unable to serialize header", exception);
        }
        return bytes.toByteArray();
    }
}
