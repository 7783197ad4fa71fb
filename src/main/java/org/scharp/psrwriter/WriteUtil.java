///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

/**
 * Utility methods for writing data to a byte array.
 * <p>
 * Filterbank files are little-endian. FITS files are big-endian.  Both variants are here so that each format's
 * writer states its byte order at the call site.
 * </p>
 */
final class WriteUtil {

    // private constructor to prevent anyone from instantiating the class.
    private WriteUtil() {
    }

    /**
     * Writes the low {@code size} bytes of a number to an array, least significant byte first.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array of the first byte to write.
     * @param number
     *     The number to write.
     * @param size
     *     The number of bytes to write.
     *
     * @return {@code size}
     */
    private static int writeLittleEndian(byte[] data, int offset, long number, int size) {
        for (int i = 0; i < size; i++) {
            data[offset + i] = (byte) (number >> (8 * i));
        }
        return size;
    }

    /**
     * Writes the low {@code size} bytes of a number to an array, most significant byte first.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array of the first byte to write.
     * @param number
     *     The number to write.
     * @param size
     *     The number of bytes to write.
     *
     * @return {@code size}
     */
    private static int writeBigEndian(byte[] data, int offset, long number, int size) {
        for (int i = 0; i < size; i++) {
            data[offset + size - 1 - i] = (byte) (number >> (8 * i));
        }
        return size;
    }

    /** Writes a {@code short} as little endian.  Returns the number of bytes written. */
    static int write2(byte[] data, int offset, short number) {
        return writeLittleEndian(data, offset, number, 2);
    }

    /** Writes an {@code int} as little endian.  Returns the number of bytes written. */
    static int write4(byte[] data, int offset, int number) {
        return writeLittleEndian(data, offset, number, 4);
    }

    /** Writes a {@code long} as little endian.  Returns the number of bytes written. */
    static int write8(byte[] data, int offset, long number) {
        return writeLittleEndian(data, offset, number, 8);
    }

    static int writeBigEndian2(byte[] data, int offset, short number) {
        return writeBigEndian(data, offset, number, 2);
    }

    static int writeBigEndian4(byte[] data, int offset, int number) {
        return writeBigEndian(data, offset, number, 4);
    }

    static int writeBigEndian8(byte[] data, int offset, long number) {
        return writeBigEndian(data, offset, number, 8);
    }
}
