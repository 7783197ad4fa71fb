///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.nio.ByteOrder;

/**
 * Converts a stream of samples into bytes.
 * <p>
 * Sub-byte samples that don't complete a byte are held until the next call to {@link #encode} or {@link #finish},
 * so the bytes produced don't depend on how the stream is divided into calls.
 * </p>
 * <p>
 * Samples are cast to the encoding's type without rescaling.  Integer encodings keep the low bits of the sample's
 * integer part, after any column offset is subtracted.
 * </p>
 */
final class SampleEncoder {

    private final SampleEncoding encoding;
    private final boolean bigEndian;
    private final long zero;

    private int pendingByte;
    private int pendingSamples;

    SampleEncoder(SampleEncoding encoding, ByteOrder byteOrder) {
        this(encoding, byteOrder, 0);
    }

    private SampleEncoder(SampleEncoding encoding, ByteOrder byteOrder, long zero) {
        this.encoding = encoding;
        this.bigEndian = byteOrder == ByteOrder.BIG_ENDIAN;
        this.zero = zero;
    }

    /**
     * Creates an encoder for a FITS binary table column.  Values are big-endian and the column's TZERO is
     * subtracted from 16-bit samples before they are stored.
     *
     * @param encoding
     *     How samples are stored.
     *
     * @return A new encoder.
     */
    static SampleEncoder forFitsColumn(SampleEncoding encoding) {
        return new SampleEncoder(encoding, ByteOrder.BIG_ENDIAN, encoding.fitsZero());
    }

    SampleEncoding encoding() {
        return encoding;
    }

    /**
     * Computes an upper bound on the number of bytes that {@link #encode} writes for a number of samples.
     *
     * @param samples
     *     The number of samples.
     *
     * @return The maximum number of bytes.
     */
    int maxEncodedLength(int samples) {
        return Math.toIntExact(encoding.bytesFor(samples) + 1);
    }

    /**
     * Encodes samples.
     *
     * @param source
     *     The array of samples.
     * @param sourceOffset
     *     The index of the first sample to encode.
     * @param count
     *     The number of samples to encode.
     * @param target
     *     The array to write to.
     * @param targetOffset
     *     The offset in {@code target} of the first byte to write.
     *
     * @return The number of complete bytes written.
     */
    int encode(double[] source, int sourceOffset, int count, byte[] target, int targetOffset) {
        int offset = targetOffset;
        final int end = sourceOffset + count;
        switch (encoding) {
        case ONE_BIT:
        case TWO_BIT:
        case FOUR_BIT:
            final int nbits = encoding.nbits();
            final int samplesPerByte = 8 / nbits;
            final int mask = (1 << nbits) - 1;
            for (int i = sourceOffset; i < end; i++) {
                pendingSamples++;
                pendingByte |= ((int) (long) source[i] & mask) << (8 - nbits * pendingSamples);
                if (pendingSamples == samplesPerByte) {
                    target[offset++] = (byte) pendingByte;
                    pendingByte = 0;
                    pendingSamples = 0;
                }
            }
            break;

        case UNSIGNED_8:
            for (int i = sourceOffset; i < end; i++) {
                target[offset++] = (byte) (long) source[i];
            }
            break;

        case UNSIGNED_16:
            for (int i = sourceOffset; i < end; i++) {
                short value = (short) ((long) source[i] - zero);
                offset += bigEndian ? WriteUtil.writeBigEndian2(target, offset, value) : WriteUtil.write2(target,
                    offset, value);
            }
            break;

        case FLOAT_32:
            for (int i = sourceOffset; i < end; i++) {
                int bits = Float.floatToRawIntBits((float) source[i]);
                offset += bigEndian ? WriteUtil.writeBigEndian4(target, offset, bits) : WriteUtil.write4(target,
                    offset, bits);
            }
            break;

        default:
            throw new AssertionError("unhandled encoding " + encoding);
        }
        return offset - targetOffset;
    }

    /**
     * Writes the final, partially filled byte of a sub-byte stream, with its unused low bits set to zero.
     *
     * @param target
     *     The array to write to.
     * @param targetOffset
     *     The offset in {@code target} at which to write.
     *
     * @return The number of bytes written (0 or 1).
     */
    int finish(byte[] target, int targetOffset) {
        if (pendingSamples == 0) {
            return 0;
        }
        target[targetOffset] = (byte) pendingByte;
        pendingByte = 0;
        pendingSamples = 0;
        return 1;
    }
}
