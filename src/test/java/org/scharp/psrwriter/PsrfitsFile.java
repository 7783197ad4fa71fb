package org.scharp.psrwriter;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads back a PSRFITS file.  The headers are parsed by nom.tam.fits, an independent FITS implementation.  The
 * SUBINT rows are located from the raw bytes so that the DATA cells can be compared byte for byte.
 */
final class PsrfitsFile {

    private final byte[] bytes;
    private final Header primaryHeader;
    private final Header subintHeader;
    private final int dataOffset;
    private final int rowWidth;

    static PsrfitsFile read(Path path) throws IOException, FitsException {
        return new PsrfitsFile(path);
    }

    private PsrfitsFile(Path path) throws IOException, FitsException {
        bytes = Files.readAllBytes(path);
        try (Fits fits = new Fits(path.toFile())) {
            BasicHDU<?> primary = fits.getHDU(0);
            BasicHDU<?> subint = fits.getHDU(1);
            primaryHeader = primary.getHeader();
            subintHeader = subint.getHeader();
        }

        int subintHeaderOffset = headerEnd(0);
        dataOffset = headerEnd(subintHeaderOffset);
        rowWidth = subintHeader.getIntValue("NAXIS1");
    }

    /**
     * Finds the end of the header that starts at {@code offset}, including its padding.
     */
    private int headerEnd(int offset) {
        for (int card = offset; card < bytes.length; card += 80) {
            String text = new String(bytes, card, 80, StandardCharsets.US_ASCII);
            if (text.equals("END" + " ".repeat(77))) {
                int end = card + 80;
                return end + (2880 - end % 2880) % 2880;
            }
        }
        throw new IllegalStateException("no END card after offset " + offset);
    }

    int length() {
        return bytes.length;
    }

    Header primaryHeader() {
        return primaryHeader;
    }

    Header subintHeader() {
        return subintHeader;
    }

    int dataOffset() {
        return dataOffset;
    }

    /**
     * Gets the raw card with the given keyword from the SUBINT header.
     */
    String subintCard(String keyword) {
        for (int card = headerEnd(0); card < dataOffset; card += 80) {
            String text = new String(bytes, card, 80, StandardCharsets.US_ASCII);
            if (text.startsWith(keyword + " ".repeat(8 - keyword.length()) + "=")) {
                return text;
            }
        }
        return null;
    }

    byte[] row(int index) {
        int start = dataOffset + index * rowWidth;
        return Arrays.copyOfRange(bytes, start, start + rowWidth);
    }

    ByteBuffer rowBuffer(int index) {
        // ByteBuffer defaults to big-endian, like FITS.
        return ByteBuffer.wrap(row(index));
    }

    /**
     * Gets the bytes that follow the last row.
     */
    byte[] padding(int rows) {
        return Arrays.copyOfRange(bytes, dataOffset + rows * rowWidth, bytes.length);
    }
}
