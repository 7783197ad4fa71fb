package org.scharp.psrwriter;

import java.util.Arrays;

/**
 * Serializes rows of the SUBINT table.  All values are big-endian.
 */
final class SubintRow {

    private final SubintTableLayout layout;
    private final ObservationInfo info;
    private final double galacticLongitude;
    private final double galacticLatitude;

    /** The columns that are the same in every row, from DAT_FREQ through DAT_SCL. */
    private final byte[] channelColumns;

    SubintRow(SubintTableLayout layout, ObservationInfo info, double galacticLongitude, double galacticLatitude) {
        this.layout = layout;
        this.info = info;
        this.galacticLongitude = galacticLongitude;
        this.galacticLatitude = galacticLatitude;

        final int nchans = layout.nchans();
        final int nvalues = nchans * layout.npol();
        channelColumns = new byte[nchans * (8 + 4) + nvalues * (4 + 4)];
        int offset = 0;
        for (int i = 0; i < nchans; i++) {
            double frequency = info.fch1 + i * info.channelBandwidth;
            offset += WriteUtil.writeBigEndian8(channelColumns, offset, Double.doubleToRawLongBits(frequency));
        }
        final int one = Float.floatToRawIntBits(1.0f);
        for (int i = 0; i < nchans; i++) {
            offset += WriteUtil.writeBigEndian4(channelColumns, offset, one); // DAT_WTS
        }
        final int zero = Float.floatToRawIntBits(0.0f);
        for (int i = 0; i < nvalues; i++) {
            offset += WriteUtil.writeBigEndian4(channelColumns, offset, zero); // DAT_OFFS
        }
        for (int i = 0; i < nvalues; i++) {
            offset += WriteUtil.writeBigEndian4(channelColumns, offset, one); // DAT_SCL
        }
        assert offset == channelColumns.length;
    }

    private static int writeDouble(byte[] data, int offset, double value) {
        return WriteUtil.writeBigEndian8(data, offset, Double.doubleToRawLongBits(value));
    }

    private static int writeFloat(byte[] data, int offset, float value) {
        return WriteUtil.writeBigEndian4(data, offset, Float.floatToRawIntBits(value));
    }

    /**
     * Serializes a row.
     *
     * @param row
     *     The array to write to.  This must be at least {@link SubintTableLayout#rowWidth()} bytes long.
     * @param firstSpectrum
     *     The index, relative to the start of the file, of the row's first spectrum.
     * @param spectra
     *     The number of real spectra in the row.  If this is less than NSBLK, the remainder of the DATA cell is
     *     zero-filled.
     * @param samples
     *     The row's samples in spectrum-major order.
     */
    void write(byte[] row, long firstSpectrum, int spectra, double[] samples) {
        assert 0 < spectra && spectra <= layout.nsblk();

        final double duration = spectra * info.tsamp;
        final double midpoint = (firstSpectrum + spectra / 2.0) * info.tsamp;

        int offset = 0;
        offset += writeDouble(row, offset, duration); // TSUBINT
        offset += writeDouble(row, offset, midpoint); // OFFS_SUB
        offset += writeDouble(row, offset, info.lstAt(midpoint)); // LST_SUB
        offset += writeDouble(row, offset, info.rightAscensionDegrees); // RA_SUB
        offset += writeDouble(row, offset, info.declinationDegrees); // DEC_SUB
        offset += writeDouble(row, offset, galacticLongitude); // GLON_SUB
        offset += writeDouble(row, offset, galacticLatitude); // GLAT_SUB

        // FD_ANG, POS_ANG, PAR_ANG, TEL_AZ, TEL_ZEN
        for (int i = 0; i < 5; i++) {
            offset += writeFloat(row, offset, 0.0f);
        }

        System.arraycopy(channelColumns, 0, row, offset, channelColumns.length);
        offset += channelColumns.length;
        assert offset == layout.dataOffset();

        // Each row is packed on its own, so a row's DATA never shares a byte with its neighbor.
        SampleEncoder encoder = SampleEncoder.forFitsColumn(layout.encoding());
        final int samplesInRow = spectra * layout.nchans() * layout.npol();
        offset += encoder.encode(samples, 0, samplesInRow, row, offset);
        offset += encoder.finish(row, offset);

        Arrays.fill(row, offset, layout.rowWidth(), (byte) 0);
    }
}
