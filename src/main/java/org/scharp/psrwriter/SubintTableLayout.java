///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The layout of the SUBINT binary table of a PSRFITS search-mode file.  Each row holds {@code nsblk} consecutive
 * spectra together with the time, position, and frequency metadata of the subintegration.
 */
final class SubintTableLayout {

    /**
     * A column of the binary table.
     */
    static final class Column {
        private final String name;
        private final long repeat;
        private final char type;
        private final String unit;
        private final String dimensions;
        private final long zero;

        Column(String name, long repeat, char type, String unit, String dimensions) {
            this(name, repeat, type, unit, dimensions, 0);
        }

        Column(String name, long repeat, char type, String unit, String dimensions, long zero) {
            this.name = name;
            this.repeat = repeat;
            this.type = type;
            this.unit = unit;
            this.dimensions = dimensions;
            this.zero = zero;
        }

        String name() {
            return name;
        }

        long repeat() {
            return repeat;
        }

        char type() {
            return type;
        }

        /**
         * @return The TFORM value of this column, for example "1D" or "4096E".
         */
        String format() {
            return repeat + String.valueOf(type);
        }

        /**
         * @return The unit of this column's values, or {@code null} if they have no unit.
         */
        String unit() {
            return unit;
        }

        /**
         * @return The TDIM value of this column, or {@code null} if it is one-dimensional.
         */
        String dimensions() {
            return dimensions;
        }

        /**
         * @return The TZERO value of this column, which a reader adds to each stored value.
         */
        long zero() {
            return zero;
        }

        long width() {
            return repeat * bytesPerElement(type);
        }
    }

    static final String EXTENSION_NAME = "SUBINT";

    private final SampleEncoding encoding;
    private final int nchans;
    private final int npol;
    private final int nsblk;
    private final List<Column> columns;
    private final int rowWidth;
    private final int dataOffset;

    private static int bytesPerElement(char type) {
        switch (type) {
        case 'B':
            return 1;
        case 'I':
            return 2;
        case 'E':
            return 4;
        case 'D':
            return 8;
        default:
            throw new AssertionError("unsupported column type " + type);
        }
    }

    /**
     * Creates a layout.
     *
     * @param encoding
     *     How samples are stored in the DATA column.
     * @param nchans
     *     The number of channels per spectrum.
     * @param npol
     *     The number of polarizations per channel.
     * @param nsblk
     *     The number of spectra per row.
     *
     * @throws IllegalArgumentException
     *     if a row would be larger than 2GiB or hold more than {@link Integer#MAX_VALUE} samples.
     */
    SubintTableLayout(SampleEncoding encoding, int nchans, int npol, int nsblk) {
        ArgumentUtil.checkPositive(nchans, "nchans");
        ArgumentUtil.checkPositive(npol, "npol");
        ArgumentUtil.checkPositive(nsblk, "nsblk");

        this.encoding = encoding;
        this.nchans = nchans;
        this.npol = npol;
        this.nsblk = nsblk;

        final long samplesPerRow = (long) nsblk * nchans * npol;
        if (Integer.MAX_VALUE < samplesPerRow) {
            throw new IllegalArgumentException(
                "a SUBINT row of " + nsblk + " spectra holds " + samplesPerRow + " samples, which is too many");
        }
        final long dataRepeat;
        final String dataDimensions;
        if (encoding.isPacked()) {
            dataRepeat = encoding.bytesFor(samplesPerRow);
            // The first axis is in bytes, which only works when a spectrum fills whole bytes.
            final long bitsPerPolarization = (long) nchans * encoding.nbits();
            dataDimensions = bitsPerPolarization % 8 == 0 ?
                "(" + bitsPerPolarization / 8 + "," + npol + "," + nsblk + ")" :
                null;
        } else {
            dataRepeat = samplesPerRow;
            dataDimensions = "(" + nchans + "," + npol + "," + nsblk + ")";
        }

        List<Column> list = new ArrayList<>();
        list.add(new Column("TSUBINT", 1, 'D', "s", null));
        list.add(new Column("OFFS_SUB", 1, 'D', "s", null));
        list.add(new Column("LST_SUB", 1, 'D', "s", null));
        list.add(new Column("RA_SUB", 1, 'D', "deg", null));
        list.add(new Column("DEC_SUB", 1, 'D', "deg", null));
        list.add(new Column("GLON_SUB", 1, 'D', "deg", null));
        list.add(new Column("GLAT_SUB", 1, 'D', "deg", null));
        list.add(new Column("FD_ANG", 1, 'E', "deg", null));
        list.add(new Column("POS_ANG", 1, 'E', "deg", null));
        list.add(new Column("PAR_ANG", 1, 'E', "deg", null));
        list.add(new Column("TEL_AZ", 1, 'E', "deg", null));
        list.add(new Column("TEL_ZEN", 1, 'E', "deg", null));
        list.add(new Column("DAT_FREQ", nchans, 'D', "MHz", null));
        list.add(new Column("DAT_WTS", nchans, 'E', null, null));
        list.add(new Column("DAT_OFFS", (long) nchans * npol, 'E', null, null));
        list.add(new Column("DAT_SCL", (long) nchans * npol, 'E', null, null));
        list.add(new Column("DATA", dataRepeat, encoding.fitsColumnType(), "Jy", dataDimensions,
            encoding.fitsZero()));
        columns = Collections.unmodifiableList(list);

        long width = 0;
        for (Column column : columns) {
            width += column.width();
        }
        if (Integer.MAX_VALUE < width) {
            throw new IllegalArgumentException("a SUBINT row of " + nsblk + " spectra is too large");
        }
        rowWidth = (int) width;
        dataOffset = (int) (width - columns.get(columns.size() - 1).width());
    }

    SampleEncoding encoding() {
        return encoding;
    }

    int nchans() {
        return nchans;
    }

    int npol() {
        return npol;
    }

    int nsblk() {
        return nsblk;
    }

    /**
     * @return The number of samples in the DATA cell of a row.
     */
    int samplesPerRow() {
        return nsblk * nchans * npol;
    }

    List<Column> columns() {
        return columns;
    }

    /**
     * @return The number of bytes in each row (NAXIS1).
     */
    int rowWidth() {
        return rowWidth;
    }

    /**
     * @return The offset of the DATA column within a row.
     */
    int dataOffset() {
        return dataOffset;
    }

    /**
     * @return The number of bytes in the DATA cell of a row.
     */
    int dataWidth() {
        return rowWidth - dataOffset;
    }

    /**
     * Builds the header of the SUBINT extension.
     *
     * @param info
     *     The observation's metadata.
     * @param rows
     *     The number of rows (NAXIS2).
     * @param totalSpectra
     *     The number of real spectra in the table, which excludes the padding of the last row.
     *
     * @return The header, without its END card.
     *
     * @throws HeaderCardException
     *     if a value cannot be represented on a header card.
     */
    Header header(ObservationInfo info, long rows, long totalSpectra) throws HeaderCardException {
        Header header = new Header();
        header.addValue("XTENSION", "BINTABLE", "***** Subintegration data  *****");
        header.addValue("BITPIX", 8, "N/A");
        header.addValue("NAXIS", 2, "2-dimensional binary table");
        header.addValue("NAXIS1", rowWidth, "width of table in bytes");
        header.addValue("NAXIS2", rows, "Number of rows in table (NSUBINT)");
        header.addValue("PCOUNT", 0, "size of special data area");
        header.addValue("GCOUNT", 1, "one data group (required keyword)");
        header.addValue("TFIELDS", columns.size(), "Number of fields per row");
        header.addValue("EXTNAME", EXTENSION_NAME, "name of this binary table extension");

        int index = 1;
        for (Column column : columns) {
            header.addValue("TTYPE" + index, column.name(), null);
            header.addValue("TFORM" + index, column.format(), null);
            if (column.unit() != null) {
                header.addValue("TUNIT" + index, column.unit(), null);
            }
            if (column.dimensions() != null) {
                header.addValue("TDIM" + index, column.dimensions(), "Dimensions (NCHAN,NPOL,NSBLK)");
            }
            if (column.zero() != 0) {
                header.addValue("TZERO" + index, column.zero(), "Offset of the stored unsigned values");
            }
            index++;
        }

        header.addValue("INT_TYPE", "TIME", "Time axis (TIME, BINPHSPERI, BINLNGASC, etc)");
        header.addValue("INT_UNIT", "SEC", "Unit of time axis (SEC, PHS (0-1), DEG)");
        header.addValue("SCALE", "FluxDen", "Intensity units (FluxDen/RefFlux/Jansky)");
        header.addValue("POL_TYPE", npol == 1 ? "AA+BB" : "AABBCRCI", "Polarisation identifier");
        header.addValue("NPOL", npol, "Nr of polarisations");
        header.addValue("TBIN", info.tsamp, "[s] Time per bin or sample");
        header.addValue("NBIN", 1, "Nr of bins (PSR/CAL mode; else 1)");
        header.addValue("NBIN_PRD", 0, "Nr of bins/pulse period (for gated data)");
        header.addValue("PHS_OFFS", 0.0, "Phase offset of bin 0 for gated data");
        header.addValue("NBITS", encoding.nbits(), "Nr of bits/datum (SEARCH mode data, else 1)");
        header.addValue("ZERO_OFF", 0.0, "Zero offset for SEARCH-mode data");
        header.addValue("NSUBOFFS", 0, "Subint offset (Contiguous SEARCH-mode files)");
        header.addValue("NCHAN", nchans, "Number of channels/sub-bands in this file");
        header.addValue("CHAN_BW", info.channelBandwidth, "[MHz] Channel/sub-band width");
        header.addValue("NCHNOFFS", 0, "Channel/sub-band offset for split files");
        header.addValue("NSBLK", nsblk, "Samples/row (SEARCH mode, else 1)");
        header.addValue("NSTOT", totalSpectra, "Total number of samples (SEARCH mode)");
        return header;
    }
}
