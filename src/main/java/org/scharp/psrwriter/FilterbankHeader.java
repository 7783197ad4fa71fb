///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.scharp.psrwriter.WriteUtil.write4;
import static org.scharp.psrwriter.WriteUtil.write8;

/**
 * The header of a SIGPROC filterbank file.
 * <p>
 * The header is a sequence of records, each of which is a key followed by a value.  A key is written as a
 * little-endian 32-bit length followed by that many ASCII bytes.  A value is written according to the key: a
 * little-endian 32-bit integer, a little-endian IEEE 754 double, or a length-prefixed string like a key.  The
 * sequence starts with the key {@code HEADER_START} and ends with the key {@code HEADER_END}, neither of which
 * has a value.  The samples follow immediately.
 * </p>
 */
final class FilterbankHeader {

    static final String HEADER_START = "HEADER_START";
    static final String HEADER_END = "HEADER_END";

    /** The SIGPROC machine_id for data that didn't come from a known backend. */
    private static final int MACHINE_ID_UNKNOWN = 0;

    /** The SIGPROC data_type for filterbank data. */
    private static final int DATA_TYPE_FILTERBANK = 1;

    private final Map<String, Object> records;

    private FilterbankHeader(Map<String, Object> records) {
        this.records = records;
    }

    /**
     * Creates the header of a filterbank file that holds a window of a source.
     *
     * @param header
     *     The source's header.
     * @param window
     *     The window that is being written.
     * @param telescope
     *     The telescope that made the observation, or {@code null} if it is unknown.
     *
     * @return A header.
     */
    static FilterbankHeader forWindow(UnifiedHeader header, Window window, Telescope telescope) {
        final double tstart = header.tstart() + window.start() * header.tsamp() / AstroUtil.SECONDS_PER_DAY;
        final String rawDataFile = header.filenames().isEmpty() ? header.filename() : header.filenames().get(0);

        Map<String, Object> records = new LinkedHashMap<>();
        records.put("telescope_id", telescope != null ? telescope.sigprocId() : Telescope.UNKNOWN_SIGPROC_ID);
        records.put("machine_id", MACHINE_ID_UNKNOWN);
        records.put("data_type", DATA_TYPE_FILTERBANK);
        records.put("rawdatafile", rawDataFile);
        records.put("source_name", header.sourceName());
        records.put("barycentric", 0);
        records.put("pulsarcentric", 0);
        records.put("src_raj", AstroUtil.sigprocRightAscension(header.rightAscension()));
        records.put("src_dej", AstroUtil.sigprocDeclination(header.declination()));
        records.put("tstart", tstart);
        records.put("tsamp", header.tsamp());
        records.put("nbits", header.nbits());
        if (window.count() <= Integer.MAX_VALUE) {
            // SIGPROC readers compute the count from the file size when this is absent.
            records.put("nsamples", (int) window.count());
        }
        records.put("fch1", header.fch1() + window.channelMin() * header.foff());
        records.put("foff", header.foff());
        records.put("nchans", window.nchans());
        records.put("nifs", 1);
        records.put("nbeams", 1);
        records.put("ibeam", 0);
        return new FilterbankHeader(records);
    }

    /**
     * Gets the records of this header, in the order in which they are written.
     *
     * @return An unmodifiable map from key to value.  Each value is an {@link Integer}, a {@link Double}, or a
     *     {@link String}.
     */
    Map<String, Object> records() {
        return Collections.unmodifiableMap(records);
    }

    private static int stringSize(String string) {
        return 4 + string.getBytes(StandardCharsets.US_ASCII).length;
    }

    private static int writeString(byte[] data, int offset, String string) {
        byte[] ascii = string.getBytes(StandardCharsets.US_ASCII);
        write4(data, offset, ascii.length);
        System.arraycopy(ascii, 0, data, offset + 4, ascii.length);
        return 4 + ascii.length;
    }

    /**
     * Computes the number of bytes that {@link #write} writes.
     *
     * @return The size of the header in bytes.
     */
    int size() {
        int size = stringSize(HEADER_START) + stringSize(HEADER_END);
        for (Map.Entry<String, Object> record : records.entrySet()) {
            size += stringSize(record.getKey());
            Object value = record.getValue();
            if (value instanceof Integer) {
                size += 4;
            } else if (value instanceof Double) {
                size += 8;
            } else {
                size += stringSize((String) value);
            }
        }
        return size;
    }

    /**
     * Serializes this header.
     *
     * @param data
     *     The array to write to.  It must have at least {@link #size()} bytes.
     *
     * @return The number of bytes written.
     */
    int write(byte[] data) {
        int offset = writeString(data, 0, HEADER_START);
        for (Map.Entry<String, Object> record : records.entrySet()) {
            offset += writeString(data, offset, record.getKey());

            Object value = record.getValue();
            if (value instanceof Integer) {
                offset += write4(data, offset, (Integer) value);
            } else if (value instanceof Double) {
                offset += write8(data, offset, Double.doubleToRawLongBits((Double) value));
            } else {
                offset += writeString(data, offset, (String) value);
            }
        }
        offset += writeString(data, offset, HEADER_END);

        assert offset == size() : "wrote " + offset + " bytes but computed " + size();
        return offset;
    }
}
