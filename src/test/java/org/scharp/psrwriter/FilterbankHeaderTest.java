package org.scharp.psrwriter;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/** Unit tests for {@link FilterbankHeader}. */
public class FilterbankHeaderTest {

    private static final double TSAMP = 0.00126646875;

    @Test
    void testRecordsForChannelSubset() {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(8, 90, 100).build();
        Window window = new Window(0, 10, 10, 90);
        Telescope gbt = TelescopeRegistry.builtIn().find("GBT");

        FilterbankHeader filterbankHeader = FilterbankHeader.forWindow(header, window, gbt);
        Map<String, Object> records = filterbankHeader.records();

        assertEquals(
            List.of("telescope_id", "machine_id", "data_type", "rawdatafile", "source_name", "barycentric",
                "pulsarcentric", "src_raj", "src_dej", "tstart", "tsamp", "nbits", "nsamples", "fch1", "foff",
                "nchans", "nifs", "nbeams", "ibeam"),
            List.copyOf(records.keySet()));

        assertEquals(6, records.get("telescope_id"));
        assertEquals(0, records.get("machine_id"));
        assertEquals(1, records.get("data_type"));
        assertEquals("test_observation.fil", records.get("rawdatafile"));
        assertEquals("J1713+0747", records.get("source_name"));
        assertEquals(171349.512, (Double) records.get("src_raj"), 1e-6);
        assertEquals(74737.32, (Double) records.get("src_dej"), 1e-6);
        assertEquals(59000.5, records.get("tstart"));
        assertEquals(TSAMP, records.get("tsamp"));
        assertEquals(8, records.get("nbits"));
        assertEquals(10, records.get("nsamples"));
        assertEquals(1445.0, records.get("fch1"));
        assertEquals(-1.0, records.get("foff"));
        assertEquals(80, records.get("nchans"));
        assertEquals(1, records.get("nifs"));
        assertEquals(1, records.get("nbeams"));
        assertEquals(0, records.get("ibeam"));
    }

    @Test
    void testStartTimeFollowsWindow() {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(8, 4, 1000).build();
        FilterbankHeader filterbankHeader = FilterbankHeader.forWindow(header, new Window(500, 10, 0, 4), null);

        assertEquals(59000.5 + 500 * TSAMP / 86400, (Double) filterbankHeader.records().get("tstart"), 1e-12);
        assertEquals(Telescope.UNKNOWN_SIGPROC_ID, filterbankHeader.records().get("telescope_id"));
    }

    @Test
    void testHugeWindowOmitsSampleCount() {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(8, 1, 5_000_000_000L).build();
        FilterbankHeader filterbankHeader = FilterbankHeader.forWindow(header,
            new Window(0, 5_000_000_000L, 0, 1), null);
        assertFalse(filterbankHeader.records().containsKey("nsamples"));
    }

    @Test
    void testWrite() {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(4, 16, 100).
            filenames(List.of()).
            filename("raw.dat").
            build();
        FilterbankHeader filterbankHeader = FilterbankHeader.forWindow(header, new Window(0, 100, 0, 16), null);

        byte[] data = new byte[filterbankHeader.size()];
        assertEquals(data.length, filterbankHeader.write(data));

        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals("HEADER_START", readString(buffer));
        assertEquals("telescope_id", readString(buffer));
        assertEquals(0, buffer.getInt());
        assertEquals("machine_id", readString(buffer));
        assertEquals(0, buffer.getInt());
        assertEquals("data_type", readString(buffer));
        assertEquals(1, buffer.getInt());
        assertEquals("rawdatafile", readString(buffer));
        assertEquals("raw.dat", readString(buffer));

        // The header ends with the end marker.
        byte[] tail = new byte[14];
        System.arraycopy(data, data.length - 14, tail, 0, 14);
        ByteBuffer tailBuffer = ByteBuffer.wrap(tail).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals("HEADER_END", readString(tailBuffer));
    }

    private static String readString(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.getInt()];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.US_ASCII);
    }
}
