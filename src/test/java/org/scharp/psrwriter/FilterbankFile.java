package org.scharp.psrwriter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A minimal SIGPROC filterbank reader, used to check the files that {@link FilterbankEncoder} writes.
 * It also serves the file's spectra as a {@link SpectraSource}.
 */
final class FilterbankFile implements SpectraSource {

    private static final Set<String> INTEGER_KEYS = Set.of(
        "telescope_id", "machine_id", "data_type", "barycentric", "pulsarcentric", "nbits", "nsamples", "nchans",
        "nifs", "nbeams", "ibeam");

    private static final Set<String> STRING_KEYS = Set.of("rawdatafile", "source_name");

    private final Map<String, Object> records;
    private final int headerLength;
    private final byte[] data;
    private final UnifiedHeader header;

    private static String readString(ByteBuffer buffer) {
        int length = buffer.getInt();
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.US_ASCII);
    }

    static FilterbankFile read(Path path) throws IOException {
        return new FilterbankFile(Files.readAllBytes(path), path.getFileName().toString());
    }

    private FilterbankFile(byte[] file, String filename) {
        ByteBuffer buffer = ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN);
        if (!FilterbankHeader.HEADER_START.equals(readString(buffer))) {
            throw new IllegalArgumentException("missing HEADER_START");
        }

        records = new LinkedHashMap<>();
        for (String key = readString(buffer); !FilterbankHeader.HEADER_END.equals(key); key = readString(buffer)) {
            if (INTEGER_KEYS.contains(key)) {
                records.put(key, buffer.getInt());
            } else if (STRING_KEYS.contains(key)) {
                records.put(key, readString(buffer));
            } else {
                records.put(key, buffer.getDouble());
            }
        }
        headerLength = buffer.position();
        data = Arrays.copyOfRange(file, headerLength, file.length);

        final int nbits = integer("nbits");
        final int nchans = integer("nchans");
        final long nspectra = records.containsKey("nsamples") ?
            integer("nsamples") :
            data.length * 8L / nbits / nchans;
        String basename = filename.endsWith(".fil") ? filename.substring(0, filename.length() - 4) : filename;
        header = UnifiedHeader.builder().
            basename(basename).
            filenames(List.of(filename)).
            sourceName((String) records.get("source_name")).
            nbits(nbits).
            fch1(real("fch1")).
            foff(real("foff")).
            nativeNchans(nchans).
            nativeNspectra(nspectra).
            nativeTsamp(real("tsamp")).
            tstart(real("tstart")).
            build();
    }

    Map<String, Object> records() {
        return records;
    }

    int integer(String key) {
        return (Integer) records.get(key);
    }

    double real(String key) {
        return (Double) records.get(key);
    }

    int headerLength() {
        return headerLength;
    }

    byte[] data() {
        return data;
    }

    /**
     * Decodes every sample in the file, in file order.
     */
    double[] samples() {
        final int nbits = integer("nbits");
        final int count = (int) (header.nspectra() * header.nchans());
        return decode(nbits, data, count);
    }

    static double[] decode(int nbits, byte[] data, int count) {
        double[] samples = new double[count];
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        switch (nbits) {
        case 1:
        case 2:
        case 4:
            int[] values = BitPacking.unpack(nbits, data, count);
            for (int i = 0; i < count; i++) {
                samples[i] = values[i];
            }
            break;
        case 8:
            for (int i = 0; i < count; i++) {
                samples[i] = Byte.toUnsignedInt(data[i]);
            }
            break;
        case 16:
            for (int i = 0; i < count; i++) {
                samples[i] = Short.toUnsignedInt(buffer.getShort());
            }
            break;
        case 32:
            for (int i = 0; i < count; i++) {
                samples[i] = buffer.getFloat();
            }
            break;
        default:
            throw new IllegalArgumentException("unsupported nbits " + nbits);
        }
        return samples;
    }

    @Override
    public UnifiedHeader header() {
        return header;
    }

    @Override
    public SampleBlock read(long start, int count) {
        final int nchans = header.nchans();
        double[] all = samples();
        int from = (int) start * nchans;
        return SampleBlock.wrap(count, nchans, Arrays.copyOfRange(all, from, from + count * nchans));
    }
}
