package org.scharp.psrwriter;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link FilterbankEncoder}. */
public class FilterbankEncoderTest {

    @Test
    void testWriteTwoBitSamples() throws IOException {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(2, 3, 10).build();
        Window window = new Window(0, 3, 0, 3);

        Path directory = Files.createTempDirectory("filterbank-encoder-");
        Path target = directory.resolve("out.fil");
        try {
            FilterbankEncoder encoder = new FilterbankEncoder(target, header, window, null);
            assertEquals(DataFormat.FILTERBANK, encoder.format());
            assertEquals(target, encoder.target());
            assertFalse(encoder.isFileCreated());

            encoder.open();
            assertTrue(encoder.isFileCreated());

            // Spectra of three channels don't align with bytes, so packing continues across batches.
            encoder.append(SampleBlock.of(new double[][] { { 3, 2, 1 } }));
            encoder.append(SampleBlock.of(new double[][] { { 0, 1, 2 }, { 3, 3, 3 } }));
            encoder.close();

            FilterbankFile file = FilterbankFile.read(target);
            assertEquals(encoder.header().size(), file.headerLength());
            assertEquals(3, file.integer("nchans"));
            assertEquals(3, file.integer("nsamples"));
            assertEquals(2, file.integer("nbits"));

            // 11 10 01 00 | 01 10 11 11 | 11 00 00 00
            assertArrayEquals(new byte[] { (byte) 0xE4, 0x6F, (byte) 0xC0 }, file.data());
        } finally {
            Files.deleteIfExists(target);
            Files.deleteIfExists(directory);
        }
    }

    @Test
    void testWriteFloatSamples() throws IOException {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(32, 2, 10).build();
        Window window = new Window(0, 2, 0, 2);

        Path directory = Files.createTempDirectory("filterbank-encoder-");
        Path target = directory.resolve("out.fil");
        try {
            FilterbankEncoder encoder = new FilterbankEncoder(target, header, window, null);
            encoder.open();
            encoder.append(SampleBlock.of(new double[][] { { 1.5, -2.0 }, { 0.0, 1e6 } }));
            encoder.close();

            FilterbankFile file = FilterbankFile.read(target);
            assertEquals(16, file.data().length);
            assertArrayEquals(new double[] { 1.5, -2.0, 0.0, 1e6 }, file.samples());
        } finally {
            Files.deleteIfExists(target);
            Files.deleteIfExists(directory);
        }
    }

    @Test
    void testUnsupportedBitDepthCreatesNoFile() throws IOException {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(12, 2, 10).build();

        Path directory = Files.createTempDirectory("filterbank-encoder-");
        Path target = directory.resolve("out.fil");
        try {
            UnsupportedBitDepthException exception = assertThrows(
                UnsupportedBitDepthException.class,
                () -> new FilterbankEncoder(target, header, new Window(0, 10, 0, 2), null));
            assertEquals(12, exception.nbits());
            assertEquals("Filterbank cannot encode 12-bit samples", exception.getMessage());
            assertFalse(Files.exists(target));
        } finally {
            Files.deleteIfExists(target);
            Files.deleteIfExists(directory);
        }
    }

    @Test
    void testStateMachine() throws IOException {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(8, 2, 10).build();
        Window window = new Window(0, 2, 0, 2);
        SampleBlock spectrum = SampleBlock.of(new double[][] { { 1, 2 } });

        Path directory = Files.createTempDirectory("filterbank-encoder-");
        Path target = directory.resolve("out.fil");
        try {
            FilterbankEncoder encoder = new FilterbankEncoder(target, header, window, null);

            Exception exception = assertThrows(IllegalStateException.class, () -> encoder.append(spectrum));
            assertEquals("Cannot append to a filterbank encoder before it is opened", exception.getMessage());

            exception = assertThrows(IllegalStateException.class, encoder::close);
            assertEquals("Cannot close a filterbank encoder that was never opened", exception.getMessage());

            encoder.open();
            exception = assertThrows(IllegalStateException.class, encoder::open);
            assertEquals("Cannot open a filterbank encoder twice", exception.getMessage());

            exception = assertThrows(
                IllegalArgumentException.class,
                () -> encoder.append(SampleBlock.of(new double[][] { { 1, 2, 3 } })));
            assertEquals("batch has 3 channels but the file has 2", exception.getMessage());

            encoder.append(spectrum);

            // Closing early finalizes the file but reports the shortfall.
            exception = assertThrows(IllegalStateException.class, encoder::close);
            assertEquals("The header declares 2 spectra but only 1 were written.", exception.getMessage());

            // close() is idempotent
            encoder.close();

            exception = assertThrows(IllegalStateException.class, () -> encoder.append(spectrum));
            assertEquals("Cannot append to a closed filterbank encoder", exception.getMessage());
        } finally {
            Files.deleteIfExists(target);
            Files.deleteIfExists(directory);
        }
    }

    @Test
    void testAppendingTooManySpectra() throws IOException {
        UnifiedHeader header = ArraySpectraSource.headerBuilder(8, 1, 10).build();

        Path directory = Files.createTempDirectory("filterbank-encoder-");
        Path target = directory.resolve("out.fil");
        try {
            FilterbankEncoder encoder = new FilterbankEncoder(target, header, new Window(0, 1, 0, 1), null);
            encoder.open();
            Exception exception = assertThrows(
                IllegalStateException.class,
                () -> encoder.append(SampleBlock.of(new double[][] { { 1 }, { 2 } })));
            assertEquals("wrote more spectra than the header declares", exception.getMessage());

            encoder.abandon();
            encoder.abandon();
            assertTrue(encoder.isFileCreated());
        } finally {
            Files.deleteIfExists(target);
            Files.deleteIfExists(directory);
        }
    }
}
