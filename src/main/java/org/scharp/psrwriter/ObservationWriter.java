///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts an observation into a Filterbank or PSRFITS file.
 * <p>
 * The window of spectra and channels to write is taken from a {@link WriterConfig} and checked against the source
 * when the writer is created.  Each of {@link #writeFilterbank()} and {@link #writePsrfits()} streams the window
 * from the source into a new file, reading at most {@link WriterConfig#chunkSize()} spectra at a time.
 * </p>
 * <pre>
 * SpectraSource source = ...;
 * WriterConfig config = WriterConfig.builder().
 *     startSample(1000).
 *     sampleCount(50000L).
 *     outputDirectory(Path.of("/data/converted")).
 *     build();
 *
 * ObservationWriter writer = new ObservationWriter(source, config);
 * Path filterbankFile = writer.writeFilterbank();
 * Path psrfitsFile = writer.writePsrfits();
 * </pre>
 * <p>
 * A writer holds no open files between calls.  Two calls may run concurrently on different threads if the source
 * supports concurrent reads.
 * </p>
 */
public final class ObservationWriter {

    private static final Logger LOG = LogManager.getLogger(ObservationWriter.class);

    static final String DEFAULT_NAME_SUFFIX = "_converted";

    private final SpectraSource source;
    private final WriterConfig config;
    private final UnifiedHeader header;
    private final Window window;

    /**
     * Creates a writer.
     *
     * @param source
     *     The observation to convert.
     * @param config
     *     The conversion's configuration.
     *
     * @throws NullPointerException
     *     if {@code source} or {@code config} is {@code null}, or if {@code source} has no header.
     * @throws InvalidWindowException
     *     if the configured window doesn't fit within the source.
     */
    public ObservationWriter(SpectraSource source, WriterConfig config) {
        ArgumentUtil.checkNotNull(source, "source");
        ArgumentUtil.checkNotNull(config, "config");

        this.source = source;
        this.config = config;
        this.header = source.header();
        ArgumentUtil.checkNotNull(header, "source.header()");
        this.window = WindowSelector.resolve(header.nspectra(), header.nchans(), config);
    }

    /**
     * Gets the window of the source that this writer converts.
     *
     * @return The resolved window.
     */
    public Window window() {
        return window;
    }

    /**
     * Gets the path of the file that a conversion to a given format writes.
     *
     * @param format
     *     The output format.
     *
     * @return The output location.
     */
    public Path outputPath(DataFormat format) {
        ArgumentUtil.checkNotNull(format, "format");
        String name = config.outputName();
        if (name == null) {
            String basename = header.basename().isBlank() ? "observation" : header.basename();
            name = basename + DEFAULT_NAME_SUFFIX;
        }
        return config.outputDirectory().resolve(name + format.extension());
    }

    /**
     * Writes the window as a SIGPROC filterbank file.  If the file exists, it is replaced.
     *
     * @return The path of the file that was written.
     *
     * @throws UnsupportedBitDepthException
     *     if the source's bit depth can't be written to a filterbank file.  No file is created.
     * @throws SourceReadException
     *     if the source failed.  The incomplete file is left at {@link SourceReadException#partialFile()}.
     * @throws OutputWriteException
     *     if the file could not be written.
     */
    public Path writeFilterbank() throws IOException {
        Telescope telescope = config.telescopeRegistry().find(header.telescope());
        Path target = outputPath(DataFormat.FILTERBANK);
        return write(new FilterbankEncoder(target, header, window, telescope));
    }

    /**
     * Writes the window as a PSRFITS search-mode file.  If the file exists, it is replaced.
     *
     * @return The path of the file that was written.
     *
     * @throws UnsupportedBitDepthException
     *     if the source's bit depth can't be written to a PSRFITS file.  No file is created.
     * @throws SourceReadException
     *     if the source failed.  The incomplete file is left at {@link SourceReadException#partialFile()}.
     * @throws OutputWriteException
     *     if the file could not be written.
     */
    public Path writePsrfits() throws IOException {
        ObservationInfo info = ObservationInfoBuilder.build(header, window, config);
        Path target = outputPath(DataFormat.PSRFITS);
        return write(new PsrfitsEncoder(target, header, window, info, config.spectraPerSubint()));
    }

    private Path write(SampleSink sink) throws IOException {
        LOG.info("Writing {} spectra of {} channels from {} to {} ({})",
            window.count(), window.nchans(), header.basename(), sink.target(), sink.format());

        ChunkedDataPump pump = new ChunkedDataPump(source, window, config.chunkSize(), config.progressListener());
        try {
            sink.open();
            pump.pump(sink);
            sink.close();
        } catch (SourceReadException exception) {
            abandon(sink, exception);
            exception.setPartialFile(sink.target());
            throw exception;
        } catch (IOException exception) {
            abandon(sink, exception);
            throw new OutputWriteException(sink.target(), sink.isFileCreated(), exception);
        } catch (RuntimeException exception) {
            abandon(sink, exception);
            throw exception;
        }

        LOG.info("Finished writing {}", sink.target());
        return sink.target();
    }

    private static void abandon(SampleSink sink, Exception failure) {
        try {
            sink.abandon();
        } catch (IOException abandonException) {
            failure.addSuppressed(abandonException);
        }
    }
}
