///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Moves a window of spectra from a {@link SpectraSource} to a {@link SampleSink} in bounded batches.
 * <p>
 * At most {@code chunkSize} spectra are held in memory at a time, no matter how large the window is.
 * </p>
 */
final class ChunkedDataPump {

    private static final Logger LOG = LogManager.getLogger(ChunkedDataPump.class);

    private final SpectraSource source;
    private final Window window;
    private final int chunkSize;
    private final ProgressListener progressListener;

    ChunkedDataPump(SpectraSource source, Window window, int chunkSize, ProgressListener progressListener) {
        assert 0 < chunkSize;
        this.source = source;
        this.window = window;
        this.chunkSize = chunkSize;
        this.progressListener = progressListener;
    }

    /**
     * Reads every spectrum in the window and appends it to a sink.  The sink must already be open.
     *
     * @param sink
     *     The sink to fill.
     *
     * @return The number of spectra appended.
     *
     * @throws SourceReadException
     *     if the source failed or returned data of the wrong shape.
     * @throws IOException
     *     if the sink could not write.
     */
    long pump(SampleSink sink) throws IOException {
        final int sourceChannels = source.header().nchans();
        final long total = window.count();

        long cursor = window.start();
        long remaining = total;
        while (remaining != 0) {
            final int count = (int) Math.min(chunkSize, remaining);

            SampleBlock batch = read(cursor, count);
            if (batch == null || batch.spectra() != count || batch.channels() != sourceChannels) {
                throw new SourceReadException(cursor, count,
                    "expected " + count + " spectra of " + sourceChannels + " channels but got " + describe(batch),
                    null);
            }

            sink.append(batch.sliceChannels(window.channelMin(), window.channelMax()));

            cursor += count;
            remaining -= count;

            LOG.debug("Wrote spectra {} to {} of {}", cursor - count, cursor, sink.target());
            progressListener.onProgress(total - remaining, total);
        }
        return total;
    }

    private SampleBlock read(long start, int count) throws SourceReadException {
        try {
            return source.read(start, count);
        } catch (IOException | RuntimeException exception) {
            throw new SourceReadException(start, count, String.valueOf(exception.getMessage()), exception);
        }
    }

    private static String describe(SampleBlock batch) {
        return batch == null ? "nothing" : batch.spectra() + " spectra of " + batch.channels() + " channels";
    }
}
