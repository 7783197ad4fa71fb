///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import nom.tam.fits.FitsException;
import nom.tam.fits.FitsUtil;
import nom.tam.fits.Header;
import nom.tam.util.FitsOutputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes a window of an observation as a PSRFITS search-mode file.
 * <p>
 * The file has two HDUs: a primary HDU whose header describes the observation and a SUBINT binary table whose rows
 * each hold {@code nsblk} spectra.  Appended batches are regrouped into rows, so the rows don't depend on how the
 * spectra were batched.  The last row may hold fewer than {@code nsblk} spectra, in which case its DATA cell is
 * zero-padded and its TSUBINT, OFFS_SUB, and LST_SUB describe only the real spectra.
 * </p>
 */
final class PsrfitsEncoder implements SampleSink {

    private static final Logger LOG = LogManager.getLogger(PsrfitsEncoder.class);

    private enum State {
        UNOPENED,
        PRIMARY_HEADER_WRITTEN,
        SUBINT_TABLE_OPEN,
        FILLING,
        CLOSED,
    }

    private final Path target;
    private final ObservationInfo info;
    private final SubintTableLayout layout;
    private final SubintRow subintRow;
    private final long totalSpectra;
    private final long declaredRows;
    private final byte[] primaryHeader;
    private final byte[] subintHeader;

    private State state;
    private FileChannel channel;
    private FitsOutputStream outputStream;

    private final double[] pendingSamples;
    private int pendingSpectra;
    private final byte[] rowBuffer;
    private long rowsWritten;
    private long spectraWritten;

    /**
     * Creates an encoder.  No file is created until {@link #open()} is invoked.
     *
     * @param target
     *     The file to write.  If it exists, it is replaced.
     * @param sourceHeader
     *     The source's header.
     * @param window
     *     The window to write.
     * @param info
     *     The metadata of the window.
     * @param nsblk
     *     The number of spectra per SUBINT row.
     *
     * @throws UnsupportedBitDepthException
     *     if the source's bit depth can't be written to a PSRFITS file.
     * @throws IllegalArgumentException
     *     if a SUBINT row would be too large or the metadata can't be written as FITS header cards.
     */
    PsrfitsEncoder(Path target, UnifiedHeader sourceHeader, Window window, ObservationInfo info, int nsblk) {
        this.target = target;
        this.info = info;
        SampleEncoding encoding = SampleEncoding.forBits(sourceHeader.nbits(), "PSRFITS");

        // Polarizations are summed upstream; the DATA column has one.
        if (1 < sourceHeader.npol()) {
            LOG.warn("The source has {} polarizations but {} holds only their sum (NPOL=1)", sourceHeader.npol(),
                target);
        }
        this.layout = new SubintTableLayout(encoding, window.nchans(), 1, nsblk);
        this.subintRow = new SubintRow(layout, info, sourceHeader.galacticLongitude(),
            sourceHeader.galacticLatitude());
        this.totalSpectra = window.count();
        this.declaredRows = MathUtil.divideAndRoundUp(totalSpectra, nsblk);

        try {
            this.primaryHeader = FitsHeaderUtil.toBytes(PsrfitsPrimaryHeader.build(info));
            this.subintHeader = FitsHeaderUtil.toBytes(layout.header(info, declaredRows, totalSpectra));
        } catch (FitsException | IllegalStateException exception) {
            // nom.tam.fits reports a value too long for a card with an IllegalStateException.
            throw new IllegalArgumentException("Unable to build the PSRFITS headers: " + exception.getMessage(),
                exception);
        }

        this.pendingSamples = new double[layout.samplesPerRow()];
        this.rowBuffer = new byte[layout.rowWidth()];
        this.state = State.UNOPENED;
    }

    @Override
    public DataFormat format() {
        return DataFormat.PSRFITS;
    }

    @Override
    public Path target() {
        return target;
    }

    SubintTableLayout layout() {
        return layout;
    }

    @Override
    public void open() throws IOException {
        if (state != State.UNOPENED) {
            throw new IllegalStateException("Cannot open a PSRFITS encoder twice");
        }

        channel = FileChannel.open(target,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
        outputStream = new FitsOutputStream(Channels.newOutputStream(channel));

        outputStream.write(primaryHeader);
        state = State.PRIMARY_HEADER_WRITTEN;

        outputStream.write(subintHeader);
        state = State.SUBINT_TABLE_OPEN;
    }

    @Override
    public void append(SampleBlock batch) throws IOException {
        ArgumentUtil.checkNotNull(batch, "batch");
        if (state == State.UNOPENED || state == State.PRIMARY_HEADER_WRITTEN) {
            throw new IllegalStateException("Cannot append to a PSRFITS encoder before it is opened");
        }
        if (state == State.CLOSED) {
            throw new IllegalStateException("Cannot append to a closed PSRFITS encoder");
        }
        if (batch.channels() != layout.nchans()) {
            throw new IllegalArgumentException(
                "batch has " + batch.channels() + " channels but the file has " + layout.nchans());
        }
        if (totalSpectra - spectraWritten < batch.spectra()) {
            throw new IllegalStateException("wrote more spectra than the header declares");
        }
        state = State.FILLING;

        final int nchans = layout.nchans();
        final int nsblk = layout.nsblk();
        final double[] samples = batch.samples();
        int consumed = 0;
        while (consumed < batch.spectra()) {
            int spectra = Math.min(batch.spectra() - consumed, nsblk - pendingSpectra);
            System.arraycopy(samples, consumed * nchans, pendingSamples, pendingSpectra * nchans, spectra * nchans);
            pendingSpectra += spectra;
            consumed += spectra;
            spectraWritten += spectra;

            if (pendingSpectra == nsblk) {
                writeRow();
            }
        }
    }

    private void writeRow() throws IOException {
        final long firstSpectrum = rowsWritten * layout.nsblk();
        subintRow.write(rowBuffer, firstSpectrum, pendingSpectra, pendingSamples);
        outputStream.write(rowBuffer);
        rowsWritten++;
        LOG.debug("Wrote SUBINT row {} ({} spectra) to {}", rowsWritten, pendingSpectra, target);
        pendingSpectra = 0;
    }

    @Override
    public void close() throws IOException {
        if (state == State.UNOPENED) {
            throw new IllegalStateException("Cannot close a PSRFITS encoder that was never opened");
        }
        if (state == State.CLOSED) {
            return;
        }

        state = State.CLOSED;
        try (FileChannel fileChannel = channel) {
            if (pendingSpectra != 0) {
                writeRow();
            }

            // The table's data is padded with zeros to a whole FITS block.
            pad(rowsWritten * layout.rowWidth());
            outputStream.flush();

            if (rowsWritten != declaredRows) {
                fileChannel.write(ByteBuffer.wrap(rewrittenSubintHeader()), primaryHeader.length);
            }
        }

        if (spectraWritten != totalSpectra) {
            throw new IllegalStateException(
                "The header declares " + totalSpectra + " spectra but only " + spectraWritten + " were written.");
        }
    }

    private void pad(long dataSize) throws IOException {
        try {
            FitsUtil.pad(outputStream, dataSize);
        } catch (FitsException exception) {
            if (exception.getCause() instanceof IOException) {
                throw (IOException) exception.getCause();
            }
            throw new IOException("Unable to pad the SUBINT table of " + target, exception);
        }
    }

    /**
     * Builds the SUBINT header again with NAXIS2 set to the number of rows actually written.  Only NAXIS2 differs, so
     * the header has the same size as the one already in the file.
     */
    private byte[] rewrittenSubintHeader() throws IOException {
        final byte[] header;
        try {
            Header rewritten = layout.header(info, rowsWritten, totalSpectra);
            header = FitsHeaderUtil.toBytes(rewritten);
        } catch (FitsException exception) {
            throw new IOException("Unable to rewrite the SUBINT header of " + target, exception);
        }
        if (header.length != subintHeader.length) {
            throw new IllegalStateException("the rewritten SUBINT header changed size");
        }
        return header;
    }

    @Override
    public void abandon() throws IOException {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        if (channel != null) {
            channel.close();
        }
    }

    @Override
    public boolean isFileCreated() {
        return channel != null;
    }
}
