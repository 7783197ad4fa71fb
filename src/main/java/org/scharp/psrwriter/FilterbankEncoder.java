///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a window of an observation as a SIGPROC filterbank file.
 * <p>
 * The file is the {@link FilterbankHeader} followed by the samples in time order, each spectrum holding its channels
 * in order.  Samples are written in the source's bit depth: 8-bit and 16-bit samples as unsigned little-endian
 * integers, 32-bit samples as little-endian IEEE 754 floats, and 1, 2, or 4-bit samples packed
 * most-significant-first.
 * </p>
 */
final class FilterbankEncoder implements SampleSink {

    private enum State {
        UNOPENED,
        HEADER_WRITTEN,
        APPENDING,
        CLOSED,
    }

    private final Path target;
    private final FilterbankHeader header;
    private final long totalSpectra;
    private final int nchans;
    private final SampleEncoder sampleEncoder;

    private State state;
    private OutputStream outputStream;
    private byte[] buffer;
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
     * @param telescope
     *     The telescope that made the observation, or {@code null} if it is unknown.
     *
     * @throws UnsupportedBitDepthException
     *     if the source's bit depth can't be written to a filterbank file.
     */
    FilterbankEncoder(Path target, UnifiedHeader sourceHeader, Window window, Telescope telescope) {
        this.target = target;
        this.sampleEncoder = new SampleEncoder(
            SampleEncoding.forBits(sourceHeader.nbits(), "Filterbank"),
            ByteOrder.LITTLE_ENDIAN);
        this.header = FilterbankHeader.forWindow(sourceHeader, window, telescope);
        this.totalSpectra = window.count();
        this.nchans = window.nchans();
        this.buffer = new byte[0];
        this.state = State.UNOPENED;
    }

    @Override
    public DataFormat format() {
        return DataFormat.FILTERBANK;
    }

    @Override
    public Path target() {
        return target;
    }

    FilterbankHeader header() {
        return header;
    }

    @Override
    public void open() throws IOException {
        if (state != State.UNOPENED) {
            throw new IllegalStateException("Cannot open a filterbank encoder twice");
        }

        outputStream = new BufferedOutputStream(Files.newOutputStream(target));
        state = State.HEADER_WRITTEN;

        byte[] headerBytes = new byte[header.size()];
        header.write(headerBytes);
        outputStream.write(headerBytes);
    }

    @Override
    public void append(SampleBlock batch) throws IOException {
        ArgumentUtil.checkNotNull(batch, "batch");
        if (state == State.UNOPENED) {
            throw new IllegalStateException("Cannot append to a filterbank encoder before it is opened");
        }
        if (state == State.CLOSED) {
            throw new IllegalStateException("Cannot append to a closed filterbank encoder");
        }
        if (batch.channels() != nchans) {
            throw new IllegalArgumentException(
                "batch has " + batch.channels() + " channels but the file has " + nchans);
        }
        if (totalSpectra - spectraWritten < batch.spectra()) {
            throw new IllegalStateException("wrote more spectra than the header declares");
        }
        state = State.APPENDING;

        final int samples = batch.spectra() * batch.channels();
        final int maxLength = sampleEncoder.maxEncodedLength(samples);
        if (buffer.length < maxLength) {
            buffer = new byte[maxLength];
        }
        int length = sampleEncoder.encode(batch.samples(), 0, samples, buffer, 0);
        outputStream.write(buffer, 0, length);

        spectraWritten += batch.spectra();
    }

    @Override
    public void close() throws IOException {
        if (state == State.UNOPENED) {
            throw new IllegalStateException("Cannot close a filterbank encoder that was never opened");
        }
        if (state == State.CLOSED) {
            return;
        }

        state = State.CLOSED;
        try (OutputStream stream = outputStream) {
            // A sub-byte stream may end with a partially filled byte.
            byte[] tail = new byte[1];
            int length = sampleEncoder.finish(tail, 0);
            stream.write(tail, 0, length);
        }

        if (spectraWritten != totalSpectra) {
            throw new IllegalStateException(
                "The header declares " + totalSpectra + " spectra but only " + spectraWritten + " were written.");
        }
    }

    @Override
    public void abandon() throws IOException {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        if (outputStream != null) {
            outputStream.close();
        }
    }

    @Override
    public boolean isFileCreated() {
        return outputStream != null;
    }
}
