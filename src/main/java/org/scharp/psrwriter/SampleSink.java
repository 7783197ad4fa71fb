package org.scharp.psrwriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A streaming writer of one output file.
 * <p>
 * A sink is used exactly once: {@link #open()}, then {@link #append} any number of times with the spectra in time
 * order, then {@link #close()}.  If the conversion fails, {@link #abandon()} releases the file without
 * finalizing it.
 * </p>
 */
interface SampleSink {

    /**
     * Gets the format that this sink writes.
     *
     * @return The format tag.
     */
    DataFormat format();

    /**
     * Gets the file that this sink writes.
     *
     * @return The output location.
     */
    Path target();

    /**
     * Creates the output file and writes its headers.
     *
     * @throws IllegalStateException
     *     if this sink was already opened.
     * @throws IOException
     *     if the file could not be written.
     */
    void open() throws IOException;

    /**
     * Writes the next batch of spectra.
     *
     * @param batch
     *     The spectra, with the channel count of the output.
     *
     * @throws IllegalStateException
     *     if this sink isn't open.
     * @throws IOException
     *     if the file could not be written.
     */
    void append(SampleBlock batch) throws IOException;

    /**
     * Flushes any buffered data, finalizes the file, and closes it.
     *
     * @throws IllegalStateException
     *     if this sink was never opened.
     * @throws IOException
     *     if the file could not be written.
     */
    void close() throws IOException;

    /**
     * Closes the output file without finalizing it.  The file is left incomplete.  This is safe to invoke in any
     * state and more than once.
     *
     * @throws IOException
     *     if the file could not be closed.
     */
    void abandon() throws IOException;

    /**
     * Gets whether {@link #open()} has created the output file.
     *
     * @return {@code true} if the file exists on disk because of this sink.
     */
    boolean isFileCreated();
}
