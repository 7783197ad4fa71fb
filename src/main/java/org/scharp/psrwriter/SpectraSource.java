package org.scharp.psrwriter;

import java.io.IOException;

/**
 * A reader of an observation in some on-disk format.
 * <p>
 * A conversion reads the source sequentially from a single thread.  If the same source is given to several
 * conversions that run concurrently, then {@link #read} must be safe to invoke concurrently.
 * </p>
 */
public interface SpectraSource {

    /**
     * Gets the observation's metadata.
     *
     * @return The header.  This must not change while a conversion is running.
     */
    UnifiedHeader header();

    /**
     * Reads a contiguous range of spectra.
     *
     * @param start
     *     The zero-based index of the first spectrum to read.
     * @param count
     *     The number of spectra to read.
     *
     * @return A block of {@code count} spectra, each with {@link UnifiedHeader#nchans()} channels.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code start + count} exceeds {@link UnifiedHeader#nspectra()}.
     * @throws IOException
     *     if the underlying data could not be read.
     */
    SampleBlock read(long start, int count) throws IOException;
}
