package org.scharp.psrwriter;

/**
 * Receives notifications as spectra are written.  This is purely observational; a listener cannot influence the
 * conversion.
 */
@FunctionalInterface
public interface ProgressListener {

    /** A listener that ignores all notifications. */
    ProgressListener NONE = (spectraWritten, totalSpectra) -> {
    };

    /**
     * Invoked after each batch of spectra has been handed to the output.
     *
     * @param spectraWritten
     *     The number of spectra written so far.
     * @param totalSpectra
     *     The number of spectra that the conversion will write.
     */
    void onProgress(long spectraWritten, long totalSpectra);
}
