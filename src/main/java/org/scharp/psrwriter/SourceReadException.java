///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when the {@link SpectraSource} failed while a conversion was in progress.
 * <p>
 * The output file is left incomplete.  Callers must not treat it as valid.
 * </p>
 */
public class SourceReadException extends IOException {

    private static final long serialVersionUID = 1L;

    private final long offset;
    private final int count;
    private transient Path partialFile;

    SourceReadException(long offset, int count, String message, Throwable cause) {
        super("Failed to read " + count + " spectra at offset " + offset + ": " + message, cause);
        this.offset = offset;
        this.count = count;
    }

    /**
     * Gets the index of the first spectrum of the read that failed.
     *
     * @return The spectrum index.
     */
    public long offset() {
        return offset;
    }

    /**
     * Gets the number of spectra requested by the read that failed.
     *
     * @return The number of spectra.
     */
    public int count() {
        return count;
    }

    /**
     * Gets the incomplete output file that was being written when the source failed.
     *
     * @return The path of the partial output, or {@code null} if the failure happened outside a conversion.
     */
    public Path partialFile() {
        return partialFile;
    }

    void setPartialFile(Path partialFile) {
        this.partialFile = partialFile;
    }
}
