///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when the output file could not be written.
 * <p>
 * If {@link #isPartialFileWritten()} returns {@code true}, then a truncated file exists at {@link #partialFile()}.
 * It is not a valid Filterbank or PSRFITS file and should be deleted by the caller.
 * </p>
 */
public class OutputWriteException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient Path partialFile;
    private final boolean partialFileWritten;

    OutputWriteException(Path partialFile, boolean partialFileWritten, IOException cause) {
        super("Unable to write " + partialFile + ": " + cause.getMessage(), cause);
        this.partialFile = partialFile;
        this.partialFileWritten = partialFileWritten;
    }

    /**
     * Gets the location of the output file.
     *
     * @return The path to which the conversion was writing.
     */
    public Path partialFile() {
        return partialFile;
    }

    /**
     * Gets whether an incomplete file was left at {@link #partialFile()}.
     *
     * @return {@code true} if the file exists and is invalid; {@code false} if it was never created.
     */
    public boolean isPartialFileWritten() {
        return partialFileWritten;
    }
}
