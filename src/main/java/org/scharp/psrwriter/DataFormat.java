package org.scharp.psrwriter;

/**
 * The on-disk format of an observation.
 */
public enum DataFormat {

    /** A SIGPROC filterbank file: a key-tagged header followed by raw samples. */
    FILTERBANK(".fil"),

    /** A PSRFITS search-mode file: a primary header and a SUBINT binary table. */
    PSRFITS(".fits");

    private final String extension;

    DataFormat(String extension) {
        this.extension = extension;
    }

    /**
     * Gets the conventional file name extension for this format.
     *
     * @return The extension, including the leading period.
     */
    public String extension() {
        return extension;
    }
}
