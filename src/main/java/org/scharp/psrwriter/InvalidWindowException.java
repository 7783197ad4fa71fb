///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

/**
 * Thrown when the requested spectra or channel range doesn't fit within the source observation.
 */
public class InvalidWindowException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    InvalidWindowException(String field, String message) {
        super(field, message);
    }
}
