///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

/**
 * Thrown when a conversion is configured in a way that cannot be satisfied.
 * <p>
 * These are always detected before any output file is created.
 * </p>
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String field;

    /**
     * Creates a new {@code ConfigurationException}.
     *
     * @param field
     *     The name of the configuration field whose value is invalid.
     * @param message
     *     A description of the problem.
     */
    public ConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Gets the name of the offending configuration field.
     *
     * @return The field name, as it appears on {@link WriterConfig.Builder}.
     */
    public String field() {
        return field;
    }
}
