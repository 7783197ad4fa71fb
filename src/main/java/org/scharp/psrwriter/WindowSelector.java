///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

/**
 * Resolves the window requested in a {@link WriterConfig} against the bounds of a source.
 */
final class WindowSelector {

    // private constructor to prevent anyone from instantiating the class.
    private WindowSelector() {
    }

    /**
     * Resolves and validates a window.
     * <p>
     * Unset bounds default to the natural extreme: the window starts at spectrum 0, runs to the last spectrum, and
     * covers every channel.  Bounds that are set explicitly are never clamped.
     * </p>
     *
     * @param nspectra
     *     The number of spectra in the source.
     * @param nchans
     *     The number of channels in the source.
     * @param config
     *     The requested window.
     *
     * @return The resolved window.
     *
     * @throws InvalidWindowException
     *     if the requested window does not fit within the source or is empty.
     */
    static Window resolve(long nspectra, int nchans, WriterConfig config) {
        assert 0 < nspectra;
        assert 0 < nchans;

        final long start = config.startSample();
        if (nspectra <= start) {
            throw new InvalidWindowException("startSample",
                "startSample (" + start + ") must be less than the number of spectra (" + nspectra + ")");
        }

        final long count = config.sampleCount() != null ? config.sampleCount() : nspectra - start;
        if (count <= 0) {
            throw new InvalidWindowException("sampleCount", "sampleCount (" + count + ") must be positive");
        }
        if (nspectra - start < count) {
            throw new InvalidWindowException("sampleCount",
                "startSample (" + start + ") + sampleCount (" + count + ") exceeds the number of spectra (" +
                    nspectra + ")");
        }

        final int channelMin = config.channelMin();
        final int channelMax = config.channelMax() != null ? config.channelMax() : nchans;
        if (nchans < channelMax) {
            throw new InvalidWindowException("channelMax",
                "channelMax (" + channelMax + ") must not exceed the number of channels (" + nchans + ")");
        }
        if (channelMax <= channelMin) {
            throw new InvalidWindowException("channelMin",
                "channelMin (" + channelMin + ") must be less than channelMax (" + channelMax + ")");
        }

        return new Window(start, count, channelMin, channelMax);
    }
}
