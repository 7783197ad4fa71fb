///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.util.Arrays;

/**
 * A two-dimensional array of samples, indexed by spectrum (time) and channel (frequency).
 * <p>
 * Samples are held as {@code double} so that every supported sample type (unsigned integers up to 16 bits and
 * 32-bit floating point) is represented exactly.  The samples are stored in spectrum-major order, which is the
 * order in which they are written to disk.
 * </p>
 */
public final class SampleBlock {

    private final int spectra;
    private final int channels;
    private final double[] samples;

    private SampleBlock(int spectra, int channels, double[] samples) {
        this.spectra = spectra;
        this.channels = channels;
        this.samples = samples;
    }

    /**
     * Creates a block that wraps an array of samples without copying it.
     *
     * @param spectra
     *     The number of spectra.
     * @param channels
     *     The number of channels in each spectrum.
     * @param samples
     *     The samples in spectrum-major order.  The caller must not modify this after the block is created.
     *
     * @return A new block.
     *
     * @throws NullPointerException
     *     if {@code samples} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code spectra} is negative, {@code channels} is not positive, or the length of {@code samples} is not
     *     {@code spectra * channels}.
     */
    public static SampleBlock wrap(int spectra, int channels, double[] samples) {
        ArgumentUtil.checkNotNull(samples, "samples");
        ArgumentUtil.checkNotNegative(spectra, "spectra");
        ArgumentUtil.checkPositive(channels, "channels");
        if ((long) spectra * channels != samples.length) {
            throw new IllegalArgumentException(
                "samples has " + samples.length + " entries but " + spectra + " spectra of " + channels +
                    " channels were declared");
        }
        return new SampleBlock(spectra, channels, samples);
    }

    /**
     * Creates a block by copying a two-dimensional array.
     *
     * @param spectra
     *     The samples, indexed as {@code spectra[spectrum][channel]}.  Every row must have the same length.
     *
     * @return A new block.
     *
     * @throws NullPointerException
     *     if {@code spectra} or any of its rows is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code spectra} is empty, its rows are empty, or its rows have different lengths.
     */
    public static SampleBlock of(double[][] spectra) {
        ArgumentUtil.checkNotNull(spectra, "spectra");
        if (spectra.length == 0) {
            throw new IllegalArgumentException("spectra must not be empty");
        }
        ArgumentUtil.checkNotNull(spectra[0], "spectra[0]");
        final int channels = spectra[0].length;
        ArgumentUtil.checkPositive(channels, "channels");

        double[] samples = new double[spectra.length * channels];
        for (int i = 0; i < spectra.length; i++) {
            ArgumentUtil.checkNotNull(spectra[i], "spectra[" + i + "]");
            if (spectra[i].length != channels) {
                throw new IllegalArgumentException("all spectra must have " + channels + " channels");
            }
            System.arraycopy(spectra[i], 0, samples, i * channels, channels);
        }
        return new SampleBlock(spectra.length, channels, samples);
    }

    public int spectra() {
        return spectra;
    }

    public int channels() {
        return channels;
    }

    /**
     * Gets a single sample.
     *
     * @param spectrum
     *     The zero-based spectrum index.
     * @param channel
     *     The zero-based channel index.
     *
     * @return The sample value.
     */
    public double get(int spectrum, int channel) {
        if (channel < 0 || channels <= channel) {
            throw new IndexOutOfBoundsException("channel " + channel + " out of bounds for " + channels + " channels");
        }
        return samples[spectrum * channels + channel];
    }

    /**
     * Gets a copy of one spectrum.
     *
     * @param spectrum
     *     The zero-based spectrum index.
     *
     * @return The spectrum's samples, one per channel.
     */
    public double[] spectrum(int spectrum) {
        return Arrays.copyOfRange(samples, spectrum * channels, (spectrum + 1) * channels);
    }

    /**
     * Gives direct access to the samples.  This is package-private so the encoders can avoid a copy.
     *
     * @return The backing array, in spectrum-major order.
     */
    double[] samples() {
        return samples;
    }

    /**
     * Selects a contiguous range of channels from every spectrum.
     *
     * @param channelMin
     *     The first channel to keep.
     * @param channelMax
     *     One past the last channel to keep.
     *
     * @return A block with {@code channelMax - channelMin} channels.  If the range covers every channel, then this
     *     block is returned.
     *
     * @throws IndexOutOfBoundsException
     *     if the range is empty or doesn't fit within this block's channels.
     */
    public SampleBlock sliceChannels(int channelMin, int channelMax) {
        if (channelMin < 0 || channels < channelMax || channelMax <= channelMin) {
            throw new IndexOutOfBoundsException(
                "channel range [" + channelMin + ", " + channelMax + ") out of bounds for " + channels + " channels");
        }
        if (channelMin == 0 && channelMax == channels) {
            return this;
        }

        final int slicedChannels = channelMax - channelMin;
        double[] sliced = new double[spectra * slicedChannels];
        for (int i = 0; i < spectra; i++) {
            System.arraycopy(samples, i * channels + channelMin, sliced, i * slicedChannels, slicedChannels);
        }
        return new SampleBlock(spectra, slicedChannels, sliced);
    }
}
