///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library writes radio-telescope observations as SIGPROC filterbank files and PSRFITS search-mode files.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.psrwriter.ObservationWriter} for sample code on converting an
 * observation.  The observation is read through a {@link org.scharp.psrwriter.SpectraSource}, which callers implement
 * for their input format.
 * </p>
 *
 * <h2>A Pulsar Data Primer for Java Programmers</h2>
 *
 * <p>
 * A radio telescope's backend splits the band it receives into a number of frequency "channels" and measures the
 * power in every channel once per sampling interval.  One such measurement of all channels is a "spectrum".  An
 * observation is a time series of spectra, which is often called a dynamic spectrum or a filterbank.  This library
 * calls the spectrum index the "sample" index, so "startSample" and "sampleCount" select spectra.
 * </p>
 *
 * <p>
 * Channels are described by the center frequency of the first channel ({@code fch1}, in MHz) and the signed offset
 * between adjacent channels ({@code foff}).  Most backends write the highest frequency first, so {@code foff} is
 * usually negative.  Selecting a subset of the channels therefore moves {@code fch1} by {@code channelMin * foff}.
 * </p>
 *
 * <p>
 * Times are Modified Julian Dates (MJD), the number of days since midnight on 17 November 1858.  A double holds an MJD
 * to about a microsecond, which is why PSRFITS splits the start time into an integer day, whole seconds, and a
 * fractional second.
 * </p>
 *
 * <p>
 * The filterbank format comes from the SIGPROC package.  Its header is a sequence of keyword-tagged values between
 * {@code HEADER_START} and {@code HEADER_END} markers, after which the samples follow with no framing.  PSRFITS is a
 * FITS convention maintained by the pulsar community.  A search-mode PSRFITS file stores the samples in the DATA
 * column of a binary table named SUBINT, with a fixed number of spectra ({@code NSBLK}) in each row.
 * </p>
 *
 * <p>
 * Samples narrower than a byte (1, 2, or 4 bits) are packed with the earliest sample in the most significant bits.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * This library checks its input strictly and throws clear exceptions as soon as possible (fail-fast).  A window that
 * doesn't fit the source is rejected when the {@link org.scharp.psrwriter.ObservationWriter} is created, and a bit
 * depth that the output format can't hold is rejected before the output file is created.  If a conversion fails after
 * the file was created, the file is left incomplete and the exception says so.
 * </p>
 */
package org.scharp.psrwriter;
