///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The metadata of an observation, normalized across source formats.
 * <p>
 * Instances of this class are immutable.  A {@link SpectraSource} creates one with a {@link UnifiedHeader.Builder}:
 * </p>
 * <pre>
 * UnifiedHeader header = UnifiedHeader.builder().
 *     basename("J1713+0747_0001").
 *     filenames(List.of("J1713+0747_0001.fil")).
 *     telescope("GBT").
 *     sourceName("J1713+0747").
 *     rightAscension(258.4563).
 *     declination(7.7937).
 *     nativeNchans(4096).
 *     nativeNspectra(1_000_000).
 *     nativeTsamp(81.92e-6).
 *     fch1(1919.8).
 *     foff(-0.1953125).
 *     nbits(8).
 *     tstart(59000.5).
 *     build();
 * </pre>
 * <p>
 * The exposed channel count, spectra count, and sample interval are derived from their native values and the
 * decimation factors, so {@code nchans() == nativeNchans() / frequencyDecimationFactor()} always holds.
 * </p>
 */
public final class UnifiedHeader {

    /** The MJD of the Unix epoch (1970-01-01T00:00:00Z). */
    private static final double UNIX_EPOCH_MJD = 40587.0;

    private static final DateTimeFormatter UTC_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

    private final String basename;
    private final String filename;
    private final List<String> filenames;
    private final DataFormat dataFormat;
    private final String telescope;
    private final String sourceName;
    private final double bandwidth;
    private final double centerFrequency;
    private final Double explicitBandwidth;
    private final Double explicitCenterFrequency;
    private final double rightAscension;
    private final double declination;
    private final double galacticLatitude;
    private final double galacticLongitude;
    private final int nbits;
    private final double fch1;
    private final double foff;
    private final int nativeNchans;
    private final long nativeNspectra;
    private final double nativeTsamp;
    private final int npol;
    private final double tstart;
    private final String tstartUtc;
    private final String explicitTstartUtc;
    private final int frequencyDecimationFactor;
    private final int timeDecimationFactor;

    /**
     * A builder class for {@link UnifiedHeader}.
     */
    public static final class Builder {
        private String basename;
        private String filename;
        private List<String> filenames;
        private DataFormat dataFormat;
        private String telescope;
        private String sourceName;
        private Double bandwidth;
        private Double centerFrequency;
        private double rightAscension;
        private double declination;
        private double galacticLatitude;
        private double galacticLongitude;
        private int nbits;
        private Double fch1;
        private Double foff;
        private int nativeNchans;
        private long nativeNspectra;
        private double nativeTsamp;
        private int npol;
        private Double tstart;
        private String tstartUtc;
        private int frequencyDecimationFactor;
        private int timeDecimationFactor;

        /**
         * Creates a builder with blank names, no files, a filterbank data format, coordinates of zero, a single
         * polarization, and no decimation.
         */
        private Builder() {
            basename = "";
            filename = "";
            filenames = List.of();
            dataFormat = DataFormat.FILTERBANK;
            telescope = "";
            sourceName = "";
            npol = 1;
            frequencyDecimationFactor = 1;
            timeDecimationFactor = 1;
        }

        private Builder(UnifiedHeader header) {
            basename = header.basename;
            filename = header.filename;
            filenames = header.filenames;
            dataFormat = header.dataFormat;
            telescope = header.telescope;
            sourceName = header.sourceName;
            bandwidth = header.explicitBandwidth;
            centerFrequency = header.explicitCenterFrequency;
            rightAscension = header.rightAscension;
            declination = header.declination;
            galacticLatitude = header.galacticLatitude;
            galacticLongitude = header.galacticLongitude;
            nbits = header.nbits;
            fch1 = header.fch1;
            foff = header.foff;
            nativeNchans = header.nativeNchans;
            nativeNspectra = header.nativeNspectra;
            nativeTsamp = header.nativeTsamp;
            npol = header.npol;
            tstart = header.tstart;
            tstartUtc = header.explicitTstartUtc;
            frequencyDecimationFactor = header.frequencyDecimationFactor;
            timeDecimationFactor = header.timeDecimationFactor;
        }

        /**
         * Sets the base name of the observation (the file name without directories or extension).
         *
         * @param basename
         *     The base name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code basename} is {@code null}.
         */
        public Builder basename(String basename) {
            ArgumentUtil.checkNotNull(basename, "basename");
            this.basename = basename;
            return this;
        }

        /**
         * Sets the name of the source file.
         *
         * @param filename
         *     The file name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code filename} is {@code null}.
         */
        public Builder filename(String filename) {
            ArgumentUtil.checkNotNull(filename, "filename");
            this.filename = filename;
            return this;
        }

        /**
         * Sets the names of all files that contribute to the observation, in time order.
         *
         * @param filenames
         *     The file names.  This list is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code filenames} is {@code null} or contains a {@code null} entry.
         */
        public Builder filenames(List<String> filenames) {
            ArgumentUtil.checkNotNull(filenames, "filenames");
            List<String> copy = new ArrayList<>(filenames.size());
            for (String name : filenames) {
                if (name == null) {
                    throw new NullPointerException("filenames must not contain a null entry");
                }
                copy.add(name);
            }
            this.filenames = copy;
            return this;
        }

        /**
         * Sets the format of the source data.
         *
         * @param dataFormat
         *     The format tag.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code dataFormat} is {@code null}.
         */
        public Builder dataFormat(DataFormat dataFormat) {
            ArgumentUtil.checkNotNull(dataFormat, "dataFormat");
            this.dataFormat = dataFormat;
            return this;
        }

        /**
         * Sets the name of the telescope that made the observation, such as "GBT" or "Arecibo".
         *
         * @param telescope
         *     The telescope name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code telescope} is {@code null}.
         */
        public Builder telescope(String telescope) {
            ArgumentUtil.checkNotNull(telescope, "telescope");
            this.telescope = telescope;
            return this;
        }

        /**
         * Sets the name of the observed source.
         *
         * @param sourceName
         *     The source name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code sourceName} is {@code null}.
         */
        public Builder sourceName(String sourceName) {
            ArgumentUtil.checkNotNull(sourceName, "sourceName");
            this.sourceName = sourceName;
            return this;
        }

        /**
         * Sets the total bandwidth in MHz.  If this isn't set, it is computed as {@code nchans * foff}.
         *
         * @param bandwidth
         *     The bandwidth. Its sign must match the sign of {@code foff}.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code bandwidth} is zero or not finite.
         */
        public Builder bandwidth(double bandwidth) {
            ArgumentUtil.checkFinite(bandwidth, "bandwidth");
            if (bandwidth == 0) {
                throw new IllegalArgumentException("bandwidth must not be zero");
            }
            this.bandwidth = bandwidth;
            return this;
        }

        /**
         * Sets the center frequency in MHz.  If this isn't set, it is computed from {@code fch1}, {@code foff}, and
         * {@code nchans}.
         *
         * @param centerFrequency
         *     The center frequency.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code centerFrequency} is not finite.
         */
        public Builder centerFrequency(double centerFrequency) {
            ArgumentUtil.checkFinite(centerFrequency, "centerFrequency");
            this.centerFrequency = centerFrequency;
            return this;
        }

        /**
         * Sets the J2000 right ascension of the pointing.
         *
         * @param rightAscension
         *     The right ascension in degrees.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code rightAscension} is outside of [0, 360).
         */
        public Builder rightAscension(double rightAscension) {
            if (!(0 <= rightAscension && rightAscension < 360)) {
                throw new IllegalArgumentException("rightAscension must be in the range [0, 360)");
            }
            this.rightAscension = rightAscension;
            return this;
        }

        /**
         * Sets the J2000 declination of the pointing.
         *
         * @param declination
         *     The declination in degrees.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code declination} is outside of [-90, 90].
         */
        public Builder declination(double declination) {
            if (!(-90 <= declination && declination <= 90)) {
                throw new IllegalArgumentException("declination must be in the range [-90, 90]");
            }
            this.declination = declination;
            return this;
        }

        /**
         * Sets the galactic latitude of the pointing.
         *
         * @param galacticLatitude
         *     The latitude in degrees.
         *
         * @return This builder
         */
        public Builder galacticLatitude(double galacticLatitude) {
            ArgumentUtil.checkFinite(galacticLatitude, "galacticLatitude");
            this.galacticLatitude = galacticLatitude;
            return this;
        }

        /**
         * Sets the galactic longitude of the pointing.
         *
         * @param galacticLongitude
         *     The longitude in degrees.
         *
         * @return This builder
         */
        public Builder galacticLongitude(double galacticLongitude) {
            ArgumentUtil.checkFinite(galacticLongitude, "galacticLongitude");
            this.galacticLongitude = galacticLongitude;
            return this;
        }

        /**
         * Sets the number of bits per sample.
         * <p>
         * Any positive depth is accepted here.  Whether it can be written is up to the output format.
         * </p>
         *
         * @param nbits
         *     The sample depth.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code nbits} is not positive.
         */
        public Builder nbits(int nbits) {
            ArgumentUtil.checkPositive(nbits, "nbits");
            this.nbits = nbits;
            return this;
        }

        /**
         * Sets the center frequency of the first exposed channel in MHz.
         *
         * @param fch1
         *     The frequency.
         *
         * @return This builder
         */
        public Builder fch1(double fch1) {
            ArgumentUtil.checkFinite(fch1, "fch1");
            this.fch1 = fch1;
            return this;
        }

        /**
         * Sets the channel offset in MHz of the exposed (decimated) channels.  This is negative when the first channel
         * has the highest frequency.
         *
         * @param foff
         *     The signed channel width.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code foff} is zero or not finite.
         */
        public Builder foff(double foff) {
            ArgumentUtil.checkFinite(foff, "foff");
            if (foff == 0) {
                throw new IllegalArgumentException("foff must not be zero");
            }
            this.foff = foff;
            return this;
        }

        /**
         * Sets the number of channels in the underlying data.
         *
         * @param nativeNchans
         *     The channel count.
         *
         * @return This builder
         */
        public Builder nativeNchans(int nativeNchans) {
            ArgumentUtil.checkPositive(nativeNchans, "nativeNchans");
            this.nativeNchans = nativeNchans;
            return this;
        }

        /**
         * Sets the number of spectra in the underlying data.
         *
         * @param nativeNspectra
         *     The spectra count.
         *
         * @return This builder
         */
        public Builder nativeNspectra(long nativeNspectra) {
            ArgumentUtil.checkPositive(nativeNspectra, "nativeNspectra");
            this.nativeNspectra = nativeNspectra;
            return this;
        }

        /**
         * Sets the sampling interval of the underlying data in seconds.
         *
         * @param nativeTsamp
         *     The sample interval.
         *
         * @return This builder
         */
        public Builder nativeTsamp(double nativeTsamp) {
            ArgumentUtil.checkPositive(nativeTsamp, "nativeTsamp");
            this.nativeTsamp = nativeTsamp;
            return this;
        }

        /**
         * Sets the number of polarizations.
         *
         * @param npol
         *     The polarization count.
         *
         * @return This builder
         */
        public Builder npol(int npol) {
            ArgumentUtil.checkPositive(npol, "npol");
            this.npol = npol;
            return this;
        }

        /**
         * Sets the time of the first native sample as a Modified Julian Date (UTC).
         *
         * @param tstart
         *     The MJD.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code tstart} is negative or not finite.
         */
        public Builder tstart(double tstart) {
            ArgumentUtil.checkFinite(tstart, "tstart");
            ArgumentUtil.checkNotNegative((long) Math.floor(tstart), "tstart");
            this.tstart = tstart;
            return this;
        }

        /**
         * Sets the time of the first native sample as text.  If this isn't set, it's rendered from {@code tstart}.
         *
         * @param tstartUtc
         *     The start time, usually in ISO-8601 form.
         *
         * @return This builder
         */
        public Builder tstartUtc(String tstartUtc) {
            ArgumentUtil.checkNotNull(tstartUtc, "tstartUtc");
            this.tstartUtc = tstartUtc;
            return this;
        }

        /**
         * Sets how many native channels are combined into one exposed channel.
         *
         * @param frequencyDecimationFactor
         *     The decimation factor.
         *
         * @return This builder
         */
        public Builder frequencyDecimationFactor(int frequencyDecimationFactor) {
            ArgumentUtil.checkPositive(frequencyDecimationFactor, "frequencyDecimationFactor");
            this.frequencyDecimationFactor = frequencyDecimationFactor;
            return this;
        }

        /**
         * Sets how many native spectra are combined into one exposed spectrum.
         *
         * @param timeDecimationFactor
         *     The decimation factor.
         *
         * @return This builder
         */
        public Builder timeDecimationFactor(int timeDecimationFactor) {
            ArgumentUtil.checkPositive(timeDecimationFactor, "timeDecimationFactor");
            this.timeDecimationFactor = timeDecimationFactor;
            return this;
        }

        /**
         * Builds the immutable {@code UnifiedHeader}.
         *
         * @return A {@code UnifiedHeader}
         *
         * @throws IllegalStateException
         *     if a field without a meaningful default hasn't been set, or if the fields are inconsistent with each
         *     other.
         */
        public UnifiedHeader build() {
            if (nbits == 0) {
                throw new IllegalStateException("nbits must be set");
            }
            if (fch1 == null) {
                throw new IllegalStateException("fch1 must be set");
            }
            if (foff == null) {
                throw new IllegalStateException("foff must be set");
            }
            if (nativeNchans == 0) {
                throw new IllegalStateException("nativeNchans must be set");
            }
            if (nativeNspectra == 0) {
                throw new IllegalStateException("nativeNspectra must be set");
            }
            if (nativeTsamp == 0) {
                throw new IllegalStateException("nativeTsamp must be set");
            }
            if (tstart == null) {
                throw new IllegalStateException("tstart must be set");
            }
            if (nativeNchans < frequencyDecimationFactor) {
                throw new IllegalStateException("frequencyDecimationFactor must not exceed nativeNchans");
            }
            if (nativeNspectra < timeDecimationFactor) {
                throw new IllegalStateException("timeDecimationFactor must not exceed nativeNspectra");
            }
            if (bandwidth != null && Math.signum(bandwidth) != Math.signum(foff)) {
                throw new IllegalStateException("bandwidth and foff must have the same sign");
            }
            return new UnifiedHeader(this);
        }
    }

    /**
     * Creates a new {@code UnifiedHeader} builder.
     * <p>
     * The channel layout ({@code fch1}, {@code foff}, {@code nativeNchans}), the sampling
     * ({@code nativeNspectra}, {@code nativeTsamp}, {@code tstart}), and {@code nbits} must be set before invoking
     * {@link Builder#build build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder that is initialized with this header's values.
     *
     * @return A new builder.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    private UnifiedHeader(Builder builder) {
        basename = builder.basename;
        filename = builder.filename;
        filenames = builder.filenames;
        dataFormat = builder.dataFormat;
        telescope = builder.telescope;
        sourceName = builder.sourceName;
        rightAscension = builder.rightAscension;
        declination = builder.declination;
        galacticLatitude = builder.galacticLatitude;
        galacticLongitude = builder.galacticLongitude;
        nbits = builder.nbits;
        fch1 = builder.fch1;
        foff = builder.foff;
        nativeNchans = builder.nativeNchans;
        nativeNspectra = builder.nativeNspectra;
        nativeTsamp = builder.nativeTsamp;
        npol = builder.npol;
        tstart = builder.tstart;
        frequencyDecimationFactor = builder.frequencyDecimationFactor;
        timeDecimationFactor = builder.timeDecimationFactor;

        explicitBandwidth = builder.bandwidth;
        explicitCenterFrequency = builder.centerFrequency;
        explicitTstartUtc = builder.tstartUtc;

        final int nchans = nchans();
        bandwidth = builder.bandwidth != null ? builder.bandwidth : nchans * foff;
        centerFrequency = builder.centerFrequency != null ? builder.centerFrequency : fch1 + foff * (nchans - 1) / 2;
        tstartUtc = builder.tstartUtc != null ? builder.tstartUtc : mjdToUtc(tstart);
    }

    /**
     * Renders a Modified Julian Date as an ISO-8601 UTC timestamp with millisecond precision.
     *
     * @param mjd
     *     The MJD.
     *
     * @return The timestamp, without a zone designator.
     */
    static String mjdToUtc(double mjd) {
        long epochMillis = Math.round((mjd - UNIX_EPOCH_MJD) * 86_400_000.0);
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC).format(UTC_FORMAT);
    }

    public String basename() {
        return basename;
    }

    public String filename() {
        return filename;
    }

    /**
     * Gets the files that contribute to the observation.
     *
     * @return An unmodifiable list of file names.  This is never {@code null}.
     */
    public List<String> filenames() {
        return Collections.unmodifiableList(filenames);
    }

    public DataFormat dataFormat() {
        return dataFormat;
    }

    public String telescope() {
        return telescope;
    }

    public String sourceName() {
        return sourceName;
    }

    /**
     * Gets the total bandwidth in MHz.
     *
     * @return The bandwidth, with the same sign as {@link #foff()}.
     */
    public double bandwidth() {
        return bandwidth;
    }

    public double centerFrequency() {
        return centerFrequency;
    }

    /**
     * Gets the J2000 right ascension.
     *
     * @return The right ascension in degrees.
     */
    public double rightAscension() {
        return rightAscension;
    }

    /**
     * Gets the J2000 declination.
     *
     * @return The declination in degrees.
     */
    public double declination() {
        return declination;
    }

    public double galacticLatitude() {
        return galacticLatitude;
    }

    public double galacticLongitude() {
        return galacticLongitude;
    }

    public int nbits() {
        return nbits;
    }

    public double fch1() {
        return fch1;
    }

    public double foff() {
        return foff;
    }

    public int nativeNchans() {
        return nativeNchans;
    }

    public long nativeNspectra() {
        return nativeNspectra;
    }

    public double nativeTsamp() {
        return nativeTsamp;
    }

    /**
     * Gets the number of channels exposed by the source, after frequency decimation.
     *
     * @return {@code nativeNchans() / frequencyDecimationFactor()}
     */
    public int nchans() {
        return nativeNchans / frequencyDecimationFactor;
    }

    /**
     * Gets the number of spectra exposed by the source, after time decimation.
     *
     * @return {@code nativeNspectra() / timeDecimationFactor()}
     */
    public long nspectra() {
        return nativeNspectra / timeDecimationFactor;
    }

    /**
     * Gets the sample interval of the spectra exposed by the source, after time decimation.
     *
     * @return The interval in seconds.
     */
    public double tsamp() {
        return nativeTsamp * timeDecimationFactor;
    }

    public int npol() {
        return npol;
    }

    /**
     * Gets the time of the first sample.
     *
     * @return The Modified Julian Date (UTC).
     */
    public double tstart() {
        return tstart;
    }

    public String tstartUtc() {
        return tstartUtc;
    }

    public int frequencyDecimationFactor() {
        return frequencyDecimationFactor;
    }

    public int timeDecimationFactor() {
        return timeDecimationFactor;
    }
}
