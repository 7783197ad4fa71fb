///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * The options of a conversion: which part of the source to write, where to write it, and how.
 * <p>
 * Instances of this class are immutable.  To change a setting, create a new instance with {@link #toBuilder()}.
 * </p>
 * <pre>
 * WriterConfig config = WriterConfig.builder().
 *     startSample(1024).
 *     sampleCount(8192).
 *     channelMin(64).
 *     channelMax(960).
 *     outputDirectory(Path.of("/data/converted")).
 *     outputName("J1713+0747_cut").
 *     build();
 * </pre>
 * <p>
 * The window bounds are checked against the source when an {@link ObservationWriter} is created.  A bound that is
 * not set defaults to the natural extreme of the source.
 * </p>
 */
public final class WriterConfig {

    /** The default number of spectra read from the source at a time. */
    public static final int DEFAULT_CHUNK_SIZE = 65536;

    /** The default number of spectra in each PSRFITS subintegration. */
    public static final int DEFAULT_SPECTRA_PER_SUBINT = 4096;

    private final long startSample;
    private final Long sampleCount;
    private final int channelMin;
    private final Integer channelMax;
    private final Path outputDirectory;
    private final String outputName;
    private final int chunkSize;
    private final int spectraPerSubint;
    private final String observer;
    private final String projectId;
    private final LocalDateTime creationTime;
    private final ProgressListener progressListener;
    private final TelescopeRegistry telescopeRegistry;

    /**
     * A builder class for {@link WriterConfig}.
     */
    public static final class Builder {
        private long startSample;
        private Long sampleCount;
        private int channelMin;
        private Integer channelMax;
        private Path outputDirectory;
        private String outputName;
        private int chunkSize;
        private int spectraPerSubint;
        private String observer;
        private String projectId;
        private LocalDateTime creationTime;
        private ProgressListener progressListener;
        private TelescopeRegistry telescopeRegistry;

        /**
         * Creates a builder for a conversion of the entire source into the current directory.
         */
        private Builder() {
            startSample = 0;
            sampleCount = null;
            channelMin = 0;
            channelMax = null;
            outputDirectory = Path.of("");
            outputName = null;
            chunkSize = DEFAULT_CHUNK_SIZE;
            spectraPerSubint = DEFAULT_SPECTRA_PER_SUBINT;
            observer = "unknown";
            projectId = "unknown";
            creationTime = LocalDateTime.now();
            progressListener = ProgressListener.NONE;
            telescopeRegistry = TelescopeRegistry.builtIn();
        }

        private Builder(WriterConfig config) {
            startSample = config.startSample;
            sampleCount = config.sampleCount;
            channelMin = config.channelMin;
            channelMax = config.channelMax;
            outputDirectory = config.outputDirectory;
            outputName = config.outputName;
            chunkSize = config.chunkSize;
            spectraPerSubint = config.spectraPerSubint;
            observer = config.observer;
            projectId = config.projectId;
            creationTime = config.creationTime;
            progressListener = config.progressListener;
            telescopeRegistry = config.telescopeRegistry;
        }

        /**
         * Sets the index of the first spectrum to write.
         *
         * @param startSample
         *     A zero-based spectrum index.
         *
         * @return This builder
         *
         * @throws ConfigurationException
         *     if {@code startSample} is negative.
         */
        public Builder startSample(long startSample) {
            if (startSample < 0) {
                throw new ConfigurationException("startSample", "startSample must not be negative");
            }
            this.startSample = startSample;
            return this;
        }

        /**
         * Sets the number of spectra to write.  By default, all spectra from {@code startSample} to the end of the
         * source are written.
         *
         * @param sampleCount
         *     The number of spectra.
         *
         * @return This builder
         *
         * @throws ConfigurationException
         *     if {@code sampleCount} is not positive.
         */
        public Builder sampleCount(long sampleCount) {
            if (sampleCount <= 0) {
                throw new ConfigurationException("sampleCount", "sampleCount must be positive");
            }
            this.sampleCount = sampleCount;
            return this;
        }

        /**
         * Sets the index of the first channel to write.
         *
         * @param channelMin
         *     A zero-based channel index.
         *
         * @return This builder
         *
         * @throws ConfigurationException
         *     if {@code channelMin} is negative.
         */
        public Builder channelMin(int channelMin) {
            if (channelMin < 0) {
                throw new ConfigurationException("channelMin", "channelMin must not be negative");
            }
            this.channelMin = channelMin;
            return this;
        }

        /**
         * Sets the index one past the last channel to write.  By default, all channels through the last one are
         * written.
         *
         * @param channelMax
         *     An exclusive, zero-based channel index.
         *
         * @return This builder
         *
         * @throws ConfigurationException
         *     if {@code channelMax} is negative.
         */
        public Builder channelMax(int channelMax) {
            if (channelMax < 0) {
                throw new ConfigurationException("channelMax", "channelMax must not be negative");
            }
            this.channelMax = channelMax;
            return this;
        }

        /**
         * Sets the directory into which the output is written.  The directory must already exist.
         *
         * @param outputDirectory
         *     The directory.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code outputDirectory} is {@code null}.
         */
        public Builder outputDirectory(Path outputDirectory) {
            ArgumentUtil.checkNotNull(outputDirectory, "outputDirectory");
            this.outputDirectory = outputDirectory;
            return this;
        }

        /**
         * Sets the name of the output file, without its extension.  By default, the source's base name is used with
         * a "_converted" suffix.
         *
         * @param outputName
         *     The base name of the output file.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code outputName} is {@code null}.
         * @throws ConfigurationException
         *     if {@code outputName} is blank.
         */
        public Builder outputName(String outputName) {
            ArgumentUtil.checkNotNull(outputName, "outputName");
            if (outputName.isBlank()) {
                throw new ConfigurationException("outputName", "outputName must not be blank");
            }
            this.outputName = outputName;
            return this;
        }

        /**
         * Sets how many spectra are read from the source at a time.  This bounds memory use and has no effect on the
         * bytes that are written.
         *
         * @param chunkSize
         *     The number of spectra per read.
         *
         * @return This builder
         *
         * @throws ConfigurationException
         *     if {@code chunkSize} is not positive.
         */
        public Builder chunkSize(int chunkSize) {
            if (chunkSize <= 0) {
                throw new ConfigurationException("chunkSize", "chunkSize must be positive");
            }
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Sets how many spectra make up one PSRFITS subintegration (NSBLK).
         *
         * @param spectraPerSubint
         *     The number of spectra per SUBINT row.
         *
         * @return This builder
         *
         * @throws ConfigurationException
         *     if {@code spectraPerSubint} is not positive.
         */
        public Builder spectraPerSubint(int spectraPerSubint) {
            if (spectraPerSubint <= 0) {
                throw new ConfigurationException("spectraPerSubint", "spectraPerSubint must be positive");
            }
            this.spectraPerSubint = spectraPerSubint;
            return this;
        }

        /**
         * Sets the name of the observer recorded in PSRFITS output.
         *
         * @param observer
         *     The observer.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code observer} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code observer} is not printable ASCII or is longer than 68 characters.
         */
        public Builder observer(String observer) {
            ArgumentUtil.checkNotNull(observer, "observer");
            ArgumentUtil.checkFitsString(observer, FitsHeaderUtil.MAX_STRING_LENGTH, "observer");
            this.observer = observer;
            return this;
        }

        /**
         * Sets the project identifier recorded in PSRFITS output.
         *
         * @param projectId
         *     The project identifier.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code projectId} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code projectId} is not printable ASCII or is longer than 68 characters.
         */
        public Builder projectId(String projectId) {
            ArgumentUtil.checkNotNull(projectId, "projectId");
            ArgumentUtil.checkFitsString(projectId, FitsHeaderUtil.MAX_STRING_LENGTH, "projectId");
            this.projectId = projectId;
            return this;
        }

        /**
         * Sets the file creation time recorded in PSRFITS output.  Fixing this makes the output reproducible.
         *
         * @param creationTime
         *     The creation time (UTC).
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code creationTime} is {@code null}.
         */
        public Builder creationTime(LocalDateTime creationTime) {
            ArgumentUtil.checkNotNull(creationTime, "creationTime");
            this.creationTime = creationTime;
            return this;
        }

        /**
         * Sets the listener that is notified as spectra are written.
         *
         * @param progressListener
         *     The listener.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code progressListener} is {@code null}.
         */
        public Builder progressListener(ProgressListener progressListener) {
            ArgumentUtil.checkNotNull(progressListener, "progressListener");
            this.progressListener = progressListener;
            return this;
        }

        /**
         * Sets the registry used to resolve the telescope's location.
         *
         * @param telescopeRegistry
         *     The registry.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code telescopeRegistry} is {@code null}.
         */
        public Builder telescopeRegistry(TelescopeRegistry telescopeRegistry) {
            ArgumentUtil.checkNotNull(telescopeRegistry, "telescopeRegistry");
            this.telescopeRegistry = telescopeRegistry;
            return this;
        }

        /**
         * Builds the immutable {@code WriterConfig}.
         *
         * @return A {@code WriterConfig}
         */
        public WriterConfig build() {
            return new WriterConfig(this);
        }
    }

    /**
     * Creates a new builder for converting an entire source into the current directory, reading 65536 spectra at a
     * time and writing PSRFITS subintegrations of 4096 spectra.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder that is initialized with this configuration's values.
     *
     * @return A new builder.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    private WriterConfig(Builder builder) {
        startSample = builder.startSample;
        sampleCount = builder.sampleCount;
        channelMin = builder.channelMin;
        channelMax = builder.channelMax;
        outputDirectory = builder.outputDirectory;
        outputName = builder.outputName;
        chunkSize = builder.chunkSize;
        spectraPerSubint = builder.spectraPerSubint;
        observer = builder.observer;
        projectId = builder.projectId;
        creationTime = builder.creationTime;
        progressListener = builder.progressListener;
        telescopeRegistry = builder.telescopeRegistry;
    }

    public long startSample() {
        return startSample;
    }

    /**
     * Gets the number of spectra to write.
     *
     * @return The count, or {@code null} if all remaining spectra should be written.
     */
    public Long sampleCount() {
        return sampleCount;
    }

    public int channelMin() {
        return channelMin;
    }

    /**
     * Gets the exclusive upper channel bound.
     *
     * @return The bound, or {@code null} if all channels through the last one should be written.
     */
    public Integer channelMax() {
        return channelMax;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    /**
     * Gets the name of the output file, without its extension.
     *
     * @return The name, or {@code null} if it should be derived from the source.
     */
    public String outputName() {
        return outputName;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int spectraPerSubint() {
        return spectraPerSubint;
    }

    public String observer() {
        return observer;
    }

    public String projectId() {
        return projectId;
    }

    public LocalDateTime creationTime() {
        return creationTime;
    }

    public ProgressListener progressListener() {
        return progressListener;
    }

    public TelescopeRegistry telescopeRegistry() {
        return telescopeRegistry;
    }
}
