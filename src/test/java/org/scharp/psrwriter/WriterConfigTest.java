package org.scharp.psrwriter;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link WriterConfig}. */
public class WriterConfigTest {

    @Test
    void testDefaults() {
        WriterConfig config = WriterConfig.builder().build();

        assertEquals(0, config.startSample());
        assertNull(config.sampleCount());
        assertEquals(0, config.channelMin());
        assertNull(config.channelMax());
        assertEquals(Path.of(""), config.outputDirectory());
        assertNull(config.outputName());
        assertEquals(WriterConfig.DEFAULT_CHUNK_SIZE, config.chunkSize());
        assertEquals(65536, config.chunkSize());
        assertEquals(4096, config.spectraPerSubint());
        assertEquals("unknown", config.observer());
        assertEquals("unknown", config.projectId());
        assertSame(ProgressListener.NONE, config.progressListener());
        assertSame(TelescopeRegistry.builtIn(), config.telescopeRegistry());
    }

    @Test
    void testBuilder() {
        LocalDateTime creationTime = LocalDateTime.of(2024, 3, 1, 12, 30, 15);
        ProgressListener listener = (written, total) -> { };
        TelescopeRegistry registry = name -> null;

        WriterConfig config = WriterConfig.builder().
            startSample(10).
            sampleCount(20).
            channelMin(3).
            channelMax(7).
            outputDirectory(Path.of("/data")).
            outputName("cut").
            chunkSize(128).
            spectraPerSubint(64).
            observer("Jocelyn Bell").
            projectId("P123").
            creationTime(creationTime).
            progressListener(listener).
            telescopeRegistry(registry).
            build();

        assertEquals(10, config.startSample());
        assertEquals(20L, config.sampleCount());
        assertEquals(3, config.channelMin());
        assertEquals(7, config.channelMax());
        assertEquals(Path.of("/data"), config.outputDirectory());
        assertEquals("cut", config.outputName());
        assertEquals(128, config.chunkSize());
        assertEquals(64, config.spectraPerSubint());
        assertEquals("Jocelyn Bell", config.observer());
        assertEquals("P123", config.projectId());
        assertEquals(creationTime, config.creationTime());
        assertSame(listener, config.progressListener());
        assertSame(registry, config.telescopeRegistry());

        // toBuilder() copies everything
        WriterConfig copy = config.toBuilder().chunkSize(1).build();
        assertEquals(1, copy.chunkSize());
        assertEquals(10, copy.startSample());
        assertEquals(20L, copy.sampleCount());
        assertEquals(7, copy.channelMax());
        assertEquals("cut", copy.outputName());
        assertEquals(creationTime, copy.creationTime());
        assertSame(registry, copy.telescopeRegistry());
    }

    @Test
    void testInvalidValues() {
        WriterConfig.Builder builder = WriterConfig.builder();

        ConfigurationException exception = assertThrows(ConfigurationException.class, () -> builder.startSample(-1));
        assertEquals("startSample", exception.field());
        assertEquals("startSample must not be negative", exception.getMessage());

        exception = assertThrows(ConfigurationException.class, () -> builder.sampleCount(0));
        assertEquals("sampleCount", exception.field());

        exception = assertThrows(ConfigurationException.class, () -> builder.channelMin(-1));
        assertEquals("channelMin", exception.field());

        exception = assertThrows(ConfigurationException.class, () -> builder.channelMax(-1));
        assertEquals("channelMax", exception.field());

        exception = assertThrows(ConfigurationException.class, () -> builder.chunkSize(0));
        assertEquals("chunkSize", exception.field());
        assertEquals("chunkSize must be positive", exception.getMessage());

        exception = assertThrows(ConfigurationException.class, () -> builder.spectraPerSubint(0));
        assertEquals("spectraPerSubint", exception.field());

        exception = assertThrows(ConfigurationException.class, () -> builder.outputName("  "));
        assertEquals("outputName", exception.field());

        Exception otherException = assertThrows(IllegalArgumentException.class, () -> builder.observer("x".repeat(69)));
        assertEquals("observer must not be longer than 68 characters", otherException.getMessage());

        // Each apostrophe takes two characters on a FITS header card.
        otherException = assertThrows(IllegalArgumentException.class,
            () -> builder.observer("O'" + "x".repeat(66)));
        assertEquals("observer must not be longer than 68 characters when apostrophes are doubled",
            otherException.getMessage());

        otherException = assertThrows(IllegalArgumentException.class,
            () -> builder.projectId("'".repeat(35)));
        assertEquals("projectId must not be longer than 68 characters when apostrophes are doubled",
            otherException.getMessage());
        assertEquals("O'" + "x".repeat(65), builder.observer("O'" + "x".repeat(65)).build().observer());

        otherException = assertThrows(NullPointerException.class, () -> builder.outputDirectory(null));
        assertEquals("outputDirectory must not be null", otherException.getMessage());

        // The builder is unchanged by the failed calls.
        assertEquals(WriterConfig.DEFAULT_CHUNK_SIZE, builder.build().chunkSize());
    }
}
