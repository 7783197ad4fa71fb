package org.scharp.psrwriter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link WindowSelector}. */
public class WindowSelectorTest {

    private static void assertInvalid(String field, String message, WriterConfig config) {
        InvalidWindowException exception = assertThrows(
            InvalidWindowException.class,
            () -> WindowSelector.resolve(100, 90, config));
        assertEquals(field, exception.field());
        assertEquals(message, exception.getMessage());
    }

    @Test
    void testDefaultsSelectEverything() {
        Window window = WindowSelector.resolve(100, 90, WriterConfig.builder().build());
        assertEquals(new Window(0, 100, 0, 90), window);
        assertEquals(90, window.nchans());
    }

    @Test
    void testDefaultCountRunsToTheEnd() {
        Window window = WindowSelector.resolve(100, 90, WriterConfig.builder().startSample(60).build());
        assertEquals(60, window.start());
        assertEquals(40, window.count());
    }

    @Test
    void testChannelSubset() {
        Window window = WindowSelector.resolve(100, 90,
            WriterConfig.builder().sampleCount(10).channelMin(10).channelMax(90).build());
        assertEquals(0, window.start());
        assertEquals(10, window.count());
        assertEquals(10, window.channelMin());
        assertEquals(90, window.channelMax());
        assertEquals(80, window.nchans());
    }

    @Test
    void testSingleSpectrumAtTheEnd() {
        Window window = WindowSelector.resolve(100, 90,
            WriterConfig.builder().startSample(99).sampleCount(1).channelMin(89).build());
        assertEquals(new Window(99, 1, 89, 90), window);
    }

    @Test
    void testInvalidWindows() {
        assertInvalid("channelMax", "channelMax (100) must not exceed the number of channels (90)",
            WriterConfig.builder().sampleCount(10).channelMin(10).channelMax(100).build());

        assertInvalid("startSample", "startSample (100) must be less than the number of spectra (100)",
            WriterConfig.builder().startSample(100).build());

        assertInvalid("sampleCount", "startSample (50) + sampleCount (51) exceeds the number of spectra (100)",
            WriterConfig.builder().startSample(50).sampleCount(51).build());

        assertInvalid("channelMin", "channelMin (40) must be less than channelMax (40)",
            WriterConfig.builder().channelMin(40).channelMax(40).build());

        assertInvalid("channelMin", "channelMin (90) must be less than channelMax (90)",
            WriterConfig.builder().channelMin(90).build());
    }

    @Test
    void testInvalidWindowIsAConfigurationException() {
        ConfigurationException exception = assertThrows(
            ConfigurationException.class,
            () -> WindowSelector.resolve(10, 10, WriterConfig.builder().startSample(10).build()));
        assertEquals("startSample", exception.field());
    }

    @Test
    void testWindowEquality() {
        Window window = new Window(1, 2, 3, 4);
        assertEquals(new Window(1, 2, 3, 4), window);
        assertEquals(new Window(1, 2, 3, 4).hashCode(), window.hashCode());
        assertNotEquals(new Window(1, 2, 3, 5), window);
        assertEquals("Window[start=1, count=2, channels=[3, 4)]", window.toString());
    }
}
