package org.scharp.psrwriter;

/**
 * A validated range of spectra and channels to convert.
 * <p>
 * Instances are created by {@link WindowSelector} and always satisfy {@code 0 <= start},
 * {@code start + count <= nspectra}, and {@code 0 <= channelMin < channelMax <= nchans} for the source they were
 * resolved against.
 * </p>
 */
public final class Window {

    private final long start;
    private final long count;
    private final int channelMin;
    private final int channelMax;

    Window(long start, long count, int channelMin, int channelMax) {
        assert 0 <= start;
        assert 0 < count;
        assert 0 <= channelMin && channelMin < channelMax;

        this.start = start;
        this.count = count;
        this.channelMin = channelMin;
        this.channelMax = channelMax;
    }

    /**
     * Gets the index of the first spectrum in the window.
     *
     * @return A zero-based spectrum index.
     */
    public long start() {
        return start;
    }

    /**
     * Gets the number of spectra in the window.
     *
     * @return A positive number.
     */
    public long count() {
        return count;
    }

    /**
     * Gets the index of the first channel in the window.
     *
     * @return A zero-based channel index, inclusive.
     */
    public int channelMin() {
        return channelMin;
    }

    /**
     * Gets the index one past the last channel in the window.
     *
     * @return A zero-based channel index, exclusive.  It is greater than {@link #channelMin()}.
     */
    public int channelMax() {
        return channelMax;
    }

    /**
     * Gets the number of channels in the window.
     *
     * @return {@code channelMax() - channelMin()}
     */
    public int nchans() {
        return channelMax - channelMin;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Window)) {
            return false;
        }
        Window that = (Window) other;
        return start == that.start && count == that.count && channelMin == that.channelMin &&
            channelMax == that.channelMax;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(start) * 31 * 31 * 31 + Long.hashCode(count) * 31 * 31 + channelMin * 31 + channelMax;
    }

    @Override
    public String toString() {
        return "Window[start=" + start + ", count=" + count + ", channels=[" + channelMin + ", " + channelMax + ")]";
    }
}
