package org.ptycho.diffraction.util;

/**
 * Tracks elapsed time for long running loads so that progress can be logged at a throttled interval.
 * Instances are shared by loader worker threads.
 *
 * @author Diffraction Assembly Developers
 */
public class ProcessTimer {

    public static final long DEFAULT_INTERVAL = 5000;

    private final long interval;
    private final long start;
    private long lastIntervalStart;

    public ProcessTimer() {
        this(DEFAULT_INTERVAL);
    }

    public ProcessTimer(final long interval) {
        this.interval = interval;
        this.start = System.currentTimeMillis();
        this.lastIntervalStart = this.start;
    }

    /**
     * @return true once per interval (only one of several concurrent callers sees true).
     */
    public synchronized boolean hasIntervalPassed() {
        final long now = System.currentTimeMillis();
        final boolean hasPassed = ((now - lastIntervalStart) > interval);
        if (hasPassed) {
            lastIntervalStart = now;
        }
        return hasPassed;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long totalMilliseconds = getElapsedMilliseconds();
        final long totalSeconds = totalMilliseconds / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        final long milliseconds = totalMilliseconds % 1000;
        return minutes + " minutes, " + seconds + "." + String.format("%03d", milliseconds) + " seconds";
    }
}
