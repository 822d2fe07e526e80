package org.janelia.fuzzer.util;

/**
 * Utility to track process time intervals.
 *
 * Elapsed time is derived from {@link System#nanoTime()} so that short
 * intervals (e.g. a single detector invocation) are not distorted by wall clock adjustments.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    public static final long DEFAULT_INTERVAL = 5000;

    private final long intervalNanoseconds;
    private final long start;
    private long lastIntervalStart;

    public ProcessTimer() {
        this(DEFAULT_INTERVAL);
    }

    /**
     * @param  interval  number of milliseconds between {@link #hasIntervalPassed} true responses.
     */
    public ProcessTimer(final long interval) {
        this.intervalNanoseconds = interval * NANOSECONDS_PER_MILLISECOND;
        this.start = System.nanoTime();
        this.lastIntervalStart = this.start;
    }

    public boolean hasIntervalPassed() {
        final long now = System.nanoTime();
        final boolean hasPassed = ((now - lastIntervalStart) > intervalNanoseconds);
        if (hasPassed) {
            lastIntervalStart = now;
        }
        return hasPassed;
    }

    public long getElapsedMilliseconds() {
        return (System.nanoTime() - start) / NANOSECONDS_PER_MILLISECOND;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }

    private static final long NANOSECONDS_PER_MILLISECOND = 1_000_000L;
}
