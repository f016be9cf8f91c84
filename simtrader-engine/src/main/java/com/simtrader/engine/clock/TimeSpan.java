package com.simtrader.engine.clock;

/**
 * Simulated time domain [start, end) in epoch seconds, sampled every {@code step} seconds.
 */
public record TimeSpan(long start, long end, long step) {

    public TimeSpan {
        if (end <= start) {
            throw new IllegalArgumentException("end " + end + " must be after start " + start);
        }
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
    }

    public static TimeSpan of(long start, long end) {
        return new TimeSpan(start, end, 1);
    }

    /**
     * Length of the span in seconds.
     */
    public long length() {
        return end - start;
    }

    /**
     * Number of ticks in the span.
     */
    public long ticks() {
        return (length() + step - 1) / step;
    }

    public boolean contains(long time) {
        return time >= start && time < end;
    }
}
