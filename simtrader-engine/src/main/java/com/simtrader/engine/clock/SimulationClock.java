package com.simtrader.engine.clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monotonic cursor over a historical time span. Every movement either
 * completes or leaves the cursor untouched.
 */
public class SimulationClock {

    private static final Logger log = LoggerFactory.getLogger(SimulationClock.class);

    private final TimeSpan span;
    private final long limit;
    private long index;

    public SimulationClock(TimeSpan span) {
        this(span, 0);
    }

    /**
     * @param stopTime time after which the clock reports exhaustion; 0 for the span end
     */
    public SimulationClock(TimeSpan span, long stopTime) {
        this.span = span;
        if (stopTime != 0 && !span.contains(stopTime)) {
            throw new IllegalArgumentException("stopTime " + stopTime + " outside span");
        }
        this.limit = stopTime == 0 ? span.end() : stopTime + 1;
    }

    public synchronized Cursor cursor() {
        return new Cursor(index, span.start() + index);
    }

    public synchronized long time() {
        return span.start() + index;
    }

    public synchronized boolean hasNext() {
        return span.start() + index + span.step() < limit;
    }

    /**
     * Advance one tick.
     */
    public synchronized Cursor next() throws RangeExhaustedException {
        return fastForward(1);
    }

    /**
     * Advance {@code steps} ticks at once.
     *
     * @throws RangeExhaustedException if the target lies beyond the span; the cursor does not move
     */
    public synchronized Cursor fastForward(long steps) throws RangeExhaustedException {
        if (steps < 0) {
            throw new IllegalArgumentException("steps must not be negative: " + steps);
        }
        // compare in steps so a huge request cannot overflow into a negative index
        long remaining = (limit - 1 - span.start() - index) / span.step();
        if (steps > remaining) {
            throw new RangeExhaustedException(String.format(
                    "Cannot advance %d steps from %d, span ends at %d", steps, time(), limit));
        }
        index += steps * span.step();
        return cursor();
    }

    /**
     * Move to the first tick at or after {@code time}. Rewinding is allowed.
     *
     * @throws OutOfRangeException if no tick time at or after {@code time} lies in the span
     */
    public synchronized Cursor goTo(long time) throws OutOfRangeException {
        if (!span.contains(time)) {
            throw new OutOfRangeException("Time " + time + " outside [" + span.start() + ", " + span.end() + ")");
        }
        long lo = 0;
        long hi = span.ticks();
        while (lo < hi) {
            long mid = (lo + hi) >>> 1;
            if (span.start() + mid * span.step() < time) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        long target = lo * span.step();
        if (lo >= span.ticks() || span.start() + target >= limit) {
            throw new OutOfRangeException("No tick at or after " + time);
        }
        index = target;
        return cursor();
    }

    public synchronized void reset() {
        index = 0;
        log.debug("Clock reset to {}", span.start());
    }

    /**
     * Put the cursor back where a snapshot left it.
     */
    public synchronized void restore(Cursor cursor) throws OutOfRangeException {
        if (!range().contains(cursor.index()) || cursor.time() != span.start() + cursor.index()) {
            throw new OutOfRangeException("Cursor " + cursor + " does not belong to this span");
        }
        index = cursor.index();
    }

    /**
     * Number of ticks the cursor can visit.
     */
    public long length() {
        long seconds = limit - span.start();
        return (seconds + span.step() - 1) / span.step();
    }

    public TimeSpan span() {
        return span;
    }

    public IndexRange range() {
        return new IndexRange(0, limit - span.start());
    }
}
