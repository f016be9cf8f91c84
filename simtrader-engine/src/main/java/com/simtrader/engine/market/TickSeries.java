package com.simtrader.engine.market;

import com.simtrader.core.model.Tick;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Time-ordered ticks of one symbol with nearest-time lookup.
 */
public class TickSeries {

    private final long[] times;
    private final Tick[] ticks;

    public TickSeries(List<Tick> source) {
        List<Tick> sorted = new ArrayList<>(source);
        sorted.sort(Comparator.comparingLong(Tick::time));
        this.ticks = sorted.toArray(new Tick[0]);
        this.times = new long[ticks.length];
        for (int i = 0; i < ticks.length; i++) {
            times[i] = ticks[i].time();
        }
    }

    public int size() {
        return ticks.length;
    }

    /**
     * Tick closest to {@code time}, re-stamped with {@code time}. Ties go to the earlier tick.
     *
     * @param tolerance maximum distance in seconds, 0 for unlimited
     */
    public Optional<Tick> nearest(long time, long tolerance) {
        if (ticks.length == 0) {
            return Optional.empty();
        }
        int lo = 0;
        int hi = times.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] < time) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        int best;
        if (lo == 0) {
            best = 0;
        } else if (lo == times.length) {
            best = times.length - 1;
        } else {
            best = (time - times[lo - 1]) <= (times[lo] - time) ? lo - 1 : lo;
        }
        if (tolerance > 0 && Math.abs(times[best] - time) > tolerance) {
            return Optional.empty();
        }
        return Optional.of(ticks[best].at(time));
    }
}
