package com.simtrader.core.model;

/**
 * Quote for one symbol at one point in time. Time is epoch seconds (UTC).
 */
public record Tick(
    long time,
    double bid,
    double ask,
    double volume
) {
    public Tick {
        if (bid <= 0 || ask <= 0) {
            throw new IllegalArgumentException("bid and ask must be positive");
        }
        if (ask < bid) {
            throw new IllegalArgumentException("ask " + ask + " below bid " + bid);
        }
    }

    public static Tick of(long time, double bid, double ask) {
        return new Tick(time, bid, ask, 0);
    }

    public double spread() {
        return ask - bid;
    }

    /**
     * Same quote stamped with another time.
     */
    public Tick at(long newTime) {
        return newTime == time ? this : new Tick(newTime, bid, ask, volume);
    }
}
