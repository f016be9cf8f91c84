package com.simtrader.engine.clock;

/**
 * The clock cannot advance because the move would leave the span.
 */
public class RangeExhaustedException extends ClockException {

    public RangeExhaustedException(String message) {
        super(message);
    }
}
