package com.simtrader.engine.clock;

/**
 * A requested time lies outside the span.
 */
public class OutOfRangeException extends ClockException {

    public OutOfRangeException(String message) {
        super(message);
    }
}
