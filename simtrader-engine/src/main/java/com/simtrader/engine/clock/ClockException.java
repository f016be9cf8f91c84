package com.simtrader.engine.clock;

/**
 * Base class for clock movements that cannot be performed.
 */
public class ClockException extends Exception {

    public ClockException(String message) {
        super(message);
    }
}
