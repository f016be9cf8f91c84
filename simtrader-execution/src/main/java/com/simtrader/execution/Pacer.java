package com.simtrader.execution;

import java.time.Duration;

/**
 * Decides how long a strategy waits between trading cycles. Live runs wait on
 * the wall clock, backtests wait for simulated time to pass.
 */
public interface Pacer {

    /**
     * Called once per strategy before it starts.
     */
    default void register() {
    }

    /**
     * Suspension point between cycles. Interruptible.
     */
    void sleep(Duration interval) throws InterruptedException;

    /**
     * Called once per strategy after it stops, whatever the reason.
     */
    default void deregister() {
    }
}
