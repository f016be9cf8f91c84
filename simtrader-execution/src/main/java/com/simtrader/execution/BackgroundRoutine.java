package com.simtrader.execution;

/**
 * Auxiliary work run on a queue worker next to the strategies, such as
 * position tracking or reporting.
 */
@FunctionalInterface
public interface BackgroundRoutine {
    void run(ShutdownSignal shutdown) throws Exception;
}
