package com.simtrader.execution;

/**
 * Blocking work offloaded to its own thread. Its result is handed back on the
 * event loop rather than written to shared state.
 */
@FunctionalInterface
public interface BlockingRoutine<T> {
    T call() throws Exception;
}
