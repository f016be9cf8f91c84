package com.simtrader.execution.queue;

/**
 * A unit of work for the {@link TaskQueue}. Cancellation arrives as a thread
 * interrupt, so long-running bodies should block interruptibly.
 */
@FunctionalInterface
public interface QueueTask {
    void run() throws Exception;
}
