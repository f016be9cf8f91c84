package com.simtrader.execution;

import com.simtrader.execution.queue.QueueRunReport;

import java.time.Duration;

/**
 * Result of {@link StrategyExecutor#execute()}.
 */
public record ExecutionReport(
    int strategies,
    int routines,
    int threadRoutines,
    QueueRunReport queue
) {
    public int mustCompleteTimeouts() {
        return queue.mustCompleteTimeouts();
    }

    public Duration elapsed() {
        return queue.elapsed();
    }

    public boolean isClean() {
        return queue.isClean();
    }
}
