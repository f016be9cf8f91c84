package com.simtrader.execution.queue;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one {@link TaskQueue#run()} call.
 *
 * @param completed            items whose body returned normally
 * @param failed               items whose body threw
 * @param cancelled            items interrupted because the queue stopped or timed out
 * @param timedOut             items cancelled by their own per-item timeout
 * @param discarded            items still queued when the queue stopped
 * @param mustCompleteFailures names of must-complete items that threw
 * @param mustCompleteTimeouts must-complete items cut off by the per-item timeout
 * @param elapsed              wall time of the run
 * @param timedOutQueue        whether the aggregate timeout ended the run
 */
public record QueueRunReport(
    int completed,
    int failed,
    int cancelled,
    int timedOut,
    int discarded,
    List<String> mustCompleteFailures,
    int mustCompleteTimeouts,
    Duration elapsed,
    boolean timedOutQueue
) {
    public QueueRunReport {
        mustCompleteFailures = List.copyOf(mustCompleteFailures);
    }

    public int total() {
        return completed + failed + cancelled + timedOut + discarded;
    }

    public boolean isClean() {
        return mustCompleteFailures.isEmpty() && mustCompleteTimeouts == 0;
    }
}
