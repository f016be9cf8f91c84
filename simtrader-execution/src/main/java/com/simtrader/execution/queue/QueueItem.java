package com.simtrader.execution.queue;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Queued task with its scheduling attributes. Must-complete items sort ahead
 * of best-effort ones, then lower priority values first, then insertion order.
 */
public record QueueItem(
    String name,
    QueueTask task,
    int priority,
    boolean mustComplete,
    long sequence
) implements Comparable<QueueItem> {

    public static final int DEFAULT_PRIORITY = 3;

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public QueueItem {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (task == null) {
            throw new IllegalArgumentException("task is required");
        }
    }

    public static QueueItem of(String name, QueueTask task) {
        return of(name, task, DEFAULT_PRIORITY, false);
    }

    public static QueueItem of(String name, QueueTask task, int priority, boolean mustComplete) {
        return new QueueItem(name, task, priority, mustComplete, SEQUENCE.incrementAndGet());
    }

    public static QueueItem mustComplete(String name, QueueTask task) {
        return of(name, task, DEFAULT_PRIORITY, true);
    }

    @Override
    public int compareTo(QueueItem other) {
        int cmp = Boolean.compare(other.mustComplete, mustComplete);
        if (cmp != 0) return cmp;
        cmp = Integer.compare(priority, other.priority);
        if (cmp != 0) return cmp;
        return Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return name + (mustComplete ? "[must-complete]" : "") + "#" + sequence;
    }
}
