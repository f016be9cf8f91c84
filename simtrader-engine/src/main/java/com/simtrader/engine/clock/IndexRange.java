package com.simtrader.engine.clock;

/**
 * Valid cursor indices, [start, end).
 */
public record IndexRange(long start, long end) {

    public boolean contains(long index) {
        return index >= start && index < end;
    }
}
