package com.simtrader.engine.clock;

/**
 * Position of the clock: offset in seconds from the span start, and the
 * corresponding epoch time.
 */
public record Cursor(long index, long time) {}
