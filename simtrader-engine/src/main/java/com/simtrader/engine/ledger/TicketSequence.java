package com.simtrader.engine.ledger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One allocator shared by orders and deals, so tickets never collide and
 * grow in allocation order.
 */
public class TicketSequence {

    private final AtomicLong next;

    public TicketSequence() {
        this(1);
    }

    public TicketSequence(long first) {
        this.next = new AtomicLong(first);
    }

    public long next() {
        return next.getAndIncrement();
    }

    public long peek() {
        return next.get();
    }

    public void resetTo(long first) {
        next.set(first);
    }
}
