package com.simtrader.engine.ledger;

/**
 * Lookup of a ticket the ledger has never stored.
 */
public class UnknownTicketException extends RuntimeException {

    private final long ticket;

    public UnknownTicketException(String ledger, long ticket) {
        super("No " + ledger + " with ticket " + ticket);
        this.ticket = ticket;
    }

    public long getTicket() {
        return ticket;
    }
}
