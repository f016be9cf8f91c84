package com.simtrader.engine.ledger;

import com.simtrader.core.model.TradeRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of a ledger. Results are immutable records in copied lists.
 * Date ranges are inclusive epoch seconds.
 */
public interface LedgerView<T extends TradeRecord> {

    /**
     * @throws UnknownTicketException if nothing was stored under {@code ticket}
     */
    T get(long ticket);

    Optional<T> find(long ticket);

    /**
     * Records referencing a position, in time order.
     */
    List<T> getByPosition(long positionTicket);

    /**
     * Records within the range; same result as {@link #getRange(long, long)}.
     */
    List<T> historyGet(long dateFrom, long dateTo);

    /**
     * Number of records within the range. Always equals the size of {@link #getRange(long, long)}.
     */
    int total(long dateFrom, long dateTo);

    /**
     * Records within the range ordered by time, then ticket.
     */
    List<T> getRange(long dateFrom, long dateTo);

    List<T> values();

    int size();

    Map<Long, Map<String, Object>> toMap();
}
