package com.simtrader.core.model;

import java.util.Map;

/**
 * Common shape of the ledger records. Each record lists its own fields in
 * {@link #toMap()} so exports never depend on reflection.
 */
public interface TradeRecord {

    long ticket();

    /**
     * Time used to order and range-query the record, epoch seconds.
     */
    long time();

    /**
     * Ticket of the position this record belongs to, 0 if none.
     */
    long positionId();

    Map<String, Object> toMap();
}
