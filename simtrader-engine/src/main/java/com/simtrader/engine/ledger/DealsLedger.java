package com.simtrader.engine.ledger;

import com.simtrader.core.model.Deal;

public class DealsLedger extends TradeLedger<Deal> {

    public DealsLedger() {
        super("deal");
    }
}
