package com.simtrader.engine.ledger;

import com.simtrader.core.model.Order;

import java.util.List;

public interface OrdersView extends LedgerView<Order> {

    /**
     * Orders still waiting for their trigger price.
     */
    List<Order> pendingOrders();

    int pendingTotal();
}
