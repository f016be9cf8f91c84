package com.simtrader.engine.ledger;

import com.simtrader.core.model.Order;
import com.simtrader.core.model.OrderState;

import java.util.List;

/**
 * Orders keyed by ticket and ordered by setup time.
 */
public class OrdersLedger extends TradeLedger<Order> implements OrdersView {

    public OrdersLedger() {
        super("order");
    }

    @Override
    public List<Order> pendingOrders() {
        return values().stream()
                .filter(o -> o.state() == OrderState.PLACED)
                .toList();
    }

    @Override
    public int pendingTotal() {
        return pendingOrders().size();
    }
}
