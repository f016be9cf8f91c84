package com.simtrader.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record Order(
    long ticket,
    String symbol,
    OrderType type,
    OrderState state,
    double volumeInitial,
    double volumeCurrent,
    double priceOpen,
    double priceCurrent,
    double sl,
    double tp,
    long timeSetup,
    long timeDone,
    long positionId,
    TradeReason reason,
    long magic,
    String comment
) implements TradeRecord {

    @Override
    public long time() {
        return timeSetup;
    }

    public Order withState(OrderState newState, long doneAt) {
        return new Order(ticket, symbol, type, newState, volumeInitial,
                newState == OrderState.FILLED ? 0 : volumeCurrent,
                priceOpen, priceCurrent, sl, tp, timeSetup, doneAt, positionId, reason, magic, comment);
    }

    /**
     * Filled copy of this order. Pending orders keep their setup time.
     */
    public Order filled(double fillPrice, long doneAt, long position) {
        return new Order(ticket, symbol, type, OrderState.FILLED, volumeInitial, 0,
                priceOpen, fillPrice, sl, tp, timeSetup, doneAt, position, reason, magic, comment);
    }

    public Order withLevels(double price, double newSl, double newTp) {
        return new Order(ticket, symbol, type, state, volumeInitial, volumeCurrent,
                price, priceCurrent, newSl, newTp, timeSetup, timeDone, positionId, reason, magic, comment);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ticket", ticket);
        map.put("symbol", symbol);
        map.put("type", type.getCode());
        map.put("state", state.getValue());
        map.put("volume_initial", volumeInitial);
        map.put("volume_current", volumeCurrent);
        map.put("price_open", priceOpen);
        map.put("price_current", priceCurrent);
        map.put("sl", sl);
        map.put("tp", tp);
        map.put("time_setup", timeSetup);
        map.put("time_done", timeDone);
        map.put("position_id", positionId);
        map.put("reason", reason.getCode());
        map.put("magic", magic);
        map.put("comment", comment);
        return map;
    }
}
