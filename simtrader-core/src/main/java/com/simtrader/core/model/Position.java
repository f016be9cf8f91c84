package com.simtrader.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Net exposure on a symbol. The ticket equals the ticket of the order that
 * opened it. A closed position keeps its realized profit and has zero volume.
 */
public record Position(
    long ticket,
    String symbol,
    OrderType type,
    double volume,
    double priceOpen,
    double priceCurrent,
    double sl,
    double tp,
    double profit,
    long time,
    long timeUpdate,
    TradeReason reason,
    long magic,
    String comment
) implements TradeRecord {

    @Override
    public long positionId() {
        return ticket;
    }

    /**
     * Signed volume: positive for buy positions, negative for sell positions.
     */
    public double netVolume() {
        return type.isBuy() ? volume : -volume;
    }

    public Position withMark(double price, double floatingProfit) {
        return new Position(ticket, symbol, type, volume, priceOpen, price, sl, tp,
                floatingProfit, time, timeUpdate, reason, magic, comment);
    }

    public Position withStops(double newSl, double newTp, long now) {
        return new Position(ticket, symbol, type, volume, priceOpen, priceCurrent, newSl, newTp,
                profit, time, now, reason, magic, comment);
    }

    public Position withVolume(OrderType newType, double newVolume, double newPriceOpen,
                               double newSl, double newTp, long now) {
        return new Position(ticket, symbol, newType, newVolume, newPriceOpen, priceCurrent, newSl, newTp,
                profit, time, now, reason, magic, comment);
    }

    public Position closed(double closePrice, double realizedProfit, long now) {
        return new Position(ticket, symbol, type, 0, priceOpen, closePrice, sl, tp,
                realizedProfit, time, now, reason, magic, comment);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ticket", ticket);
        map.put("symbol", symbol);
        map.put("type", type.getCode());
        map.put("volume", volume);
        map.put("price_open", priceOpen);
        map.put("price_current", priceCurrent);
        map.put("sl", sl);
        map.put("tp", tp);
        map.put("profit", profit);
        map.put("time", time);
        map.put("time_update", timeUpdate);
        map.put("reason", reason.getCode());
        map.put("magic", magic);
        map.put("comment", comment);
        return map;
    }
}
