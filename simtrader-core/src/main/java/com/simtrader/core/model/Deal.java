package com.simtrader.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record Deal(
    long ticket,
    long order,
    long positionId,
    String symbol,
    OrderType type,
    DealEntry entry,
    double volume,
    double price,
    double profit,
    long time,
    TradeReason reason,
    long magic,
    String comment
) implements TradeRecord {

    /**
     * Positive for buy deals, negative for sell deals.
     */
    public double signedVolume() {
        return type.isBuy() ? volume : -volume;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ticket", ticket);
        map.put("order", order);
        map.put("position_id", positionId);
        map.put("symbol", symbol);
        map.put("type", type.getCode());
        map.put("entry", entry.getCode());
        map.put("volume", volume);
        map.put("price", price);
        map.put("profit", profit);
        map.put("time", time);
        map.put("reason", reason.getCode());
        map.put("magic", magic);
        map.put("comment", comment);
        return map;
    }
}
