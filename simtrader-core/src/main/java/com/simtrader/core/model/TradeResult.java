package com.simtrader.core.model;

public record TradeResult(
    TradeRetcode retcode,
    long order,
    long deal,
    double volume,
    double price,
    double bid,
    double ask,
    String comment,
    TradeRequest request
) {
    public static TradeResult rejected(TradeRetcode retcode, String comment, TradeRequest request) {
        return new TradeResult(retcode, 0, 0, 0, 0, 0, 0, comment, request);
    }

    public boolean isDone() {
        return retcode == TradeRetcode.DONE;
    }
}
