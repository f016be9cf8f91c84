package com.simtrader.core.model;

import java.util.Optional;

/**
 * Trade request as submitted by a strategy. Prices are absolute, zero means
 * "not set" for price, sl and tp. {@code position} targets an open position,
 * {@code order} targets a pending order.
 */
public record TradeRequest(
    TradeAction action,
    String symbol,
    double volume,
    OrderType type,
    double price,
    double sl,
    double tp,
    long position,
    long order,
    int deviation,
    long magic,
    String comment
) {
    public static Builder builder() {
        return new Builder();
    }

    public static TradeRequest market(String symbol, OrderType type, double volume) {
        return builder().action(TradeAction.DEAL).symbol(symbol).type(type).volume(volume).build();
    }

    public static TradeRequest market(String symbol, OrderType type, double volume, double sl, double tp) {
        return builder().action(TradeAction.DEAL).symbol(symbol).type(type).volume(volume)
                .sl(sl).tp(tp).build();
    }

    /**
     * Full close of an open position.
     */
    public static TradeRequest close(Position position) {
        return close(position, position.volume());
    }

    public static TradeRequest close(Position position, double volume) {
        return builder()
                .action(TradeAction.DEAL)
                .symbol(position.symbol())
                .type(position.type().opposite())
                .volume(volume)
                .position(position.ticket())
                .magic(position.magic())
                .build();
    }

    public static TradeRequest modifyStops(long positionTicket, String symbol, double sl, double tp) {
        return builder().action(TradeAction.SLTP).position(positionTicket).symbol(symbol)
                .sl(sl).tp(tp).build();
    }

    public static TradeRequest pending(String symbol, OrderType type, double volume, double price) {
        return builder().action(TradeAction.PENDING).symbol(symbol).type(type).volume(volume)
                .price(price).build();
    }

    public static TradeRequest modifyPending(long orderTicket, double price, double sl, double tp) {
        return builder().action(TradeAction.MODIFY).order(orderTicket).price(price).sl(sl).tp(tp).build();
    }

    public static TradeRequest remove(long orderTicket) {
        return builder().action(TradeAction.REMOVE).order(orderTicket).build();
    }

    /**
     * Structural check of the fields the action needs. Market conditions are
     * checked by whoever executes the request.
     *
     * @return description of the first violation, empty if the request is well formed
     */
    public Optional<String> validate() {
        if (sl < 0 || tp < 0 || price < 0) {
            return Optional.of("price, sl and tp must not be negative");
        }
        switch (action) {
            case DEAL:
                if (isBlank(symbol)) return Optional.of("symbol is required");
                if (type == null || !type.isMarket()) return Optional.of("deal requires a market order type");
                if (volume <= 0) return Optional.of("volume must be positive");
                break;
            case PENDING:
                if (isBlank(symbol)) return Optional.of("symbol is required");
                if (type == null || !type.isPending()) return Optional.of("pending requires a limit or stop type");
                if (volume <= 0) return Optional.of("volume must be positive");
                if (price <= 0) return Optional.of("pending order requires a price");
                break;
            case SLTP:
                if (position <= 0) return Optional.of("position ticket is required");
                break;
            case MODIFY:
                if (order <= 0) return Optional.of("order ticket is required");
                if (price <= 0) return Optional.of("price is required");
                break;
            case REMOVE:
                if (order <= 0) return Optional.of("order ticket is required");
                break;
            case CLOSE_BY:
                if (position <= 0) return Optional.of("position ticket is required");
                break;
        }
        return Optional.empty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static class Builder {
        private TradeAction action;
        private String symbol;
        private double volume;
        private OrderType type;
        private double price;
        private double sl;
        private double tp;
        private long position;
        private long order;
        private int deviation;
        private long magic;
        private String comment = "";

        public Builder action(TradeAction action) { this.action = action; return this; }
        public Builder symbol(String symbol) { this.symbol = symbol; return this; }
        public Builder volume(double volume) { this.volume = volume; return this; }
        public Builder type(OrderType type) { this.type = type; return this; }
        public Builder price(double price) { this.price = price; return this; }
        public Builder sl(double sl) { this.sl = sl; return this; }
        public Builder tp(double tp) { this.tp = tp; return this; }
        public Builder position(long position) { this.position = position; return this; }
        public Builder order(long order) { this.order = order; return this; }
        public Builder deviation(int deviation) { this.deviation = deviation; return this; }
        public Builder magic(long magic) { this.magic = magic; return this; }
        public Builder comment(String comment) { this.comment = comment; return this; }

        public TradeRequest build() {
            if (action == null) throw new IllegalArgumentException("action is required");
            return new TradeRequest(action, symbol, volume, type, price, sl, tp, position, order,
                    deviation, magic, comment == null ? "" : comment);
        }
    }
}
