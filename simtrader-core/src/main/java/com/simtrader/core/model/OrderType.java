package com.simtrader.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderType {
    BUY(0),
    SELL(1),
    BUY_LIMIT(2),
    SELL_LIMIT(3),
    BUY_STOP(4),
    SELL_STOP(5);

    private final int code;

    OrderType(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    public boolean isBuy() {
        return this == BUY || this == BUY_LIMIT || this == BUY_STOP;
    }

    public boolean isMarket() {
        return this == BUY || this == SELL;
    }

    public boolean isPending() {
        return !isMarket();
    }

    /**
     * The market side this order executes as once it fills.
     */
    public OrderType marketType() {
        return isBuy() ? BUY : SELL;
    }

    /**
     * Market order on the other side, used to close or reduce a position.
     */
    public OrderType opposite() {
        return isBuy() ? SELL : BUY;
    }

    @JsonCreator
    public static OrderType fromCode(int code) {
        for (OrderType type : values()) {
            if (type.code == code) return type;
        }
        throw new IllegalArgumentException("Unknown order type: " + code);
    }
}
