package com.simtrader.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What initiated an order, deal or position.
 */
public enum TradeReason {
    CLIENT(0),
    EXPERT(3),
    SL(4),
    TP(5),
    SO(6);

    private final int code;

    TradeReason(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static TradeReason fromCode(int code) {
        for (TradeReason reason : values()) {
            if (reason.code == code) return reason;
        }
        throw new IllegalArgumentException("Unknown trade reason: " + code);
    }
}
