package com.simtrader.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of trade request. Codes follow the broker terminal convention.
 */
public enum TradeAction {
    DEAL(1),
    PENDING(5),
    SLTP(6),
    MODIFY(7),
    REMOVE(8),
    CLOSE_BY(10);

    private final int code;

    TradeAction(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static TradeAction fromCode(int code) {
        for (TradeAction action : values()) {
            if (action.code == code) return action;
        }
        throw new IllegalArgumentException("Unknown trade action: " + code);
    }
}
