package com.simtrader.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderState {
    PLACED("placed"),
    FILLED("filled"),
    CANCELLED("cancelled"),
    REJECTED("rejected");

    private final String value;

    OrderState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
