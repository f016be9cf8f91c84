package com.simtrader.core.config;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueueMode {
    /** Stop once the queue is drained and nothing is running. */
    FINITE("finite"),
    /** Keep waiting for new items until stopped or timed out. */
    INFINITE("infinite");

    private final String value;

    QueueMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
