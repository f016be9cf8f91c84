package com.simtrader.core.config;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happens to unfinished work when a queue stops or times out.
 */
public enum ExitPolicy {
    /** Cancel everything, must-complete items included. */
    CANCEL("cancel"),
    /** Cancel best-effort items, let must-complete items finish. */
    COMPLETE_PRIORITY("complete_priority");

    private final String value;

    ExitPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
