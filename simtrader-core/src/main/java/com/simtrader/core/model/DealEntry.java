package com.simtrader.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a deal relative to its position.
 */
public enum DealEntry {
    IN(0),
    OUT(1),
    INOUT(2);

    private final int code;

    DealEntry(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static DealEntry fromCode(int code) {
        for (DealEntry entry : values()) {
            if (entry.code == code) return entry;
        }
        throw new IllegalArgumentException("Unknown deal entry: " + code);
    }
}
