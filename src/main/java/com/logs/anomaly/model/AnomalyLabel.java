package com.logs.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-record verdict, exchanged as -1 (anomaly) / 1 (normal).
 */
public enum AnomalyLabel {
    ANOMALY(-1),
    NORMAL(1);

    private final int value;

    AnomalyLabel(int value) {
        this.value = value;
    }

    @JsonValue
    public int getValue() {
        return value;
    }
}
