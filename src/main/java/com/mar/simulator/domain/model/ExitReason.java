package com.mar.simulator.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Exit type recorded on a ledger row.
 */
public enum ExitReason {
    STOP_OUT("Stop out"),
    TIMED("Timed exit"),
    BREAKOUT("Breakout exit"),
    MACD_CROSSOVER("MACD exit"),
    EXIT_ALL("Exit all");

    private final String label;

    ExitReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
