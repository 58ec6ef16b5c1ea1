package com.mar.simulator.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExitType implements Labelled {
    TIMED("Timed"),
    BREAKOUT("Breakout"),
    MACD_SIGNAL_CROSSOVER("MACD-Signal crossover");

    private final String label;

    ExitType(String label) {
        this.label = label;
    }

    @JsonValue
    @Override
    public String label() {
        return label;
    }

    @JsonCreator
    public static ExitType fromLabel(String text) {
        return Labelled.parse(ExitType.class, text);
    }
}
