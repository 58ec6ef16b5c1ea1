package com.mar.simulator.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryType implements Labelled {
    BREAKOUT("Breakout"),
    MACD_SIGNAL_CROSSOVER("MACD-Signal crossover"),
    MACD_ZERO_CROSSOVER("MACD zero crossover");

    private final String label;

    EntryType(String label) {
        this.label = label;
    }

    @JsonValue
    @Override
    public String label() {
        return label;
    }

    public boolean usesMacd() {
        return this != BREAKOUT;
    }

    @JsonCreator
    public static EntryType fromLabel(String text) {
        return Labelled.parse(EntryType.class, text);
    }
}
