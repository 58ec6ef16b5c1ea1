package com.mar.simulator.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What to do when an entry opportunity shows up for a direction a security already holds.
 */
public enum ExtraUnitPolicy implements Labelled {
    /** Same trigger as a fresh entry. */
    AS_NEW_UNIT("As new unit"),
    /** Pyramid once price has moved far enough, measured in entry ATRs, since the last unit. */
    USING_ATR("Using ATR"),
    NO("No");

    private final String label;

    ExtraUnitPolicy(String label) {
        this.label = label;
    }

    @JsonValue
    @Override
    public String label() {
        return label;
    }

    @JsonCreator
    public static ExtraUnitPolicy fromLabel(String text) {
        return Labelled.parse(ExtraUnitPolicy.class, text);
    }
}
