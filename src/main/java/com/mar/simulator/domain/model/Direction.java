package com.mar.simulator.domain.model;

public enum Direction {
    LONG("Long", 1),
    SHORT("Short", -1);

    private final String label;
    private final int sign;

    Direction(String label, int sign) {
        this.label = label;
        this.sign = sign;
    }

    public String label() {
        return label;
    }

    /** +1 for long, -1 for short: the sign of P&L per unit of price rise. */
    public int sign() {
        return sign;
    }

    public boolean isLong() {
        return this == LONG;
    }
}
