package com.mar.simulator.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import java.time.Instant;

/**
 * One traded lot. Economic terms are fixed at entry; only the stop price moves afterwards.
 */
@Getter
public class Unit {

    private final String tradeId;
    private final String securityName;
    private final Direction direction;
    private final double entryPrice;
    private final Instant entryTime;
    private final int entryTickIndex;
    private final double atr;
    private final int unitSize;
    private final int lotSize;
    private final double marginFactor;
    private final double stopLossFactor;
    private final double originalStopPrice;

    @Setter
    private double stopPrice;

    @Builder
    public Unit(String tradeId, String securityName, Direction direction, double entryPrice, Instant entryTime,
                int entryTickIndex, double atr, int unitSize, int lotSize, double marginFactor, double stopLossFactor) {
        this.tradeId = tradeId;
        this.securityName = securityName;
        this.direction = direction;
        this.entryPrice = entryPrice;
        this.entryTime = entryTime;
        this.entryTickIndex = entryTickIndex;
        this.atr = atr;
        this.unitSize = unitSize;
        this.lotSize = lotSize;
        this.marginFactor = marginFactor;
        this.stopLossFactor = stopLossFactor;
        this.originalStopPrice = entryPrice - direction.sign() * stopLossFactor * atr;
        this.stopPrice = originalStopPrice;
    }

    public boolean isLong() {
        return direction.isLong();
    }

    /** Notional of this unit at the given price. */
    public double valueAt(double price) {
        return price * unitSize * lotSize;
    }

    public double getValue() {
        return valueAt(entryPrice);
    }

    public double getMarginReq() {
        return getValue() * marginFactor;
    }

    /** A long is stopped when price falls below its stop, a short when price rises above it. */
    public boolean isStoppedAt(double price) {
        return isLong() ? stopPrice > price : stopPrice < price;
    }

    @Override
    public String toString() {
        return String.format("%s unit for %s, size %d contracts @ %.4f (t=%s, stop=%.4f, ATR=%.4f)",
            direction.label(), securityName, unitSize, entryPrice, entryTime, stopPrice, atr);
    }
}
