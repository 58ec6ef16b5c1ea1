package com.mar.simulator.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class Sizing {
    @Positive private double notionalAccountSize = 100_000;
    @PositiveOrZero private double riskPercentOfAccount = 1.0;

    // re-base the notional account by every closed trade's net profit
    private boolean compoundAccountSize = false;

    @Min(1) private int maxPositionLimitEachWay = 12;
    @Min(1) private int maxUnits = 4;
    @Min(1) private int atrAverageRange = 20;
    @Min(1) private int lotSize = 15;

    @PositiveOrZero private double marginFactor = 0.0;
    // <= 0 disables the per-trade margin cap
    private double maxMarginPerTrade = 0.0;
}
