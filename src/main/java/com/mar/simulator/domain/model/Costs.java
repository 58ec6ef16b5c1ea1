package com.mar.simulator.domain.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class Costs {
    // fraction of slippage-adjusted notional, charged on both legs
    @PositiveOrZero private double transactionCostRate = 0.0;
    // price units per contract, charged on both legs
    @PositiveOrZero private double slippagePerContract = 0.0;
}
