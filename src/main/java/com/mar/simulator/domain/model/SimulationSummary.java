package com.mar.simulator.domain.model;

import lombok.Builder;
import lombok.Data;
import java.time.Instant;

@Data
@Builder
public class SimulationSummary {
    private int ticks;
    private int trades;
    private int winningTrades;
    private int losingTrades;

    private double grossProfit;
    private double netProfit;
    private double slippageCost;
    private double transactionCost;

    // per-trade averages; NaN when no trade closed
    private double avgGrossProfit;
    private double avgNetProfit;
    private double avgSlippageCost;
    private double avgTransactionCost;

    private double maxMargin;
    private Instant maxMarginTime;

    private double finalEquity;
    private double finalNotionalAccountSize;
}
