package com.mar.simulator.domain.model;

import lombok.Builder;
import lombok.Data;
import java.time.Instant;

/**
 * Ledger row for one unit. Entry fields are filled when the unit opens; exit fields once, when it closes.
 */
@Data
@Builder
public class TradeRecord {
    private String tradeId;
    private String security;
    private Direction direction;

    private Instant entryTime;
    private int entryTickIndex;
    private double entryPrice;
    private int unitSize;
    private int lotSize;
    private double entryAtr;
    private double stopPrice;
    private double marginReq;

    // account snapshot right after entry
    private double notionalAccountSize;
    private double equity;
    private double marginTotal;
    private String securityStatus;

    private Instant exitTime;
    private Integer exitTickIndex;
    private Double exitPrice;
    private ExitReason exitType;
    private Double exitBreakoutPrice;   // breakout exits only
    private Double exitAtr;
    private Double grossProfit;
    private Double slippageCost;
    private Double transactionCost;
    private Double netProfit;

    public boolean isClosed() {
        return exitType != null;
    }
}
