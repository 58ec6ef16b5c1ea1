package com.mar.simulator.engine;

import com.mar.simulator.domain.model.Unit;

/**
 * Outcome of closing a unit at a price, costs included.
 */
public record ClosedUnit(Unit unit,
                         double exitPrice,
                         double grossProfit,
                         double slippageCost,
                         double transactionCost,
                         double netProfit) {}
