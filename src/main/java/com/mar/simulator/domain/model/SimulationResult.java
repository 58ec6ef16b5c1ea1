package com.mar.simulator.domain.model;

import java.util.List;

public record SimulationResult(SimulationSummary summary, List<TradeRecord> ledger) {}
