package com.mar.simulator.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import com.mar.simulator.domain.model.ExitReason;
import com.mar.simulator.domain.model.SimulationSummary;
import com.mar.simulator.domain.model.TradeRecord;

/**
 * Append-only ledger: one row per unit, keyed by trade id, kept in entry order.
 * A row is written at entry and mutated exactly once, at exit.
 */
public class TradeBook {

    private final Map<String, TradeRecord> byId = new HashMap<>();
    private final List<TradeRecord> rows = new ArrayList<>();

    public void open(TradeRecord row) {
        if (byId.putIfAbsent(row.getTradeId(), row) != null) {
            throw new SimulationException(SimulationException.ErrorCode.LEDGER_VIOLATION,
                "Duplicate trade id " + row.getTradeId());
        }
        rows.add(row);
    }

    public TradeRecord close(ClosedUnit closed, Instant exitTime, int exitTickIndex, ExitReason reason,
                             Double breakoutPrice, double exitAtr) {
        String tradeId = closed.unit().getTradeId();
        TradeRecord row = byId.get(tradeId);
        if (row == null) {
            throw new SimulationException(SimulationException.ErrorCode.LEDGER_VIOLATION,
                "No ledger row for trade " + tradeId);
        }
        if (row.isClosed()) {
            throw new SimulationException(SimulationException.ErrorCode.LEDGER_VIOLATION,
                "Trade " + tradeId + " already closed as " + row.getExitType());
        }
        row.setExitTime(exitTime);
        row.setExitTickIndex(exitTickIndex);
        row.setExitPrice(closed.exitPrice());
        row.setExitType(reason);
        row.setExitBreakoutPrice(breakoutPrice);
        row.setExitAtr(exitAtr);
        row.setGrossProfit(closed.grossProfit());
        row.setSlippageCost(closed.slippageCost());
        row.setTransactionCost(closed.transactionCost());
        row.setNetProfit(closed.netProfit());
        return row;
    }

    public TradeRecord get(String tradeId) {
        return byId.get(tradeId);
    }

    public List<TradeRecord> rows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }

    public long openCount() {
        return rows.stream().filter(r -> !r.isClosed()).count();
    }

    /**
     * Aggregates over closed rows. Averages are NaN when nothing closed.
     */
    public SimulationSummary.SimulationSummaryBuilder summarize() {
        int closed = 0, winners = 0, losers = 0;
        double gross = 0, net = 0, slippage = 0, transaction = 0;
        for (TradeRecord r : rows) {
            if (!r.isClosed()) continue;
            closed++;
            gross += r.getGrossProfit();
            net += r.getNetProfit();
            slippage += r.getSlippageCost();
            transaction += r.getTransactionCost();
            if (r.getNetProfit() > 0) winners++;
            else if (r.getNetProfit() < 0) losers++;
        }
        return SimulationSummary.builder()
                                .trades(closed)
                                .winningTrades(winners)
                                .losingTrades(losers)
                                .grossProfit(gross)
                                .netProfit(net)
                                .slippageCost(slippage)
                                .transactionCost(transaction)
                                .avgGrossProfit(average(gross, closed))
                                .avgNetProfit(average(net, closed))
                                .avgSlippageCost(average(slippage, closed))
                                .avgTransactionCost(average(transaction, closed));
    }

    private static double average(double total, int count) {
        return count == 0 ? Double.NaN : total / count;
    }
}
