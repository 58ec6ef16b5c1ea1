package com.mar.simulator.engine;

import static com.mar.simulator.engine.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import com.mar.simulator.domain.model.Direction;
import com.mar.simulator.domain.model.ExitReason;
import com.mar.simulator.domain.model.SimulationSummary;
import com.mar.simulator.domain.model.TradeRecord;
import com.mar.simulator.domain.model.Unit;

class TradeBookTest {

    private TradeBook book;

    @BeforeEach
    void setup() {
        book = new TradeBook();
    }

    private static Unit unit(String id) {
        return Unit.builder().tradeId(id).securityName("ES").direction(Direction.LONG)
                   .entryPrice(100.0).entryTime(T0).atr(1.0).unitSize(1).lotSize(1).stopLossFactor(2.0).build();
    }

    private static TradeRecord row(String id) {
        return TradeRecord.builder().tradeId(id).security("ES").direction(Direction.LONG).entryTime(T0)
                          .entryPrice(100.0).unitSize(1).lotSize(1).build();
    }

    private static ClosedUnit closed(String id, double net) {
        return new ClosedUnit(unit(id), 100.0 + net, net + 1.0, 0.5, 0.5, net);
    }

    @Test
    @DisplayName("rows keep entry order and are mutated once at exit")
    void openAndClose() {
        book.open(row("a"));
        book.open(row("b"));
        assertEquals(2, book.openCount());

        TradeRecord r = book.close(closed("b", 3.0), T0.plusSeconds(5), 5, ExitReason.BREAKOUT, 99.0, 1.2);
        assertSame(book.get("b"), r);
        assertEquals(ExitReason.BREAKOUT, r.getExitType());
        assertEquals(99.0, r.getExitBreakoutPrice());
        assertEquals(5, r.getExitTickIndex());
        assertEquals(1, book.openCount());
        assertEquals("a", book.rows().get(0).getTradeId());
    }

    @Test
    @DisplayName("duplicate ids and double closes are ledger violations")
    void violations() {
        book.open(row("a"));
        var dup = assertThrows(SimulationException.class, () -> book.open(row("a")));
        assertEquals(SimulationException.ErrorCode.LEDGER_VIOLATION, dup.getErrorCode());

        book.close(closed("a", 1.0), T0, 1, ExitReason.TIMED, null, 1.0);
        assertThrows(SimulationException.class,
            () -> book.close(closed("a", 1.0), T0, 2, ExitReason.TIMED, null, 1.0));
        assertThrows(SimulationException.class,
            () -> book.close(closed("zzz", 1.0), T0, 2, ExitReason.TIMED, null, 1.0));
    }

    @Test
    @DisplayName("summary aggregates closed rows only")
    void summary() {
        book.open(row("a"));
        book.open(row("b"));
        book.open(row("c"));
        book.close(closed("a", 4.0), T0, 1, ExitReason.TIMED, null, 1.0);
        book.close(closed("b", -2.0), T0, 1, ExitReason.STOP_OUT, null, 1.0);

        SimulationSummary s = book.summarize().build();
        assertEquals(2, s.getTrades());
        assertEquals(1, s.getWinningTrades());
        assertEquals(1, s.getLosingTrades());
        assertEquals(2.0, s.getNetProfit(), 1e-12);
        assertEquals(4.0, s.getGrossProfit(), 1e-12);
        assertEquals(1.0, s.getAvgNetProfit(), 1e-12);
        assertEquals(0.5, s.getAvgSlippageCost(), 1e-12);
    }

    @Test
    void emptySummaryHasNaNAverages() {
        SimulationSummary s = book.summarize().build();
        assertEquals(0, s.getTrades());
        assertTrue(Double.isNaN(s.getAvgGrossProfit()));
    }
}
