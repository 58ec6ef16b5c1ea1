package com.mar.simulator.engine;

import lombok.Getter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import com.mar.simulator.domain.model.Direction;
import com.mar.simulator.domain.model.PriceSeries;
import com.mar.simulator.domain.model.Unit;
import com.mar.simulator.util.Indicators;

/**
 * One instrument: its price history, indicator state and open units.
 * Positions are kept oldest first in each direction.
 */
public class Security {

    @Getter
    private final SecuritySpec spec;
    private final PriceSeries history;

    private final List<Unit> longPositions = new ArrayList<>();
    private final List<Unit> shortPositions = new ArrayList<>();

    @Getter private double atr;
    @Getter private int unitSize;
    @Getter private double longEntryAtr;
    @Getter private double shortEntryAtr;

    // MACD state, NaN when disabled
    @Getter private double emaFast = Double.NaN;
    @Getter private double emaSlow = Double.NaN;
    @Getter private double macd = Double.NaN;
    @Getter private double signal = Double.NaN;
    @Getter private double prevMacd = Double.NaN;
    @Getter private double prevSignal = Double.NaN;

    public Security(SecuritySpec spec, PriceSeries warmup) {
        this.spec = spec;
        this.history = warmup;
        int needed = requiredHistory(spec);
        if (warmup.size() < needed) {
            throw new SimulationException(SimulationException.ErrorCode.INSUFFICIENT_HISTORY,
                "Security " + spec.getName() + " needs " + needed + " warm-up prices, got " + warmup.size());
        }
        double[] prices = warmup.toArray();
        for (double p : prices) validatePrice(p);
        this.atr = Indicators.initAtr(prices, spec.getAtrAverageRange());
        if (spec.isMacdEnabled()) {
            var series = Indicators.macd(prices, spec.getMacdFastLength(), spec.getMacdSlowLength(),
                spec.getMacdSignalLength(), spec.getMacdSmoothing());
            int last = prices.length - 1;
            this.emaFast = series.emaFast()[last];
            this.emaSlow = series.emaSlow()[last];
            this.macd = series.macd()[last];
            this.signal = series.signal()[last];
            this.prevMacd = series.macd()[last - 1];
            this.prevSignal = series.signal()[last - 1];
        }
    }

    /** Warm-up points this security needs before the first simulated tick. */
    public static int requiredHistory(SecuritySpec spec) {
        int needed = spec.getAtrAverageRange() + 1;
        if (spec.isMacdEnabled()) {
            // one extra point so the previous tick's MACD/Signal are defined too
            needed = Math.max(needed, Indicators.macdWarmup(spec.getMacdFastLength(),
                spec.getMacdSlowLength(), spec.getMacdSignalLength()) + 1);
        }
        return needed;
    }

    public String getName() {
        return spec.getName();
    }

    public int getLotSize() {
        return spec.getLotSize();
    }

    // ------------------------- indicators -------------------------

    /** Steps ATR and MACD/Signal with the new price; history still ends at the previous tick. */
    public void updateIndicators(double currPrice) {
        validatePrice(currPrice);
        atr = Indicators.stepAtr(atr, history.lastPrice(), currPrice, spec.getAtrAverageRange());
        if (spec.isMacdEnabled()) {
            prevMacd = macd;
            prevSignal = signal;
            emaFast = Indicators.stepEma(emaFast, spec.getMacdFastLength(), spec.getMacdSmoothing(), currPrice);
            emaSlow = Indicators.stepEma(emaSlow, spec.getMacdSlowLength(), spec.getMacdSmoothing(), currPrice);
            macd = emaFast - emaSlow;
            signal = Indicators.stepEma(signal, spec.getMacdSignalLength(), spec.getMacdSmoothing(), macd);
        }
    }

    public void appendPrice(Instant time, double price) {
        history.append(time, price);
    }

    public PriceSeries history() {
        return history;
    }

    public double lastPrice() {
        return history.lastPrice();
    }

    // ------------------------- sizing -------------------------

    /**
     * Contracts per unit so that one ATR move costs {@code riskPercent} of the account. Never negative;
     * zero when ATR is not positive.
     */
    public void updateUnitSize(double riskPercentOfAccount, double notionalAccountSize) {
        double riskBudget = riskPercentOfAccount / 100.0 * notionalAccountSize;
        double perContract = atr * spec.getLotSize();
        if (!(perContract > 0) || !Double.isFinite(riskBudget)) {
            unitSize = 0;
            return;
        }
        unitSize = (int) Math.max(0, Math.floor(riskBudget / perContract));
    }

    /** Largest size whose margin stays under the per-trade cap; unlimited when the cap is off. */
    public int maxUnitSize(double price, double maxMarginPerTrade) {
        double perContract = spec.getMarginFactor() * price * spec.getLotSize();
        if (maxMarginPerTrade <= 0 || !(perContract > 0)) return Integer.MAX_VALUE;
        return (int) Math.max(0, Math.floor(maxMarginPerTrade / perContract));
    }

    public int tradableSize(double price, double maxMarginPerTrade) {
        return Math.min(unitSize, maxUnitSize(price, maxMarginPerTrade));
    }

    // ------------------------- entry triggers -------------------------

    /**
     * Price against the channel of the last {@code length} prior prices. With {@code longAtHigh}
     * longs trigger above the high and shorts below the low; otherwise the mapping flips.
     */
    public boolean breakout(Direction direction, int length, boolean longAtHigh, double price) {
        double prevHigh = history.highest(length);
        double prevLow = history.lowest(length);
        boolean above = price > prevHigh;
        boolean below = price < prevLow;
        boolean trendSide = direction.isLong() ? above : below;
        boolean counterSide = direction.isLong() ? below : above;
        return longAtHigh ? trendSide : counterSide;
    }

    /** MACD crossed Signal in the given direction between the previous and this tick. */
    public boolean macdSignalCross(Direction direction) {
        return direction.isLong()
            ? prevMacd < prevSignal && macd > signal
            : prevMacd > prevSignal && macd < signal;
    }

    public boolean macdZeroCross(Direction direction) {
        return direction.isLong()
            ? prevMacd < 0 && macd > 0
            : prevMacd > 0 && macd < 0;
    }

    /** MACD on the side of Signal that agrees with the direction. */
    public boolean macdOnSignalSide(Direction direction) {
        return direction.isLong() ? macd > signal : macd < signal;
    }

    /** Longs only while Signal is negative, shorts only while it is positive. */
    public boolean signalPolarityAllows(Direction direction) {
        return direction.isLong() ? signal < 0 : signal > 0;
    }

    // ------------------------- positions -------------------------

    public void snapshotEntryAtr(Direction direction) {
        if (direction.isLong()) longEntryAtr = atr;
        else shortEntryAtr = atr;
    }

    public double entryAtr(Direction direction) {
        return direction.isLong() ? longEntryAtr : shortEntryAtr;
    }

    public Unit open(Direction direction, String tradeId, double price, Instant time, int tickIndex, int size) {
        if (isLoaded()) {
            throw new SimulationException(SimulationException.ErrorCode.INVARIANT_VIOLATION,
                "Security " + getName() + " already holds " + getNumTotalPositions() + " units");
        }
        Unit unit = Unit.builder()
                        .tradeId(tradeId)
                        .securityName(getName())
                        .direction(direction)
                        .entryPrice(price)
                        .entryTime(time)
                        .entryTickIndex(tickIndex)
                        .atr(entryAtr(direction))
                        .unitSize(size)
                        .lotSize(spec.getLotSize())
                        .marginFactor(spec.getMarginFactor())
                        .stopLossFactor(spec.getStopLossFactor())
                        .build();
        positionsOf(direction).add(unit);
        return unit;
    }

    /**
     * Removes the unit at {@code index} and prices the round trip. Slippage worsens both fills;
     * the transaction cost rate applies to both slippage-adjusted notionals.
     */
    public ClosedUnit close(Direction direction, int index, double exitPrice) {
        Unit unit = positionsOf(direction).remove(index);
        int sign = direction.sign();
        double contracts = (double) unit.getUnitSize() * unit.getLotSize();
        double slip = spec.getSlippagePerContract();

        double gross = sign * (exitPrice - unit.getEntryPrice()) * contracts;
        double slippageCost = 2 * slip * contracts;
        double entryFill = unit.getEntryPrice() + sign * slip;
        double exitFill = exitPrice - sign * slip;
        double transactionCost = spec.getTransactionCostRate() * (entryFill + exitFill) * contracts;
        double net = gross - slippageCost - transactionCost;
        return new ClosedUnit(unit, exitPrice, gross, slippageCost, transactionCost, net);
    }

    /**
     * Re-centres stops ahead of a pyramided unit: each unit's stop moves from its original level by
     * {@code factor * unit ATR * rank} in the favourable direction, rank being the number of units added
     * after it, the incoming one included.
     */
    public void adjustStops(Direction direction, double adjustStopAtrFactor) {
        List<Unit> positions = positionsOf(direction);
        int n = positions.size();
        for (int i = 0; i < n; i++) {
            Unit u = positions.get(i);
            int rank = n - i;
            u.setStopPrice(u.getOriginalStopPrice() + direction.sign() * adjustStopAtrFactor * u.getAtr() * rank);
        }
    }

    public List<Unit> positions(Direction direction) {
        return Collections.unmodifiableList(positionsOf(direction));
    }

    public List<Unit> getLongPositions() {
        return positions(Direction.LONG);
    }

    public List<Unit> getShortPositions() {
        return positions(Direction.SHORT);
    }

    public Unit latestUnit(Direction direction) {
        List<Unit> positions = positionsOf(direction);
        return positions.get(positions.size() - 1);
    }

    public boolean isEntered(Direction direction) {
        return !positionsOf(direction).isEmpty();
    }

    public boolean isLoaded() {
        return getNumTotalPositions() >= spec.getMaxUnits();
    }

    public int getNumPositions(Direction direction) {
        return positionsOf(direction).size();
    }

    public int getNumLongPositions() {
        return longPositions.size();
    }

    public int getNumShortPositions() {
        return shortPositions.size();
    }

    public int getNumTotalPositions() {
        return longPositions.size() + shortPositions.size();
    }

    public double openMargin() {
        double sum = 0.0;
        for (Unit u : longPositions) sum += u.getMarginReq();
        for (Unit u : shortPositions) sum += u.getMarginReq();
        return sum;
    }

    /** e.g. "2L 0S" */
    public String getQuickSummary() {
        return getNumLongPositions() + "L " + getNumShortPositions() + "S";
    }

    private List<Unit> positionsOf(Direction direction) {
        return direction.isLong() ? longPositions : shortPositions;
    }

    private void validatePrice(double price) {
        if (!Double.isFinite(price) || price < 0) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_PRICE_DATA,
                "Malformed price " + price + " for security " + getName());
        }
    }
}
