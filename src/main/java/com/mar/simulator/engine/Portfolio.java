package com.mar.simulator.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import com.mar.simulator.config.AppProperties;
import com.mar.simulator.domain.model.Direction;
import com.mar.simulator.domain.model.EntryType;
import com.mar.simulator.domain.model.ExitReason;
import com.mar.simulator.domain.model.ExitType;
import com.mar.simulator.domain.model.ExtraUnitPolicy;
import com.mar.simulator.domain.model.PriceSeries;
import com.mar.simulator.domain.model.PriceTick;
import com.mar.simulator.domain.model.SecurityOverrides;
import com.mar.simulator.domain.model.SimulationResult;
import com.mar.simulator.domain.model.SimulationSummary;
import com.mar.simulator.domain.model.TradeRecord;
import com.mar.simulator.domain.model.Unit;
import com.mar.simulator.util.Indicators;

/**
 * Runs the tick loop over a set of securities and keeps the account-wide books.
 * <p>
 * Per tick, strictly in this order: indicators, unit sizes, stops, exits, entries (all longs, then all
 * shorts), then the tick's prices are appended to each history. Securities are visited in the order
 * they were added, so trade ids and ledger order are reproducible.
 * <p>
 * Not thread-safe. One instance per run.
 */
@Slf4j
public class Portfolio {

    private static final double MARGIN_TOLERANCE = 1e-6;

    private final AppProperties config;
    private final List<Security> securities = new ArrayList<>();
    @Getter private final TradeBook tradeBook = new TradeBook();

    @Getter private int numLongPositions;
    @Getter private int numShortPositions;
    @Getter private double equity;
    @Getter private double marginTotal;
    @Getter private double grossProfit;
    @Getter private double netProfit;
    @Getter private double notionalAccountSize;

    @Getter private double maxMargin;
    @Getter private Instant maxMarginTime;

    @Getter private int tickIndex;
    private Instant lastTime;

    public Portfolio(AppProperties config) {
        validate(config);
        this.config = config;
        this.notionalAccountSize = config.getSizing().getNotionalAccountSize();
        this.equity = notionalAccountSize;
    }

    // ------------------------- setup -------------------------

    /**
     * Adds a security, resolving its settings from the portfolio defaults and any overrides
     * registered under its name. The warm-up series initialises its indicators.
     */
    public Security addSecurity(String name, PriceSeries warmup) {
        if (tickIndex > 0) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_CONFIGURATION,
                "Cannot add security " + name + " after the simulation started");
        }
        Security sec = new Security(resolveSpec(name), warmup);
        sec.updateUnitSize(config.getSizing().getRiskPercentOfAccount(), notionalAccountSize);
        securities.add(sec);
        Instant warmupEnd = warmup.lastTime();
        if (lastTime == null || warmupEnd.isAfter(lastTime)) lastTime = warmupEnd;
        log.debug("Added security {} | lot={} maxUnits={} ATR={}", name, sec.getLotSize(),
            sec.getSpec().getMaxUnits(), sec.getAtr());
        return sec;
    }

    SecuritySpec resolveSpec(String name) {
        var sizing = config.getSizing();
        var macd = config.getMacd();
        SecurityOverrides o = config.getSecurities().getOrDefault(name, new SecurityOverrides());
        return SecuritySpec.builder()
                           .name(name)
                           .lotSize(o.getLotSize() != null ? o.getLotSize() : sizing.getLotSize())
                           .maxUnits(o.getMaxUnits() != null ? o.getMaxUnits() : sizing.getMaxUnits())
                           .atrAverageRange(o.getAtrAverageRange() != null ? o.getAtrAverageRange() : sizing.getAtrAverageRange())
                           .stopLossFactor(o.getStopLossFactor() != null ? o.getStopLossFactor() : config.getStops().getStopLossFactor())
                           .marginFactor(sizing.getMarginFactor())
                           .transactionCostRate(config.getCosts().getTransactionCostRate())
                           .slippagePerContract(config.getCosts().getSlippagePerContract())
                           .macdEnabled(macdEnabled())
                           .macdFastLength(macd.getFastLength())
                           .macdSlowLength(macd.getSlowLength())
                           .macdSignalLength(macd.getSignalLength())
                           .macdSmoothing(macd.getSmoothing())
                           .build();
    }

    /**
     * Warm-up length every security needs: the longest lookback of any active window or indicator, plus one.
     */
    public int minLengthOfInitialData() {
        int longest = Math.max(config.getSizing().getAtrAverageRange(),
            config.getSecurities().values().stream()
                  .map(SecurityOverrides::getAtrAverageRange)
                  .filter(v -> v != null)
                  .mapToInt(Integer::intValue)
                  .max().orElse(0));
        if (config.getEntry().getType() == EntryType.BREAKOUT) {
            longest = Math.max(longest, Math.max(config.getEntry().getLongBreakout(), config.getEntry().getShortBreakout()));
        }
        if (config.getExit().getType() == ExitType.BREAKOUT) {
            longest = Math.max(longest, Math.max(config.getExit().getLongBreakout(), config.getExit().getShortBreakout()));
        }
        if (macdEnabled()) {
            var m = config.getMacd();
            longest = Math.max(longest, Indicators.macdWarmup(m.getFastLength(), m.getSlowLength(), m.getSignalLength()));
        }
        return longest + 1;
    }

    public boolean macdEnabled() {
        return config.getEntry().getType().usesMacd()
            || config.getExit().getType() == ExitType.MACD_SIGNAL_CROSSOVER
            || config.getEntry().isMacdSignalCondition()
            || config.getEntry().isSignalPolarityCondition();
    }

    public List<Security> getSecurities() {
        return Collections.unmodifiableList(securities);
    }

    // ------------------------- simulation loop -------------------------

    /**
     * Runs every tick, force-closes what is left at the last prices and returns the finalised ledger.
     * The listener is best-effort: its failures are logged and never affect the run.
     */
    public SimulationResult run(List<PriceTick> ticks, ProgressListener listener) {
        if (securities.isEmpty()) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_CONFIGURATION,
                "Portfolio has no securities");
        }
        log.info("Simulation start | securities={} ticks={} entry={} exit={} extraUnits={} stops={}",
            securities.size(), ticks.size(), config.getEntry().getType(), config.getExit().getType(),
            config.getPyramiding().getAddExtraUnits(), config.getStops().isEnabled());

        int total = ticks.size();
        for (int i = 0; i < total; i++) {
            step(ticks.get(i));
            notifyProgress(listener, (i + 1) / (double) total);
        }
        exitAll(total > 0 ? ticks.get(total - 1).time() : lastTime);

        SimulationSummary summary = summarize();
        log.info("Simulation end | trades={} gross={} net={} maxMargin={} at {}",
            summary.getTrades(), String.format("%.2f", summary.getGrossProfit()),
            String.format("%.2f", summary.getNetProfit()), String.format("%.2f", maxMargin), maxMarginTime);
        return new SimulationResult(summary, tradeBook.rows());
    }

    public void step(PriceTick tick) {
        validateTick(tick);
        updateIndicators(tick);
        updateUnitSizes();
        checkStops(tick);
        checkExits(tick);
        checkEntries(tick);
        updateHistData(tick);
        verifyBooks();
        lastTime = tick.time();
        tickIndex++;
    }

    public void updateIndicators(PriceTick tick) {
        for (int s = 0; s < securities.size(); s++) {
            securities.get(s).updateIndicators(tick.price(s));
        }
    }

    public void updateUnitSizes() {
        double risk = config.getSizing().getRiskPercentOfAccount();
        for (Security sec : securities) sec.updateUnitSize(risk, notionalAccountSize);
    }

    public void updateHistData(PriceTick tick) {
        for (int s = 0; s < securities.size(); s++) {
            securities.get(s).appendPrice(tick.time(), tick.price(s));
        }
    }

    // ------------------------- stops -------------------------

    /** Closes every unit whose stop has been crossed, newest first within each security. */
    public int checkStops(PriceTick tick) {
        if (!config.getStops().isEnabled()) return 0;
        int stopped = 0;
        for (Direction d : Direction.values()) {
            for (int s = 0; s < securities.size(); s++) {
                Security sec = securities.get(s);
                double price = tick.price(s);
                List<Unit> positions = sec.positions(d);
                for (int i = positions.size() - 1; i >= 0; i--) {
                    if (positions.get(i).isStoppedAt(price)) {
                        closeUnit(sec, d, i, price, tick.time(), ExitReason.STOP_OUT, null);
                        stopped++;
                    }
                }
            }
        }
        return stopped;
    }

    // ------------------------- exits -------------------------

    public int checkExits(PriceTick tick) {
        var exit = config.getExit();
        int exits = 0;
        for (int s = 0; s < securities.size(); s++) {
            Security sec = securities.get(s);
            double price = tick.price(s);
            switch (exit.getType()) {
                case TIMED -> {
                    exits += exitTimed(sec, Direction.LONG, exit.getLongHorizon(), price, tick.time());
                    exits += exitTimed(sec, Direction.SHORT, exit.getShortHorizon(), price, tick.time());
                }
                case BREAKOUT -> {
                    if (sec.isEntered(Direction.LONG)) {
                        double prevLow = sec.history().lowest(exit.getLongBreakout());
                        if (price < prevLow) {
                            exits += exitAll(sec, Direction.LONG, price, tick.time(), ExitReason.BREAKOUT, prevLow);
                        }
                    }
                    if (sec.isEntered(Direction.SHORT)) {
                        double prevHigh = sec.history().highest(exit.getShortBreakout());
                        if (price > prevHigh) {
                            exits += exitAll(sec, Direction.SHORT, price, tick.time(), ExitReason.BREAKOUT, prevHigh);
                        }
                    }
                }
                case MACD_SIGNAL_CROSSOVER -> {
                    // longs leave when MACD crosses under Signal, shorts when it crosses over
                    if (sec.isEntered(Direction.LONG) && sec.macdSignalCross(Direction.SHORT)) {
                        exits += exitAll(sec, Direction.LONG, price, tick.time(), ExitReason.MACD_CROSSOVER, null);
                    }
                    if (sec.isEntered(Direction.SHORT) && sec.macdSignalCross(Direction.LONG)) {
                        exits += exitAll(sec, Direction.SHORT, price, tick.time(), ExitReason.MACD_CROSSOVER, null);
                    }
                }
            }
        }
        return exits;
    }

    private int exitTimed(Security sec, Direction d, int horizon, double price, Instant time) {
        int exits = 0;
        // oldest first, so only the front can be due
        while (sec.isEntered(d) && tickIndex - sec.positions(d).get(0).getEntryTickIndex() >= horizon) {
            closeUnit(sec, d, 0, price, time, ExitReason.TIMED, null);
            exits++;
        }
        return exits;
    }

    private int exitAll(Security sec, Direction d, double price, Instant time, ExitReason reason, Double threshold) {
        int exits = 0;
        while (sec.isEntered(d)) {
            closeUnit(sec, d, sec.getNumPositions(d) - 1, price, time, reason, threshold);
            exits++;
        }
        return exits;
    }

    /** Closes everything still open at each security's last price. */
    public int exitAll(Instant time) {
        int exits = 0;
        for (Security sec : securities) {
            for (Direction d : Direction.values()) {
                exits += exitAll(sec, d, sec.lastPrice(), time, ExitReason.EXIT_ALL, null);
            }
        }
        verifyBooks();
        return exits;
    }

    // ------------------------- entries -------------------------

    public int checkEntries(PriceTick tick) {
        return addUnits(tick, Direction.LONG) + addUnits(tick, Direction.SHORT);
    }

    private int addUnits(PriceTick tick, Direction d) {
        int added = 0;
        for (int s = 0; s < securities.size(); s++) {
            if (isLoaded(d)) break;
            Security sec = securities.get(s);
            if (sec.isLoaded()) continue;
            double price = tick.price(s);
            if (!sec.isEntered(d)) {
                added += tryNewUnit(sec, d, price, tick.time()) ? 1 : 0;
                continue;
            }
            ExtraUnitPolicy policy = config.getPyramiding().getAddExtraUnits();
            switch (policy) {
                case AS_NEW_UNIT -> added += tryNewUnit(sec, d, price, tick.time()) ? 1 : 0;
                case USING_ATR -> added += tryExtraUnit(sec, d, price, tick.time()) ? 1 : 0;
                case NO -> { }
            }
        }
        return added;
    }

    public boolean isLoaded(Direction d) {
        int open = d.isLong() ? numLongPositions : numShortPositions;
        return open >= config.getSizing().getMaxPositionLimitEachWay();
    }

    boolean entryTriggered(Security sec, Direction d, double price) {
        var entry = config.getEntry();
        boolean base = switch (entry.getType()) {
            case BREAKOUT -> sec.breakout(d, d.isLong() ? entry.getLongBreakout() : entry.getShortBreakout(),
                entry.isLongAtHigh(), price);
            case MACD_SIGNAL_CROSSOVER -> sec.macdSignalCross(d);
            case MACD_ZERO_CROSSOVER -> sec.macdZeroCross(d);
        };
        if (!base) return false;
        if (entry.isMacdSignalCondition() && !sec.macdOnSignalSide(d)) return false;
        return !entry.isSignalPolarityCondition() || sec.signalPolarityAllows(d);
    }

    private boolean tryNewUnit(Security sec, Direction d, double price, Instant time) {
        if (!entryTriggered(sec, d, price)) return false;
        sec.updateUnitSize(config.getSizing().getRiskPercentOfAccount(), notionalAccountSize);
        sec.snapshotEntryAtr(d);
        return openUnit(sec, d, price, time);
    }

    /** Pyramids once price has run {@code extraUnitAtrFactor} entry ATRs past the latest unit. */
    private boolean tryExtraUnit(Security sec, Direction d, double price, Instant time) {
        Unit latest = sec.latestUnit(d);
        double moved = d.sign() * (price - latest.getEntryPrice());
        if (moved < config.getPyramiding().getExtraUnitAtrFactor() * sec.entryAtr(d)) return false;
        if (sec.tradableSize(price, config.getSizing().getMaxMarginPerTrade()) <= 0) return false;
        if (config.getStops().isAdjustOnMoreUnits()) {
            sec.adjustStops(d, config.getStops().getAdjustStopAtrFactor());
        }
        return openUnit(sec, d, price, time);
    }

    private boolean openUnit(Security sec, Direction d, double price, Instant time) {
        int size = sec.tradableSize(price, config.getSizing().getMaxMarginPerTrade());
        if (size <= 0) {
            log.debug("Skip {} entry on {} at {}: tradable size is 0 (unitSize={} ATR={})",
                d.label(), sec.getName(), price, sec.getUnitSize(), sec.getAtr());
            return false;
        }
        Unit unit = sec.open(d, tradeId(sec, d, time), price, time, tickIndex, size);
        if (d.isLong()) numLongPositions++;
        else numShortPositions++;
        marginTotal += unit.getMarginReq();
        if (marginTotal > maxMargin) {
            maxMargin = marginTotal;
            maxMarginTime = time;
        }
        tradeBook.open(TradeRecord.builder()
                                  .tradeId(unit.getTradeId())
                                  .security(sec.getName())
                                  .direction(d)
                                  .entryTime(time)
                                  .entryTickIndex(tickIndex)
                                  .entryPrice(price)
                                  .unitSize(size)
                                  .lotSize(unit.getLotSize())
                                  .entryAtr(unit.getAtr())
                                  .stopPrice(unit.getStopPrice())
                                  .marginReq(unit.getMarginReq())
                                  .notionalAccountSize(notionalAccountSize)
                                  .equity(equity)
                                  .marginTotal(marginTotal)
                                  .securityStatus(sec.getQuickSummary())
                                  .build());
        log.debug("Enter {} {} x{} @ {} | stop={} status={}", d.label(), sec.getName(), size, price,
            unit.getStopPrice(), sec.getQuickSummary());
        return true;
    }

    /** Deterministic from the entry time, the security and the side. */
    static String tradeId(Security sec, Direction d, Instant time) {
        return sec.getName() + "-" + (d.isLong() ? "L" : "S") + "-" + time;
    }

    // ------------------------- closing & books -------------------------

    private void closeUnit(Security sec, Direction d, int index, double price, Instant time,
                           ExitReason reason, Double threshold) {
        ClosedUnit closed = sec.close(d, index, price);
        if (d.isLong()) numLongPositions--;
        else numShortPositions--;
        marginTotal -= closed.unit().getMarginReq();
        grossProfit += closed.grossProfit();
        netProfit += closed.netProfit();
        equity += closed.netProfit();
        if (config.getSizing().isCompoundAccountSize()) {
            notionalAccountSize += closed.netProfit();
        }
        tradeBook.close(closed, time, tickIndex, reason, threshold, sec.getAtr());
        log.debug("{} {} {} x{} @ {} | net={} status={}", reason, d.label(), sec.getName(),
            closed.unit().getUnitSize(), price, String.format("%.2f", closed.netProfit()), sec.getQuickSummary());
    }

    /**
     * Cross-checks the portfolio counters against the securities. A mismatch means the books are
     * corrupt, so the run is aborted.
     */
    public void verifyBooks() {
        int longs = 0, shorts = 0;
        double margin = 0.0;
        for (Security sec : securities) {
            longs += sec.getNumLongPositions();
            shorts += sec.getNumShortPositions();
            margin += sec.openMargin();
            if (sec.getNumTotalPositions() > sec.getSpec().getMaxUnits()) {
                throw new SimulationException(SimulationException.ErrorCode.INVARIANT_VIOLATION,
                    "Security " + sec.getName() + " holds " + sec.getNumTotalPositions() + " units, max "
                        + sec.getSpec().getMaxUnits());
            }
        }
        if (longs != numLongPositions || shorts != numShortPositions) {
            throw new SimulationException(SimulationException.ErrorCode.INVARIANT_VIOLATION,
                String.format("Position counters diverged at tick %d: portfolio %dL/%dS, securities %dL/%dS",
                    tickIndex, numLongPositions, numShortPositions, longs, shorts));
        }
        if (Math.abs(margin - marginTotal) > MARGIN_TOLERANCE * Math.max(1.0, Math.abs(margin))) {
            throw new SimulationException(SimulationException.ErrorCode.INVARIANT_VIOLATION,
                String.format("Margin total diverged at tick %d: books %.6f, open units %.6f",
                    tickIndex, marginTotal, margin));
        }
    }

    public SimulationSummary summarize() {
        return tradeBook.summarize()
                        .ticks(tickIndex)
                        .maxMargin(maxMargin)
                        .maxMarginTime(maxMarginTime)
                        .finalEquity(equity)
                        .finalNotionalAccountSize(notionalAccountSize)
                        .build();
    }

    // ------------------------- validation -------------------------

    private void validateTick(PriceTick tick) {
        if (tick == null || tick.time() == null || tick.prices() == null) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_PRICE_DATA,
                "Malformed tick at index " + tickIndex);
        }
        if (tick.width() != securities.size()) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_PRICE_DATA,
                "Tick " + tick.time() + " has " + tick.width() + " prices for " + securities.size() + " securities");
        }
        if (lastTime != null && !tick.time().isAfter(lastTime)) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_PRICE_DATA,
                "Tick " + tick.time() + " is not after " + lastTime);
        }
    }

    private static void notifyProgress(ProgressListener listener, double fraction) {
        if (listener == null) return;
        try {
            listener.onProgress(fraction);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}: {}", String.format("%.4f", fraction), e.getMessage());
        }
    }

    /** Rejects configurations the simulation cannot run with. */
    public static void validate(AppProperties config) {
        if (config == null) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_CONFIGURATION, "Missing configuration");
        }
        require(config.getEntry() != null && config.getEntry().getType() != null, "entry type is required");
        require(config.getExit() != null && config.getExit().getType() != null, "exit type is required");
        require(config.getPyramiding() != null && config.getPyramiding().getAddExtraUnits() != null,
            "additional-unit policy is required");
        require(config.getStops() != null && config.getSizing() != null && config.getCosts() != null
            && config.getMacd() != null && config.getSecurities() != null, "incomplete configuration");
        var sizing = config.getSizing();
        require(sizing.getAtrAverageRange() >= 1, "ATR average range must be >= 1");
        require(sizing.getLotSize() >= 1, "lot size must be >= 1");
        require(sizing.getMaxUnits() >= 1, "max units must be >= 1");
        require(sizing.getMaxPositionLimitEachWay() >= 1, "position limit each way must be >= 1");
        require(sizing.getNotionalAccountSize() > 0, "notional account size must be positive");
        require(sizing.getRiskPercentOfAccount() >= 0, "risk percent must not be negative");
        require(sizing.getMarginFactor() >= 0, "margin factor must not be negative");
        require(config.getEntry().getLongBreakout() >= 1 && config.getEntry().getShortBreakout() >= 1,
            "entry breakout lengths must be >= 1");
        require(config.getExit().getLongBreakout() >= 1 && config.getExit().getShortBreakout() >= 1,
            "exit breakout lengths must be >= 1");
        require(config.getExit().getLongHorizon() >= 1 && config.getExit().getShortHorizon() >= 1,
            "exit horizons must be >= 1");
        var macd = config.getMacd();
        require(macd.getFastLength() >= 1 && macd.getSlowLength() >= 1 && macd.getSignalLength() >= 1,
            "MACD lengths must be >= 1");
        require(macd.getSmoothing() >= 0, "MACD smoothing must not be negative");
        require(config.getCosts().getSlippagePerContract() >= 0 && config.getCosts().getTransactionCostRate() >= 0,
            "costs must not be negative");
        config.getSecurities().forEach((name, o) -> {
            require(o != null, "empty overrides for " + name);
            require(o.getLotSize() == null || o.getLotSize() >= 1, "lot size of " + name + " must be >= 1");
            require(o.getMaxUnits() == null || o.getMaxUnits() >= 1, "max units of " + name + " must be >= 1");
            require(o.getAtrAverageRange() == null || o.getAtrAverageRange() >= 1,
                "ATR average range of " + name + " must be >= 1");
        });
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_CONFIGURATION, message);
        }
    }
}
