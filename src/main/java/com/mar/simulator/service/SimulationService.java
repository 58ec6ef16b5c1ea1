package com.mar.simulator.service;

import static java.util.Map.entry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mar.simulator.config.AppProperties;
import com.mar.simulator.domain.model.PriceTable;
import com.mar.simulator.domain.model.PriceTick;
import com.mar.simulator.domain.model.SimulationResult;
import com.mar.simulator.domain.model.SimulationSummary;
import com.mar.simulator.engine.Portfolio;
import com.mar.simulator.engine.ProgressListener;
import com.mar.simulator.engine.SimulationException;
import com.mar.simulator.infrastructure.messaging.SseHub;

/**
 * Runs one simulation end to end: load prices, warm up the portfolio, simulate, report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationService {

    // progress events are sent at most this often, as a fraction of the run
    private static final double PROGRESS_STEP = 0.01;

    private final AppProperties props;
    private final PriceDataService priceDataService;
    private final TradeBookWriter tradeBookWriter;
    private final SseHub sseHub;
    private final ObjectMapper objectMapper;

    /**
     * Deep copy of the application defaults with {@code overrides} merged over it. The defaults are never
     * mutated. Unknown enum labels fail here.
     */
    public AppProperties resolveConfig(JsonNode overrides) {
        try {
            AppProperties copy = objectMapper.convertValue(props, AppProperties.class);
            if (overrides != null && !overrides.isNull()) {
                // sections merge field by field; lists such as data.files are replaced whole
                ObjectMapper merging = objectMapper.copy();
                merging.setDefaultMergeable(Boolean.TRUE);
                merging.configOverride(List.class).setMergeable(Boolean.FALSE);
                merging.readerForUpdating(copy).readValue(overrides);
            }
            return copy;
        } catch (Exception e) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_CONFIGURATION,
                "Invalid configuration: " + e.getMessage(), e);
        }
    }

    public SimulationResult simulate(AppProperties cfg, ProgressListener listener) {
        List<Path> files = cfg.getData().getFiles().stream().map(Path::of).toList();
        Portfolio portfolio = new Portfolio(cfg);
        logJ("CONFIG", Map.ofEntries(
            entry("entry", cfg.getEntry()),
            entry("exit", cfg.getExit()),
            entry("pyramiding", cfg.getPyramiding()),
            entry("stops", cfg.getStops()),
            entry("sizing", cfg.getSizing()),
            entry("costs", cfg.getCosts()),
            entry("macd", cfg.getMacd()),
            entry("files", files.stream().map(Path::toString).toList()),
            entry("warmup", portfolio.minLengthOfInitialData())
        ));

        PriceTable table = priceDataService.load(files, cfg.getData().getContinuousIntervalSeconds());
        List<PriceTick> ticks = priceDataService.prepare(portfolio, table);
        SimulationResult result = portfolio.run(ticks, listener);

        logJ("RESULTS", summaryFields(result.summary()));
        if (cfg.getOutput().isEnabled()) {
            tradeBookWriter.write(result, Path.of(cfg.getOutput().getDirectory()));
        }
        return result;
    }

    /**
     * Background variant: progress, the summary and any failure go to the job's event stream, which is
     * closed at the end either way.
     */
    public void runForUI(AppProperties cfg, String jobId) {
        try {
            sseHub.emit(jobId, SseHub.PROGRESS, Map.of("phase", "start", "fraction", 0.0));
            SimulationResult result = simulate(cfg, throttled(jobId));
            sseHub.emit(jobId, SseHub.RESULT, result.summary());
        } catch (SimulationException e) {
            log.error("Simulation {} failed [{}]: {}", jobId, e.getErrorCode(), e.getMessage());
            sseHub.emit(jobId, SseHub.ERROR, Map.of("code", e.getErrorCode().name(), "message", e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Simulation {} failed unexpectedly", jobId, e);
            sseHub.emit(jobId, SseHub.ERROR, Map.of("code", "INTERNAL", "message", String.valueOf(e.getMessage())));
        } finally {
            sseHub.complete(jobId);
        }
    }

    private ProgressListener throttled(String jobId) {
        return new ProgressListener() {
            private double lastSent;

            @Override
            public void onProgress(double fraction) {
                if (fraction < 1.0 && fraction - lastSent < PROGRESS_STEP) return;
                lastSent = fraction;
                sseHub.emit(jobId, SseHub.PROGRESS, Map.of("phase", "run", "fraction", r3(fraction)));
            }
        };
    }

    static Map<String, Object> summaryFields(SimulationSummary s) {
        return Map.ofEntries(
            entry("ticks", s.getTicks()),
            entry("trades", s.getTrades()),
            entry("winners", s.getWinningTrades()),
            entry("losers", s.getLosingTrades()),
            entry("grossProfit", r2(s.getGrossProfit())),
            entry("netProfit", r2(s.getNetProfit())),
            entry("slippageCost", r2(s.getSlippageCost())),
            entry("transactionCost", r2(s.getTransactionCost())),
            entry("maxMargin", r2(s.getMaxMargin())),
            entry("maxMarginTime", String.valueOf(s.getMaxMarginTime())),
            entry("finalEquity", r2(s.getFinalEquity()))
        );
    }

    private void logJ(String tag, Map<String, Object> fields) {
        try {
            log.info("{} {}", tag, objectMapper.writeValueAsString(fields));
        } catch (Exception e) {
            log.info("{} {}", tag, fields);
        }
    }

    private static double r2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static double r3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
