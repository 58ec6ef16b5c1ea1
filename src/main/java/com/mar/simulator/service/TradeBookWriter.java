package com.mar.simulator.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mar.simulator.domain.model.SimulationResult;
import com.mar.simulator.domain.model.TradeRecord;
import com.mar.simulator.engine.SimulationException;

@Service
@Slf4j
@RequiredArgsConstructor
public class TradeBookWriter {

    static final String LEDGER_FILE = "trades.csv";
    static final String SUMMARY_FILE = "summary.json";

    private static final String CSV_HEADER = String.join(",",
        "tradeId", "security", "direction", "entryTime", "entryTickIndex", "entryPrice", "unitSize", "lotSize",
        "entryATR", "stopPrice", "marginReq", "notionalAccountSize", "equity", "marginTotal", "securityStatus",
        "exitTime", "exitTickIndex", "exitPrice", "exitType", "exitBreakoutPrice", "exitATR",
        "grossProfit", "slippageCost", "transactionCost", "netProfit") + "\n";

    private final ObjectMapper objectMapper;

    /** Writes the ledger as CSV and the summary as JSON into {@code dir}; returns the ledger path. */
    public Path write(SimulationResult result, Path dir) {
        try {
            Files.createDirectories(dir);
            Path ledger = dir.resolve(LEDGER_FILE);
            writeLedger(result.ledger(), ledger);
            Path summary = dir.resolve(SUMMARY_FILE);
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(summary.toFile(), result.summary());
            log.info("REPORT | wrote {} trades to {} and summary to {}", result.ledger().size(),
                ledger.toAbsolutePath(), summary.toAbsolutePath());
            return ledger;
        } catch (IOException e) {
            throw new SimulationException(SimulationException.ErrorCode.IO_FAILURE,
                "Failed to write report to " + dir.toAbsolutePath(), e);
        }
    }

    void writeLedger(List<TradeRecord> rows, Path path) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path)) {
            w.write(CSV_HEADER);
            for (TradeRecord r : rows) {
                w.write(String.join(",",
                    r.getTradeId(),
                    r.getSecurity(),
                    r.getDirection().label(),
                    String.valueOf(r.getEntryTime()),
                    String.valueOf(r.getEntryTickIndex()),
                    num(r.getEntryPrice()),
                    String.valueOf(r.getUnitSize()),
                    String.valueOf(r.getLotSize()),
                    num(r.getEntryAtr()),
                    num(r.getStopPrice()),
                    num(r.getMarginReq()),
                    num(r.getNotionalAccountSize()),
                    num(r.getEquity()),
                    num(r.getMarginTotal()),
                    r.getSecurityStatus(),
                    opt(r.getExitTime()),
                    opt(r.getExitTickIndex()),
                    num(r.getExitPrice()),
                    r.getExitType() == null ? "" : r.getExitType().label(),
                    num(r.getExitBreakoutPrice()),
                    num(r.getExitAtr()),
                    num(r.getGrossProfit()),
                    num(r.getSlippageCost()),
                    num(r.getTransactionCost()),
                    num(r.getNetProfit())));
                w.write('\n');
            }
        }
    }

    private static String num(Double v) {
        return v == null ? "" : String.format(Locale.ROOT, "%.6f", v);
    }

    private static String opt(Object v) {
        return v == null ? "" : v.toString();
    }
}
