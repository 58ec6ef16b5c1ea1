package com.mar.simulator.service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mar.simulator.domain.model.SimulationResult;
import com.mar.simulator.engine.Fixtures;
import com.mar.simulator.engine.Portfolio;
import com.mar.simulator.engine.ProgressListener;

class TradeBookWriterTest {

    private final ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path dir;

    @Test
    void writesLedgerAndSummary() throws Exception {
        Portfolio pf = new Portfolio(Fixtures.config());
        pf.addSecurity("ES", Fixtures.zigzag(21));
        SimulationResult result = pf.run(Fixtures.ticks(21, 100.0, 97.0), ProgressListener.NONE);

        Path out = dir.resolve("report");
        Path ledger = new TradeBookWriter(om).write(result, out);

        List<String> lines = Files.readAllLines(ledger);
        assertEquals(1 + result.ledger().size(), lines.size());
        assertTrue(lines.get(0).startsWith("tradeId,security,direction,entryTime"));
        String first = lines.get(1);
        assertTrue(first.startsWith("ES-L-"));
        assertTrue(first.contains(",Long,"));
        assertTrue(first.contains(",Stop out,"));
        assertTrue(first.contains("97.000000"));

        JsonNode summary = om.readTree(out.resolve(TradeBookWriter.SUMMARY_FILE).toFile());
        assertEquals(result.summary().getTrades(), summary.get("trades").asInt());
        assertEquals(2, summary.get("ticks").asInt());
    }
}
