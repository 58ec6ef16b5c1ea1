package com.mar.simulator.service;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import com.mar.simulator.domain.model.PriceTable;
import com.mar.simulator.domain.model.PriceTick;
import com.mar.simulator.engine.Fixtures;
import com.mar.simulator.engine.Portfolio;
import com.mar.simulator.engine.SimulationException;

class PriceDataServiceTest {

    private final PriceDataService service = new PriceDataService();

    @TempDir
    Path dir;

    private Path csv(String name, String... lines) throws IOException {
        Path f = dir.resolve(name);
        Files.writeString(f, String.join("\n", lines) + "\n");
        return f;
    }

    /** ISO rows one second apart starting at 09:00:00, with the given seconds skipped. */
    private Path isoSeries(String name, int n, double base, int... skip) throws IOException {
        StringBuilder sb = new StringBuilder("time,price\n");
        outer:
        for (int i = 0; i < n; i++) {
            for (int s : skip) if (s == i) continue outer;
            sb.append(Instant.parse("2024-03-01T09:00:00Z").plusSeconds(i)).append(',').append(base + i).append('\n');
        }
        Path f = dir.resolve(name);
        Files.writeString(f, sb.toString());
        return f;
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("blotter timestamps with an embedded comma and negative amounts are accepted")
        void blotterFormat() throws IOException {
            Path f = csv("es.csv",
                "time,price",
                "\"01/03/2024, 09:15:01 AM\",-101.5",
                "\"01/03/2024, 09:15:00 AM\",100.25",
                "\"01/03/2024, 01:00:00 PM\",99");
            var rows = service.readSeries(f);
            assertEquals(3, rows.size());
            assertEquals(Instant.parse("2024-03-01T09:15:00Z"), rows.firstKey());
            assertEquals(101.5, rows.get(Instant.parse("2024-03-01T09:15:01Z")), 0.0);
            assertEquals(Instant.parse("2024-03-01T13:00:00Z"), rows.lastKey());
        }

        @Test
        void localIsoTimes() {
            assertEquals(Instant.parse("2024-03-01T09:15:00Z"), PriceDataService.parseTime("2024-03-01T09:15:00"));
            assertNull(PriceDataService.parseTime("yesterday"));
        }

        @Test
        @DisplayName("bad rows name the file and line")
        void malformed() throws IOException {
            Path f = csv("bad.csv", "time,price", "2024-03-01T09:00:00Z,1", "2024-03-01T09:00:01Z,abc");
            var e = assertThrows(SimulationException.class, () -> service.readSeries(f));
            assertEquals(SimulationException.ErrorCode.INVALID_PRICE_DATA, e.getErrorCode());
            assertTrue(e.getMessage().contains("bad.csv:3"));

            Path dup = csv("dup.csv", "time,price", "2024-03-01T09:00:00Z,1", "2024-03-01T09:00:00Z,2");
            assertThrows(SimulationException.class, () -> service.readSeries(dup));
        }

        @Test
        void missingFile() {
            var e = assertThrows(SimulationException.class, () -> service.readSeries(dir.resolve("nope.csv")));
            assertEquals(SimulationException.ErrorCode.IO_FAILURE, e.getErrorCode());
        }

        @Test
        @DisplayName("a byte-order mark before the header is ignored")
        void byteOrderMark() throws IOException {
            Path f = csv("bom.csv", "\uFEFFtime,price", "2024-03-01T09:00:00Z,1", "2024-03-01T09:00:01Z,2");
            var rows = service.readSeries(f);
            assertEquals(2, rows.size());
            assertEquals(1.0, rows.firstEntry().getValue(), 0.0);
        }

        @Test
        @DisplayName("blotter exports are read from their tradeTime and netAmount columns")
        void blotterColumns() throws IOException {
            Path f = csv("blotter.csv",
                "strategyName,tradeTime,qty,netAmount",
                "breakout,\"01/03/2024, 09:15:00 AM\",3,-100.5",
                "\"mean, reverting\",\"01/03/2024, 09:15:01 AM\",1,101");
            var rows = service.readSeries(f);
            assertEquals(2, rows.size());
            assertEquals(100.5, rows.get(Instant.parse("2024-03-01T09:15:00Z")), 0.0);
            assertEquals(101.0, rows.get(Instant.parse("2024-03-01T09:15:01Z")), 0.0);

            Path noPrice = csv("noprice.csv", "strategyName,tradeTime,qty", "a,2024-03-01T09:00:00Z,1");
            var e = assertThrows(SimulationException.class, () -> service.readSeries(noPrice));
            assertEquals(SimulationException.ErrorCode.INVALID_PRICE_DATA, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("alignment")
    class Alignment {

        @Test
        @DisplayName("series are inner-joined on time and named by file stem")
        void innerJoin() throws IOException {
            Path a = isoSeries("alpha.csv", 10, 100, 3);
            Path b = isoSeries("beta.csv", 10, 50, 7);
            PriceTable t = service.load(List.of(a, b), 0);
            assertEquals(List.of("alpha", "beta"), t.names());
            assertEquals(8, t.size());
            assertEquals(102.0, t.rows().get(2)[0], 0.0);
            assertEquals(54.0, t.rows().get(3)[1], 0.0);
        }

        @Test
        @DisplayName("only the longest run of one-second steps is kept")
        void continuousRun() throws IOException {
            // gaps at 3 and 7 leave runs 0-2, 4-6 and 8-19
            Path a = isoSeries("a.csv", 20, 100, 3, 7);
            PriceTable t = service.load(List.of(a), 1);
            assertEquals(12, t.size());
            assertEquals(Instant.parse("2024-03-01T09:00:08Z"), t.times().get(0));
        }

        @Test
        void duplicateStemsFallBackToIndexNames() {
            assertEquals(List.of("sec_0", "sec_1"),
                PriceDataService.securityNames(List.of(Path.of("x/p.csv"), Path.of("y/p.csv"))));
        }

        @Test
        void noFiles() {
            var e = assertThrows(SimulationException.class, () -> service.load(List.of(), 1));
            assertEquals(SimulationException.ErrorCode.INVALID_CONFIGURATION, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("warm-up split")
    class Prepare {

        @Test
        @DisplayName("the first warm-up rows seed the securities and the rest are ticks")
        void split() throws IOException {
            Path a = isoSeries("a.csv", 30, 100);
            Path b = isoSeries("b.csv", 30, 200);
            Portfolio pf = new Portfolio(Fixtures.config());
            List<PriceTick> ticks = service.prepare(pf, service.load(List.of(a, b), 1));

            assertEquals(2, pf.getSecurities().size());
            assertEquals(21, pf.getSecurities().get(0).history().size());
            assertEquals(9, ticks.size());
            assertEquals(121.0, ticks.get(0).price(0), 0.0);
            assertEquals(221.0, ticks.get(0).price(1), 0.0);
        }

        @Test
        void tooShort() throws IOException {
            Path a = isoSeries("a.csv", 15, 100);
            Portfolio pf = new Portfolio(Fixtures.config());
            PriceTable t = service.load(List.of(a), 1);
            var e = assertThrows(SimulationException.class, () -> service.prepare(pf, t));
            assertEquals(SimulationException.ErrorCode.INSUFFICIENT_HISTORY, e.getErrorCode());
        }
    }
}
