package com.mar.simulator.service;

import lombok.extern.slf4j.Slf4j;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Service;
import com.mar.simulator.domain.model.PriceTable;
import com.mar.simulator.domain.model.PriceTick;
import com.mar.simulator.engine.Portfolio;
import com.mar.simulator.engine.SimulationException;

/**
 * Loads per-security price files and turns them into a warm-up plus a tick stream for a {@link Portfolio}.
 */
@Service
@Slf4j
public class PriceDataService {

    // trade-blotter export format, e.g. "03/01/2024, 09:15:01 AM"
    private static final DateTimeFormatter BLOTTER_TIME =
        DateTimeFormatter.ofPattern("dd/MM/yyyy, hh:mm:ss a", Locale.ENGLISH);

    private static final String BOM = "\uFEFF";

    /**
     * Reads every file, inner-joins them on timestamp and, when {@code intervalSeconds > 0}, keeps only the
     * longest run of rows spaced exactly that far apart.
     */
    public PriceTable load(List<Path> files, long intervalSeconds) {
        if (files == null || files.isEmpty()) {
            throw new SimulationException(SimulationException.ErrorCode.INVALID_CONFIGURATION, "No price files configured");
        }
        List<String> names = securityNames(files);
        List<TreeMap<Instant, Double>> columns = new ArrayList<>(files.size());
        for (Path f : files) columns.add(readSeries(f));

        PriceTable joined = innerJoin(names, columns);
        log.info("Loaded {} securities | joined rows={}", names.size(), joined.size());
        if (intervalSeconds <= 0) return joined;

        PriceTable run = largestContinuousRun(joined, intervalSeconds);
        log.info("Continuous run at {}s spacing | rows={} from {} to {}", intervalSeconds, run.size(),
            run.size() > 0 ? run.times().get(0) : null, run.size() > 0 ? run.times().get(run.size() - 1) : null);
        return run;
    }

    /**
     * Registers every column of {@code table} with the portfolio, using the first
     * {@link Portfolio#minLengthOfInitialData()} rows as warm-up, and returns the rows left to simulate.
     */
    public List<PriceTick> prepare(Portfolio portfolio, PriceTable table) {
        int warmup = portfolio.minLengthOfInitialData();
        if (table.size() < warmup) {
            throw new SimulationException(SimulationException.ErrorCode.INSUFFICIENT_HISTORY,
                "Need at least " + warmup + " aligned rows for warm-up, got " + table.size());
        }
        for (int s = 0; s < table.width(); s++) {
            portfolio.addSecurity(table.names().get(s), table.series(s, 0, warmup));
        }
        List<PriceTick> ticks = table.ticks(warmup);
        log.info("Warm-up rows={} | ticks to simulate={}", warmup, ticks.size());
        return ticks;
    }

    /**
     * Reads a price file into a time-ordered map. Prices are taken as absolute values.
     *
     * Plain files are {@code time,price}, with an optional header. A header may instead name wider blotter
     * exports, where {@code tradeTime} and {@code netAmount} are picked out and other columns are ignored.
     */
    TreeMap<Instant, Double> readSeries(Path file) {
        TreeMap<Instant, Double> out = new TreeMap<>();
        int lineNo = 0;
        Columns columns = Columns.PLAIN;
        try (BufferedReader r = Files.newBufferedReader(file)) {
            String line;
            while ((line = r.readLine()) != null) {
                lineNo++;
                if (lineNo == 1 && line.startsWith(BOM)) line = line.substring(1);
                line = line.trim();
                if (line.isEmpty()) continue;
                if (lineNo == 1 && line.matches("\"?\\p{Alpha}.*")) {
                    columns = Columns.fromHeader(file, line);
                    continue;
                }

                String timeText, priceText;
                if (columns == Columns.PLAIN) {
                    // the time column may itself contain a comma, so split on the last one
                    int cut = line.lastIndexOf(',');
                    if (cut < 0) throw malformed(file, lineNo, "expected time,price");
                    timeText = line.substring(0, cut);
                    priceText = line.substring(cut + 1);
                } else {
                    List<String> cells = splitQuoted(line);
                    if (cells.size() <= Math.max(columns.time(), columns.price())) {
                        throw malformed(file, lineNo, "expected " + columns.width() + " columns");
                    }
                    timeText = cells.get(columns.time());
                    priceText = cells.get(columns.price());
                }

                Instant time = parseTime(unquote(timeText));
                if (time == null) throw malformed(file, lineNo, "unreadable timestamp");
                double price;
                try {
                    price = Math.abs(Double.parseDouble(unquote(priceText)));
                } catch (NumberFormatException e) {
                    throw malformed(file, lineNo, "unreadable price");
                }
                if (!Double.isFinite(price)) throw malformed(file, lineNo, "non-finite price");
                if (out.putIfAbsent(time, price) != null) throw malformed(file, lineNo, "duplicate timestamp " + time);
            }
        } catch (IOException e) {
            throw new SimulationException(SimulationException.ErrorCode.IO_FAILURE, "Cannot read " + file, e);
        }
        log.debug("Read {} rows from {}", out.size(), file);
        return out;
    }

    /** Positions of the time and price cells; {@link #PLAIN} splits on the last comma instead. */
    record Columns(int time, int price, int width) {

        static final Columns PLAIN = new Columns(0, 1, 2);

        static Columns fromHeader(Path file, String header) {
            List<String> names = splitQuoted(header);
            if (names.size() <= 2) return PLAIN;
            int time = -1, price = -1;
            for (int i = 0; i < names.size(); i++) {
                String n = unquote(names.get(i)).toLowerCase(Locale.ROOT);
                if (time < 0 && (n.equals("time") || n.equals("tradetime"))) time = i;
                if (price < 0 && (n.equals("price") || n.equals("netamount"))) price = i;
            }
            if (time < 0 || price < 0) throw malformed(file, 1, "header names no time or price column");
            return new Columns(time, price, names.size());
        }
    }

    /** Splits on commas outside double quotes. */
    static List<String> splitQuoted(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') quoted = !quoted;
            if (c == ',' && !quoted) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }

    static Instant parseTime(String s) {
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(s, BLOTTER_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static PriceTable innerJoin(List<String> names, List<TreeMap<Instant, Double>> columns) {
        List<Instant> times = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        for (Map.Entry<Instant, Double> e : columns.get(0).entrySet()) {
            double[] row = new double[columns.size()];
            row[0] = e.getValue();
            boolean everywhere = true;
            for (int c = 1; c < columns.size() && everywhere; c++) {
                Double v = columns.get(c).get(e.getKey());
                if (v == null) everywhere = false;
                else row[c] = v;
            }
            if (everywhere) {
                times.add(e.getKey());
                rows.add(row);
            }
        }
        return new PriceTable(List.copyOf(names), times, rows);
    }

    /** Longest block of consecutive rows whose timestamps step by exactly {@code intervalSeconds}. Earliest wins ties. */
    static PriceTable largestContinuousRun(PriceTable table, long intervalSeconds) {
        int n = table.size();
        if (n == 0) return table;
        int bestStart = 0, bestLen = 1, start = 0;
        for (int i = 1; i < n; i++) {
            long gap = table.times().get(i).getEpochSecond() - table.times().get(i - 1).getEpochSecond();
            if (gap != intervalSeconds) start = i;
            int len = i - start + 1;
            if (len > bestLen) {
                bestLen = len;
                bestStart = start;
            }
        }
        return new PriceTable(table.names(),
            new ArrayList<>(table.times().subList(bestStart, bestStart + bestLen)),
            new ArrayList<>(table.rows().subList(bestStart, bestStart + bestLen)));
    }

    /** File stems, or {@code sec_<i>} when two files share a stem. */
    static List<String> securityNames(List<Path> files) {
        List<String> stems = new ArrayList<>(files.size());
        Set<String> seen = new HashSet<>();
        boolean clash = false;
        for (Path f : files) {
            String stem = f.getFileName().toString();
            int dot = stem.lastIndexOf('.');
            if (dot > 0) stem = stem.substring(0, dot);
            clash |= !seen.add(stem);
            stems.add(stem);
        }
        if (!clash) return stems;
        List<String> generic = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) generic.add("sec_" + i);
        return generic;
    }

    private static String unquote(String s) {
        s = s.trim();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) return s.substring(1, s.length() - 1).trim();
        return s;
    }

    private static SimulationException malformed(Path file, int line, String what) {
        return new SimulationException(SimulationException.ErrorCode.INVALID_PRICE_DATA,
            file.getFileName() + ":" + line + ": " + what);
    }
}
