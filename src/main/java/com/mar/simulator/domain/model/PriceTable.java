package com.mar.simulator.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-aligned prices of several securities: one row per timestamp, one column per security.
 */
public record PriceTable(List<String> names, List<Instant> times, List<double[]> rows) {

    public int size() {
        return times.size();
    }

    public int width() {
        return names.size();
    }

    /** Column {@code s} of rows {@code [from, to)} as a standalone series. */
    public PriceSeries series(int s, int from, int to) {
        double[] prices = new double[to - from];
        for (int i = from; i < to; i++) prices[i - from] = rows.get(i)[s];
        return new PriceSeries(new ArrayList<>(times.subList(from, to)), prices);
    }

    public List<PriceTick> ticks(int from) {
        List<PriceTick> out = new ArrayList<>(Math.max(0, size() - from));
        for (int i = from; i < size(); i++) out.add(new PriceTick(times.get(i), rows.get(i)));
        return out;
    }
}
