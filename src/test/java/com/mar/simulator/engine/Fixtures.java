package com.mar.simulator.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import com.mar.simulator.config.AppProperties;
import com.mar.simulator.domain.model.ExtraUnitPolicy;
import com.mar.simulator.domain.model.PriceSeries;
import com.mar.simulator.domain.model.PriceTick;

/**
 * Shared builders for engine and service tests.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-01-02T09:15:00Z");

    private Fixtures() {
    }

    /** Defaults with lot size 1, long horizons and no pyramiding, so scenarios stay small. */
    public static AppProperties config() {
        AppProperties cfg = new AppProperties();
        cfg.getSizing().setLotSize(1);
        cfg.getPyramiding().setAddExtraUnits(ExtraUnitPolicy.NO);
        cfg.getOutput().setEnabled(false);
        return cfg;
    }

    public static PriceSeries series(double... prices) {
        List<Instant> times = new ArrayList<>(prices.length);
        for (int i = 0; i < prices.length; i++) times.add(T0.plusSeconds(i));
        return new PriceSeries(times, prices);
    }

    public static PriceSeries constant(int n, double price) {
        double[] p = new double[n];
        Arrays.fill(p, price);
        return series(p);
    }

    /** 99, 98, 99, ... ending on 99: every true range is 1, so ATR is exactly 1. */
    public static PriceSeries zigzag(int n) {
        double[] p = new double[n];
        for (int i = 0; i < n; i++) p[i] = (n - 1 - i) % 2 == 0 ? 99.0 : 98.0;
        return series(p);
    }

    /** Ticks one second apart, starting right after a warm-up of {@code warmup} points. */
    public static List<PriceTick> rows(int warmup, double[]... rows) {
        List<PriceTick> out = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) out.add(new PriceTick(T0.plusSeconds(warmup + i), rows[i]));
        return out;
    }

    public static List<PriceTick> ticks(int warmup, double... prices) {
        double[][] rows = new double[prices.length][];
        for (int i = 0; i < prices.length; i++) rows[i] = new double[]{prices[i]};
        return rows(warmup, rows);
    }
}
