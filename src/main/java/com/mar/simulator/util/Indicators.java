package com.mar.simulator.util;

import java.util.Arrays;

/**
 * Indicator math on price arrays. Every batch initializer is built from the same
 * step function used tick-by-tick, so a warm-up value stepped forward equals the
 * batch value over the longer series.
 */
public class Indicators {

    public static double trueRange(double prevPrice, double currPrice) {
        return Math.abs(currPrice - prevPrice);
    }

    /**
     * ATR over a warm-up series: simple mean of the first {@code window} true ranges,
     * then Wilder smoothing over the rest.
     */
    public static double initAtr(double[] prices, int window) {
        if (window < 1) throw new IllegalArgumentException("ATR window must be >= 1, got " + window);
        if (prices.length < window + 1) {
            throw new IllegalArgumentException("ATR needs " + (window + 1) + " prices, got " + prices.length);
        }
        double sum = 0.0;
        for (int i = 1; i <= window; i++) sum += trueRange(prices[i - 1], prices[i]);
        double atr = sum / window;
        for (int i = window + 1; i < prices.length; i++) {
            atr = stepAtr(atr, prices[i - 1], prices[i], window);
        }
        return atr;
    }

    public static double stepAtr(double prevAtr, double prevPrice, double currPrice, int window) {
        double tr = trueRange(prevPrice, currPrice);
        return ((window - 1) * prevAtr + tr) / window;
    }

    /**
     * EMA with {@code multiplier = smoothing / (length + 1)}. Smoothing 0 returns prevEma unchanged.
     */
    public static double stepEma(double prevEma, int length, double smoothing, double price) {
        double multiplier = smoothing / (length + 1.0);
        return price * multiplier + prevEma * (1.0 - multiplier);
    }

    /**
     * EMA series seeded with the SMA of the first {@code length} values; NaN before the seed.
     */
    public static double[] ema(double[] values, int length, double smoothing) {
        return emaFrom(values, 0, length, smoothing);
    }

    public static double initEma(double[] values, int length, double smoothing) {
        double[] out = ema(values, length, smoothing);
        return out.length == 0 ? Double.NaN : out[out.length - 1];
    }

    /**
     * MACD and Signal over a warm-up series. MACD starts where the slower EMA is seeded;
     * Signal is seeded with the SMA of the first {@code signalLength} MACD values.
     */
    public static MacdSeries macd(double[] prices, int fastLength, int slowLength, int signalLength, double smoothing) {
        if (fastLength < 1 || slowLength < 1 || signalLength < 1) {
            throw new IllegalArgumentException("MACD lengths must be >= 1");
        }
        int start = Math.max(fastLength, slowLength) - 1;
        if (prices.length < start + signalLength) {
            throw new IllegalArgumentException("MACD needs " + (start + signalLength) + " prices, got " + prices.length);
        }
        double[] fast = ema(prices, fastLength, smoothing);
        double[] slow = ema(prices, slowLength, smoothing);
        double[] macd = new double[prices.length];
        Arrays.fill(macd, Double.NaN);
        for (int i = start; i < prices.length; i++) macd[i] = fast[i] - slow[i];
        double[] signal = emaFrom(macd, start, signalLength, smoothing);
        return new MacdSeries(fast, slow, macd, signal);
    }

    public static int macdWarmup(int fastLength, int slowLength, int signalLength) {
        return Math.max(fastLength, slowLength) - 1 + signalLength;
    }

    /**
     * Highest of the last {@code lookback} values in {@code values[0, size)}; NaN when fewer exist.
     */
    public static double highest(double[] values, int size, int lookback) {
        if (lookback < 1 || size < lookback) return Double.NaN;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = size - lookback; i < size; i++) max = Math.max(max, values[i]);
        return max;
    }

    public static double lowest(double[] values, int size, int lookback) {
        if (lookback < 1 || size < lookback) return Double.NaN;
        double min = Double.POSITIVE_INFINITY;
        for (int i = size - lookback; i < size; i++) min = Math.min(min, values[i]);
        return min;
    }

    private static double[] emaFrom(double[] values, int offset, int length, double smoothing) {
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        int seedIdx = offset + length - 1;
        if (seedIdx >= values.length) return out;
        double sum = 0.0;
        for (int i = offset; i <= seedIdx; i++) sum += values[i];
        out[seedIdx] = sum / length;
        for (int i = seedIdx + 1; i < values.length; i++) {
            out[i] = stepEma(out[i - 1], length, smoothing, values[i]);
        }
        return out;
    }

    public record MacdSeries(double[] emaFast, double[] emaSlow, double[] macd, double[] signal) {}
}
