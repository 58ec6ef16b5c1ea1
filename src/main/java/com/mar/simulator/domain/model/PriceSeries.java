package com.mar.simulator.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import com.mar.simulator.util.Indicators;

/**
 * Append-only (time, price) history of one security.
 */
public class PriceSeries {

    private final List<Instant> times;
    private double[] prices;
    private int size;

    public PriceSeries(List<Instant> times, double[] prices) {
        if (times.size() != prices.length) {
            throw new IllegalArgumentException("times and prices differ in length: " + times.size() + " vs " + prices.length);
        }
        this.times = new ArrayList<>(times);
        this.prices = Arrays.copyOf(prices, Math.max(16, prices.length * 2));
        this.size = prices.length;
    }

    public void append(Instant time, double price) {
        if (size == prices.length) prices = Arrays.copyOf(prices, size * 2);
        prices[size++] = price;
        times.add(time);
    }

    public int size() {
        return size;
    }

    public double lastPrice() {
        return prices[size - 1];
    }

    public Instant lastTime() {
        return times.get(size - 1);
    }

    public double priceAt(int i) {
        return prices[i];
    }

    public Instant timeAt(int i) {
        return times.get(i);
    }

    public double[] toArray() {
        return Arrays.copyOf(prices, size);
    }

    /** Highest of the last {@code lookback} points; NaN with insufficient history. */
    public double highest(int lookback) {
        return Indicators.highest(prices, size, lookback);
    }

    public double lowest(int lookback) {
        return Indicators.lowest(prices, size, lookback);
    }
}
