package com.mar.simulator.domain.model;

import java.time.Instant;

/**
 * One aligned row of the price table: a timestamp and one price per security, in portfolio order.
 * The price array is copied on the way in and out.
 */
public record PriceTick(Instant time, double[] prices) {

    public PriceTick {
        prices = prices == null ? null : prices.clone();
    }

    @Override
    public double[] prices() {
        return prices == null ? null : prices.clone();
    }

    public double price(int securityIndex) {
        return prices[securityIndex];
    }

    public int width() {
        return prices.length;
    }
}
