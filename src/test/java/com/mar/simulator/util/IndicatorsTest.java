package com.mar.simulator.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IndicatorsTest {

    private static final double EPS = 1e-9;

    private static double[] randomWalk(int n, long seed) {
        Random rnd = new Random(seed);
        double[] p = new double[n];
        p[0] = 100.0;
        for (int i = 1; i < n; i++) p[i] = Math.max(1.0, p[i - 1] + rnd.nextGaussian());
        return p;
    }

    @Nested
    @DisplayName("ATR")
    class Atr {

        @Test
        @DisplayName("is the mean of the first window true ranges on a minimal series")
        void seedIsSimpleMean() {
            double[] p = {10, 11, 9, 12};
            // TRs 1, 2, 3
            assertEquals(2.0, Indicators.initAtr(p, 3), EPS);
        }

        @Test
        @DisplayName("applies Wilder smoothing after the seed")
        void wilderAfterSeed() {
            double[] p = {10, 11, 9, 12, 12};
            // seed 2, then ((3-1)*2 + 0)/3
            assertEquals(4.0 / 3.0, Indicators.initAtr(p, 3), EPS);
        }

        @Test
        @DisplayName("stepping from a warm-up value matches the batch value over the full series")
        void incrementalMatchesBatch() {
            double[] p = randomWalk(300, 7L);
            int window = 20;
            double atr = Indicators.initAtr(Arrays.copyOf(p, 40), window);
            for (int i = 40; i < p.length; i++) atr = Indicators.stepAtr(atr, p[i - 1], p[i], window);
            assertEquals(Indicators.initAtr(p, window), atr, EPS);
        }

        @Test
        void rejectsShortSeries() {
            assertThrows(IllegalArgumentException.class, () -> Indicators.initAtr(new double[]{1, 2, 3}, 3));
            assertThrows(IllegalArgumentException.class, () -> Indicators.initAtr(new double[]{1, 2, 3}, 0));
        }
    }

    @Nested
    @DisplayName("EMA and MACD")
    class Ema {

        @Test
        @DisplayName("is seeded with the simple mean and NaN before it")
        void seededWithSma() {
            double[] ema = Indicators.ema(new double[]{1, 2, 3, 4}, 3, 2.0);
            assertTrue(Double.isNaN(ema[0]));
            assertTrue(Double.isNaN(ema[1]));
            assertEquals(2.0, ema[2], EPS);
            // multiplier 2/4
            assertEquals(3.0, ema[3], EPS);
        }

        @Test
        @DisplayName("smoothing 0 leaves the previous value unchanged")
        void zeroSmoothing() {
            assertEquals(5.0, Indicators.stepEma(5.0, 10, 0.0, 100.0), 0.0);
        }

        @Test
        @DisplayName("stepped EMA matches the batch EMA")
        void incrementalEma() {
            double[] p = randomWalk(200, 11L);
            double ema = Indicators.initEma(Arrays.copyOf(p, 50), 26, 2.0);
            for (int i = 50; i < p.length; i++) ema = Indicators.stepEma(ema, 26, 2.0, p[i]);
            assertEquals(Indicators.initEma(p, 26, 2.0), ema, EPS);
        }

        @Test
        @DisplayName("stepped MACD and Signal match the batch series")
        void incrementalMacd() {
            double[] p = randomWalk(250, 3L);
            int warm = Indicators.macdWarmup(12, 26, 9) + 1;
            var init = Indicators.macd(Arrays.copyOf(p, warm), 12, 26, 9, 2.0);
            double fast = init.emaFast()[warm - 1];
            double slow = init.emaSlow()[warm - 1];
            double signal = init.signal()[warm - 1];
            double macd = fast - slow;
            for (int i = warm; i < p.length; i++) {
                fast = Indicators.stepEma(fast, 12, 2.0, p[i]);
                slow = Indicators.stepEma(slow, 26, 2.0, p[i]);
                macd = fast - slow;
                signal = Indicators.stepEma(signal, 9, 2.0, macd);
            }
            var full = Indicators.macd(p, 12, 26, 9, 2.0);
            assertEquals(full.macd()[p.length - 1], macd, EPS);
            assertEquals(full.signal()[p.length - 1], signal, EPS);
        }

        @Test
        @DisplayName("Signal starts once signalLength MACD values exist")
        void signalSeedPosition() {
            double[] p = randomWalk(60, 5L);
            var s = Indicators.macd(p, 12, 26, 9, 2.0);
            assertTrue(Double.isNaN(s.macd()[24]));
            assertFalse(Double.isNaN(s.macd()[25]));
            assertTrue(Double.isNaN(s.signal()[32]));
            double seed = 0;
            for (int i = 25; i <= 33; i++) seed += s.macd()[i];
            assertEquals(seed / 9, s.signal()[33], EPS);
            assertEquals(34, Indicators.macdWarmup(12, 26, 9));
        }
    }

    @Test
    @DisplayName("rolling high/low looks at the last values only and is NaN when short")
    void rollingExtremes() {
        double[] v = {5, 1, 9, 3, 4, 0, 0};
        assertEquals(9.0, Indicators.highest(v, 5, 3), 0.0);
        assertEquals(3.0, Indicators.lowest(v, 5, 3), 0.0);
        assertTrue(Double.isNaN(Indicators.highest(v, 2, 3)));
        assertTrue(Double.isNaN(Indicators.lowest(v, 5, 0)));
    }
}
