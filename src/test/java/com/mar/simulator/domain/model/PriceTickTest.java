package com.mar.simulator.domain.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PriceTickTest {

    @Test
    @DisplayName("a tick's prices cannot be changed through the array it was built from or handed out")
    void pricesAreCopied() {
        double[] source = {100.0, 50.0};
        PriceTick tick = new PriceTick(Instant.EPOCH, source);

        source[0] = -1.0;
        tick.prices()[1] = -1.0;

        assertEquals(100.0, tick.price(0), 0.0);
        assertEquals(50.0, tick.price(1), 0.0);
        assertEquals(2, tick.width());
    }
}
