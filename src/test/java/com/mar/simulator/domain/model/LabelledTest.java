package com.mar.simulator.domain.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonMappingException;

class LabelledTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    @DisplayName("policies parse from labels and constant names alike")
    void parsesLabelsAndNames() {
        assertEquals(ExtraUnitPolicy.AS_NEW_UNIT, Labelled.parse(ExtraUnitPolicy.class, "As new unit"));
        assertEquals(ExtraUnitPolicy.USING_ATR, Labelled.parse(ExtraUnitPolicy.class, "USING_ATR"));
        assertEquals(ExtraUnitPolicy.NO, Labelled.parse(ExtraUnitPolicy.class, "no"));
        assertEquals(EntryType.MACD_SIGNAL_CROSSOVER, Labelled.parse(EntryType.class, "MACD-Signal crossover"));
        assertEquals(ExitType.TIMED, Labelled.parse(ExitType.class, " Timed "));
    }

    @Test
    @DisplayName("unknown or blank values are rejected rather than defaulted")
    void rejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> Labelled.parse(ExitType.class, "Trailing"));
        assertThrows(IllegalArgumentException.class, () -> Labelled.parse(EntryType.class, " "));
    }

    @Test
    @DisplayName("JSON uses the labels in both directions")
    void jsonRoundTrip() throws Exception {
        assertEquals("\"Using ATR\"", om.writeValueAsString(ExtraUnitPolicy.USING_ATR));
        assertEquals(EntryType.MACD_ZERO_CROSSOVER, om.readValue("\"MACD zero crossover\"", EntryType.class));
        assertThrows(JsonMappingException.class, () -> om.readValue("\"sideways\"", ExitType.class));
    }

    @Test
    void macdUsage() {
        assertFalse(EntryType.BREAKOUT.usesMacd());
        assertTrue(EntryType.MACD_ZERO_CROSSOVER.usesMacd());
        assertEquals("Stop out", ExitReason.STOP_OUT.toString());
    }
}
