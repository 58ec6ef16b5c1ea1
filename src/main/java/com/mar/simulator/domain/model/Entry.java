package com.mar.simulator.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class Entry {
    @NotNull private EntryType type = EntryType.BREAKOUT;
    @Min(1) private int longBreakout = 20;
    @Min(1) private int shortBreakout = 20;

    // true: trend following (long at a new high); false: countertrend
    private boolean longAtHigh = true;

    // extra conjuncts on top of the base trigger
    private boolean macdSignalCondition = false;
    private boolean signalPolarityCondition = false;
}
