package com.mar.simulator.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class Exit {
    @NotNull private ExitType type = ExitType.TIMED;

    // TIMED: ticks held before the oldest unit is closed
    @Min(1) private int longHorizon = 80;
    @Min(1) private int shortHorizon = 80;

    // BREAKOUT: lookback of the opposite-side channel
    @Min(1) private int longBreakout = 80;
    @Min(1) private int shortBreakout = 80;
}
