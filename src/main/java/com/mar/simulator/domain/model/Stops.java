package com.mar.simulator.domain.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class Stops {
    private boolean enabled = true;
    @PositiveOrZero private double stopLossFactor = 2.0;
    private boolean adjustOnMoreUnits = true;
    @PositiveOrZero private double adjustStopAtrFactor = 0.5;
}
