package com.mar.simulator.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class Macd {
    @Min(1) private int fastLength = 12;
    @Min(1) private int slowLength = 26;
    @Min(1) private int signalLength = 9;
    @PositiveOrZero private double smoothing = 2.0;
}
