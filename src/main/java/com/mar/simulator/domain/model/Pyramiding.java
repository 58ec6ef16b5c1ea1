package com.mar.simulator.domain.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class Pyramiding {
    @NotNull private ExtraUnitPolicy addExtraUnits = ExtraUnitPolicy.AS_NEW_UNIT;
    @PositiveOrZero private double extraUnitAtrFactor = 0.5;
}
