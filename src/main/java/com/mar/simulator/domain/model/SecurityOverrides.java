package com.mar.simulator.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Per-security settings; null falls back to the portfolio default.
 */
@Data
public class SecurityOverrides {
    @Min(1) private Integer lotSize;
    @Min(1) private Integer maxUnits;
    @Min(1) private Integer atrAverageRange;
    @PositiveOrZero private Double stopLossFactor;
}
