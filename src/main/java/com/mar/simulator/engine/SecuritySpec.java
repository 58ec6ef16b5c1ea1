package com.mar.simulator.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Fully resolved settings of one security: portfolio defaults with its overrides applied.
 */
@Value
@Builder
public class SecuritySpec {
    String name;
    int lotSize;
    int maxUnits;
    int atrAverageRange;
    double stopLossFactor;
    double marginFactor;
    double transactionCostRate;
    double slippagePerContract;

    boolean macdEnabled;
    int macdFastLength;
    int macdSlowLength;
    int macdSignalLength;
    double macdSmoothing;
}
