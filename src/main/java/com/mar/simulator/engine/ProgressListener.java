package com.mar.simulator.engine;

/**
 * Receives the fraction of ticks processed, in [0, 1], after every tick.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = fraction -> { };

    void onProgress(double fraction);
}
