package com.consullo.hdlbench.trace;

/**
 * Shape of a synthetic trace.
 *
 * @param seed random seed; equal seeds give identical traces for the same module
 * @param endTime exclusive end of the generated time range
 * @param timeStep distance between time markers; the clock toggles at every marker
 * @param stimulusInterval other inputs may change only at multiples of this interval
 * @param activityStart other inputs stay at zero up to and including this time
 * @param resetAssertedUntil reset is 1 before this time
 * @param resetDrivenUntil reset is driven (then 0) before this time
 * @param changeProbability probability that an input changes at a stimulus point
 * @since 1.0
 */
public record SyntheticTraceConfig(
    long seed,
    long endTime,
    long timeStep,
    long stimulusInterval,
    long activityStart,
    long resetAssertedUntil,
    long resetDrivenUntil,
    double changeProbability) {

  public SyntheticTraceConfig {
    if (endTime <= 0 || timeStep <= 0 || stimulusInterval <= 0) {
      throw new IllegalArgumentException("endTime/timeStep/stimulusInterval must be positive.");
    }
    if (activityStart < 0 || resetAssertedUntil < 0 || resetDrivenUntil < resetAssertedUntil) {
      throw new IllegalArgumentException("invalid reset window or activity start.");
    }
    if (changeProbability < 0.0 || changeProbability > 1.0) {
      throw new IllegalArgumentException("changeProbability must be within [0, 1]: " + changeProbability);
    }
  }

  /**
   * Returns the defaults: markers every 5 units up to 1000, reset high until 20 and driven until 50, other inputs
   * changing with probability 0.3 every 20 units after 50, seed 1.
   *
   * @return default configuration
   */
  public static SyntheticTraceConfig defaults() {
    return new SyntheticTraceConfig(1L, 1000, 5, 20, 50, 20, 50, 0.3);
  }

  public SyntheticTraceConfig withSeed(long newSeed) {
    return new SyntheticTraceConfig(newSeed, endTime, timeStep, stimulusInterval, activityStart, resetAssertedUntil,
        resetDrivenUntil, changeProbability);
  }
}
