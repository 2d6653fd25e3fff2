package com.consullo.hdlbench.testbench;

/**
 * Fixed timing and naming constants of a synthesized testbench.
 *
 * <p>All delays are in units of the {@link #timescale()} directive. None of them depend on the module under test.
 *
 * @param timescale timescale directive argument, e.g. {@code 1ns/1ps}
 * @param clockHalfPeriod delay between clock toggles
 * @param resetReleaseDelay delay from time 0 until reset is released
 * @param resetReassertDelay delay from release until reset is asserted once more
 * @param settleDelay delay before the first stimulus vector is applied
 * @param vectorStep delay between stimulus vectors
 * @param finishDelay delay after the last vector before {@code $finish}
 * @param dumpFile trace file name passed to {@code $dumpfile}
 * @param instanceName instance name of the module under test
 * @since 1.0
 */
public record TestbenchConfig(
    String timescale,
    int clockHalfPeriod,
    int resetReleaseDelay,
    int resetReassertDelay,
    int settleDelay,
    int vectorStep,
    int finishDelay,
    String dumpFile,
    String instanceName) {

  public static final String DEFAULT_DUMP_FILE = "wave.vcd";

  public TestbenchConfig {
    if (timescale == null || timescale.isBlank() || dumpFile == null || dumpFile.isBlank()
        || instanceName == null || instanceName.isBlank()) {
      throw new IllegalArgumentException("timescale/dumpFile/instanceName must not be blank.");
    }
    if (clockHalfPeriod <= 0 || vectorStep <= 0) {
      throw new IllegalArgumentException("clockHalfPeriod/vectorStep must be positive.");
    }
    if (resetReleaseDelay < 0 || resetReassertDelay < 0 || settleDelay < 0 || finishDelay < 0) {
      throw new IllegalArgumentException("delays must not be negative.");
    }
  }

  /**
   * Returns the defaults: 1ns/1ps, 100 MHz clock, reset released at 20 and re-asserted at 30, first vector at 50,
   * vectors every 10, finish 100 after the last vector, dump to {@code wave.vcd}, instance {@code uut}.
   *
   * @return default configuration
   */
  public static TestbenchConfig defaults() {
    return new TestbenchConfig("1ns/1ps", 5, 20, 10, 50, 10, 100, DEFAULT_DUMP_FILE, "uut");
  }
}
