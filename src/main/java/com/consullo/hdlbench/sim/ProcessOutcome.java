package com.consullo.hdlbench.sim;

/**
 * Outcome of one external process invocation.
 *
 * @param exitCode exit code, or -1 when the process did not exit normally
 * @param output merged standard output and error
 * @param timedOut true when the process was killed after its timeout
 * @param startFailure reason the process could not be started, or null
 */
public record ProcessOutcome(int exitCode, String output, boolean timedOut, String startFailure) {

  public ProcessOutcome {
    output = output == null ? "" : output;
  }

  public static ProcessOutcome exited(int exitCode, String output) {
    return new ProcessOutcome(exitCode, output, false, null);
  }

  public static ProcessOutcome timedOut(String output) {
    return new ProcessOutcome(-1, output, true, null);
  }

  public static ProcessOutcome failedToStart(String reason) {
    return new ProcessOutcome(-1, "", false, reason);
  }

  public boolean succeeded() {
    return startFailure == null && !timedOut && exitCode == 0;
  }

  /**
   * Short failure description, e.g. {@code exit code 2} or {@code timed out}.
   */
  public String describeFailure() {
    if (startFailure != null) {
      return "could not start: " + startFailure;
    }
    if (timedOut) {
      return "timed out";
    }
    return "exit code " + exitCode;
  }
}
