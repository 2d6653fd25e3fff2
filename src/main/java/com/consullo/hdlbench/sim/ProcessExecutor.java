package com.consullo.hdlbench.sim;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a command with a timeout and collects its merged output.
 *
 * <p>
 * Standard error is redirected into standard output, which a daemon thread drains while the caller waits, so a
 * chatty process cannot block on a full pipe. A process still alive at the timeout is killed forcibly.
 * </p>
 *
 * @since 1.0
 */
public class ProcessExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessExecutor.class);

  private static final long DRAIN_JOIN_MILLIS = 2000;

  /**
   * Executes {@code command}.
   *
   * @param command command and arguments
   * @param workingDirectory working directory, or null to inherit
   * @param timeout wall-clock limit
   * @return outcome; never throws for process failures
   */
  public ProcessOutcome execute(List<String> command, Path workingDirectory, Duration timeout) {
    Validate.notEmpty(command, "command must not be empty");
    Validate.notNull(timeout, "timeout must not be null");

    ProcessBuilder pb = new ProcessBuilder(command);
    if (workingDirectory != null) {
      pb.directory(workingDirectory.toFile());
    }
    pb.redirectErrorStream(true);
    LOGGER.debug("Running: {} (timeout {}s)", String.join(" ", command), timeout.toSeconds());

    Process process;
    try {
      process = pb.start();
    } catch (IOException e) {
      LOGGER.debug("Could not start {}: {}", command.get(0), e.getMessage());
      return ProcessOutcome.failedToStart(e.getMessage());
    }

    ByteArrayOutputStream collected = new ByteArrayOutputStream();
    Thread drain = new Thread(() -> drain(process.getInputStream(), collected), "ProcessOutputDrain");
    drain.setDaemon(true);
    drain.start();

    try {
      boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!exited) {
        process.destroyForcibly();
        process.waitFor(DRAIN_JOIN_MILLIS, TimeUnit.MILLISECONDS);
        drain.join(DRAIN_JOIN_MILLIS);
        LOGGER.warn("{} timed out after {}s", command.get(0), timeout.toSeconds());
        return ProcessOutcome.timedOut(text(collected));
      }
      drain.join(DRAIN_JOIN_MILLIS);
      int code = process.exitValue();
      LOGGER.debug("{} exited with {}", command.get(0), code);
      return ProcessOutcome.exited(code, text(collected));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      return ProcessOutcome.failedToStart("interrupted while waiting for " + command.get(0));
    }
  }

  private static void drain(InputStream in, ByteArrayOutputStream sink) {
    byte[] buf = new byte[8192];
    try (InputStream is = in) {
      int n;
      while ((n = is.read(buf)) >= 0) {
        synchronized (sink) {
          sink.write(buf, 0, n);
        }
      }
    } catch (IOException e) {
      LOGGER.debug("Output drain stopped: {}", e.getMessage());
    }
  }

  private static String text(ByteArrayOutputStream sink) {
    synchronized (sink) {
      return sink.toString(StandardCharsets.UTF_8);
    }
  }
}
