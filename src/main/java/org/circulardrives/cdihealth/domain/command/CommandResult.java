package org.circulardrives.cdihealth.domain.command;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Captured outcome of a finished diagnostic command.
 *
 * @since 0.1.0
 */
public final class CommandResult {
  private final int exitCode;
  private final byte[] stdout;
  private final byte[] stderr;
  private final Duration duration;

  /**
   * Creates a result; byte arrays are copied.
   *
   * @param exitCode process exit status
   * @param stdout captured standard output
   * @param stderr captured standard error
   * @param duration wall-clock run time
   */
  public CommandResult(int exitCode, byte[] stdout, byte[] stderr, Duration duration) {
    this.exitCode = exitCode;
    this.stdout = stdout == null ? new byte[0] : stdout.clone();
    this.stderr = stderr == null ? new byte[0] : stderr.clone();
    this.duration = Objects.requireNonNullElse(duration, Duration.ZERO);
  }

  /**
   * Convenience factory for UTF-8 text output.
   *
   * @param exitCode process exit status
   * @param stdout standard output text
   * @return result with empty stderr and zero duration
   */
  public static CommandResult ofText(int exitCode, String stdout) {
    return new CommandResult(
        exitCode, stdout == null ? null : stdout.getBytes(StandardCharsets.UTF_8), null, Duration.ZERO);
  }

  public int exitCode() {
    return exitCode;
  }

  public byte[] stdout() {
    return stdout.clone();
  }

  public byte[] stderr() {
    return stderr.clone();
  }

  public String stdoutText() {
    return new String(stdout, StandardCharsets.UTF_8);
  }

  public String stderrText() {
    return new String(stderr, StandardCharsets.UTF_8);
  }

  public Duration duration() {
    return duration;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CommandResult other)) {
      return false;
    }
    return exitCode == other.exitCode
        && Arrays.equals(stdout, other.stdout)
        && Arrays.equals(stderr, other.stderr)
        && duration.equals(other.duration);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(exitCode, duration);
    result = 31 * result + Arrays.hashCode(stdout);
    return 31 * result + Arrays.hashCode(stderr);
  }

  @Override
  public String toString() {
    return "CommandResult{exitCode=" + exitCode + ", stdout=" + stdout.length + "B, stderr=" + stderr.length
        + "B, duration=" + duration + '}';
  }
}
