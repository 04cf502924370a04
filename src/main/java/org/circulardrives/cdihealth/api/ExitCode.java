package org.circulardrives.cdihealth.api;

/**
 * Process exit codes shared by all commands.
 *
 * <p>Grading outcomes are data: a scan that finds failing drives still exits {@link #SUCCESS}.</p>
 */
public enum ExitCode {
  SUCCESS(0),
  INVALID_ARGS(2),
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
