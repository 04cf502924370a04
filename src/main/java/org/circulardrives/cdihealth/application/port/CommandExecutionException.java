package org.circulardrives.cdihealth.application.port;

/**
 * Checked exception thrown when a diagnostic command cannot be started or its output cannot be collected.
 *
 * @since 0.1.0
 */
public final class CommandExecutionException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public CommandExecutionException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause from process creation or stream handling
   */
  public CommandExecutionException(String msg, Throwable cause) { super(msg, cause); }
}
