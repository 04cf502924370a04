package org.circulardrives.cdihealth.application.discovery;

/**
 * Checked exception thrown when the device list itself cannot be obtained.
 *
 * @since 0.1.0
 */
public final class DiscoveryException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public DiscoveryException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public DiscoveryException(String msg, Throwable cause) { super(msg, cause); }
}
