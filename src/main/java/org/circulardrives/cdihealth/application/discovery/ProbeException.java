package org.circulardrives.cdihealth.application.discovery;

import java.util.Objects;
import org.circulardrives.cdihealth.domain.device.ProbeFailureKind;

/**
 * Checked exception thrown when one device cannot be probed.
 *
 * @since 0.1.0
 */
public final class ProbeException extends Exception {
  private final ProbeFailureKind kind;

  /**
   * Creates an exception.
   *
   * @param kind failure classification
   * @param msg human-readable error
   */
  public ProbeException(ProbeFailureKind kind, String msg) {
    super(msg);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception with a cause.
   *
   * @param kind failure classification
   * @param msg human-readable error
   * @param cause root cause
   */
  public ProbeException(ProbeFailureKind kind, String msg, Throwable cause) {
    super(msg, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ProbeFailureKind kind() {
    return kind;
  }
}
