package org.circulardrives.cdihealth.domain.grading;

/**
 * Mutually exclusive reasons attached to {@link GradeStatus#FAIL} and {@link GradeStatus#ERROR} results.
 *
 * @since 0.1.0
 */
public enum FailureReason {
  /** No usable telemetry, probe timeout, or unparseable output. */
  DATA_READ_ERROR("DataReadError"),
  /** A historical or current self-test failed. */
  FAILED_SELF_TEST("FailedSelfTest"),
  /** Pending sectors above the policy maximum. */
  PENDING_SECTORS("PendingSectors"),
  /** Reallocated sectors or grown defects above the policy maximum. */
  REALLOCATED_SECTORS("ReallocatedSectors"),
  /** Endurance consumed above the policy maximum. */
  PERCENT_USED("PercentUsed"),
  /** Spare capacity at or below the policy minimum. */
  AVAILABLE_SPARE("AvailableSpare"),
  /** NVMe media and data integrity errors above the policy maximum. */
  MEDIA_ERRORS("MediaErrors"),
  /** Time above the critical composite temperature above the policy maximum. */
  CRITICAL_TEMP("CriticalTemp");

  private final String label;

  FailureReason(String label) {
    this.label = label;
  }

  /**
   * Report label for this reason.
   *
   * @return camel-case label such as {@code PendingSectors}
   */
  public String label() {
    return label;
  }
}
