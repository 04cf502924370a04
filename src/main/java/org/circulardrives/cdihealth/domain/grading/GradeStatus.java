package org.circulardrives.cdihealth.domain.grading;

/**
 * Overall verdict for a device.
 *
 * <p>A flagged device is a {@link #PASS} carrying a {@link FlagReason}; see {@link GradeResult#flagged()}.</p>
 *
 * @since 0.1.0
 */
public enum GradeStatus {
  /** Device may be reused. */
  PASS,
  /** Device breached a threshold or failed a self-test. */
  FAIL,
  /** Device could not be assessed. */
  ERROR
}
