package org.circulardrives.cdihealth.domain.telemetry;

/**
 * Pass/fail marker for one historical or current device self-test.
 *
 * @since 0.1.0
 */
public enum SelfTestOutcome {
  PASSED,
  FAILED
}
