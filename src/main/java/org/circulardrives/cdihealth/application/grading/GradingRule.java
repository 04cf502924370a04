package org.circulardrives.cdihealth.application.grading;

import java.util.Optional;
import org.circulardrives.cdihealth.domain.grading.FailureReason;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;

/**
 * One independent failure check.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface GradingRule {
  /**
   * Evaluates the check.
   *
   * @param attributes normalized attributes
   * @param policy thresholds
   * @return the failure reason when the check fires; empty when it does not or its input is not reported
   */
  Optional<FailureReason> evaluate(CanonicalAttributes attributes, ThresholdPolicy policy);
}
