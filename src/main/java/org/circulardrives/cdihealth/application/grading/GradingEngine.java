package org.circulardrives.cdihealth.application.grading;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.circulardrives.cdihealth.application.normalize.WorkloadCalculator;
import org.circulardrives.cdihealth.domain.grading.FailureReason;
import org.circulardrives.cdihealth.domain.grading.FlagReason;
import org.circulardrives.cdihealth.domain.grading.GradeResult;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Classifies a device as pass, fail, flagged or error from its canonical attributes.
 * <p><strong>Role:</strong> Application service invoked once per device after normalization.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return {@code Error/DataReadError} when no telemetry was obtained.</li>
 *   <li>Fail on any failed self-test, then on the first protocol check that fires.</li>
 *   <li>Otherwise flag temperature warnings, then heavy workloads, else pass.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #grade(CanonicalAttributes)} is a pure function.</p>
 * <p><strong>Observability:</strong> {@link #gradeSafely(CanonicalAttributes)} logs unexpected failures at WARN.</p>
 *
 * @since 0.1.0
 */
public final class GradingEngine {
  private static final Logger log = LoggerFactory.getLogger(GradingEngine.class);

  private final ThresholdPolicy policy;

  /**
   * Creates an engine bound to a policy.
   *
   * @param policy thresholds; must not be {@code null}
   */
  public GradingEngine(ThresholdPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public ThresholdPolicy policy() {
    return policy;
  }

  /**
   * Grades one device.
   *
   * @param attributes normalized attributes; must not be {@code null}
   * @return grade; workload is attached whenever it is determined
   */
  public GradeResult grade(CanonicalAttributes attributes) {
    Objects.requireNonNull(attributes, "attributes");
    if (!attributes.telemetryObtained()) {
      return GradeResult.dataReadError();
    }
    OptionalDouble workload = WorkloadCalculator.tbPerYear(attributes);
    if (attributes.anySelfTestFailed()) {
      return GradeResult.fail(FailureReason.FAILED_SELF_TEST, workload);
    }
    for (GradingRule rule : GradingRules.forProtocol(attributes.protocol())) {
      Optional<FailureReason> reason = rule.evaluate(attributes, policy);
      if (reason.isPresent()) {
        return GradeResult.fail(reason.get(), workload);
      }
    }
    if (attributes.warningTempMinutes().isPresent()
        && attributes.warningTempMinutes().getAsLong() > policy.warningTempMinutesMax()) {
      return GradeResult.flagged(FlagReason.TEMP_WARNING, workload);
    }
    if (workload.isPresent() && workload.getAsDouble() > policy.workloadTbPerYearMax()) {
      return GradeResult.flagged(FlagReason.HEAVY_USE, workload);
    }
    return GradeResult.pass(workload);
  }

  /**
   * Grades one device, converting any unexpected failure into {@code Error/DataReadError}.
   *
   * @param attributes normalized attributes
   * @return grade, never throws
   */
  public GradeResult gradeSafely(CanonicalAttributes attributes) {
    try {
      return grade(attributes);
    } catch (RuntimeException ex) {
      log.warn("Grading failed; reporting device as DataReadError", ex);
      return GradeResult.dataReadError();
    }
  }
}
