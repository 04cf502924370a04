package org.circulardrives.cdihealth.domain.grading;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of grading one device.
 *
 * @param status overall verdict
 * @param failureReason reason for {@link GradeStatus#FAIL} or {@link GradeStatus#ERROR}; empty on pass
 * @param flagReason caveat on a passing device
 * @param workloadTbPerYear derived workload when it could be determined
 * @since 0.1.0
 */
public record GradeResult(
    GradeStatus status,
    Optional<FailureReason> failureReason,
    Optional<FlagReason> flagReason,
    OptionalDouble workloadTbPerYear) {

  public GradeResult {
    Objects.requireNonNull(status, "status");
    failureReason = Objects.requireNonNullElse(failureReason, Optional.empty());
    flagReason = Objects.requireNonNullElse(flagReason, Optional.empty());
    workloadTbPerYear = Objects.requireNonNullElse(workloadTbPerYear, OptionalDouble.empty());
    if (status == GradeStatus.PASS && failureReason.isPresent()) {
      throw new IllegalArgumentException("passing result cannot carry a failure reason");
    }
    if (status != GradeStatus.PASS && failureReason.isEmpty()) {
      throw new IllegalArgumentException(status + " result requires a failure reason");
    }
    if (status != GradeStatus.PASS && flagReason.isPresent()) {
      throw new IllegalArgumentException("only passing results carry a flag");
    }
  }

  public static GradeResult pass(OptionalDouble workload) {
    return new GradeResult(GradeStatus.PASS, Optional.empty(), Optional.empty(), workload);
  }

  public static GradeResult flagged(FlagReason flag, OptionalDouble workload) {
    return new GradeResult(
        GradeStatus.PASS, Optional.empty(), Optional.of(Objects.requireNonNull(flag, "flag")), workload);
  }

  public static GradeResult fail(FailureReason reason, OptionalDouble workload) {
    return new GradeResult(
        GradeStatus.FAIL, Optional.of(Objects.requireNonNull(reason, "reason")), Optional.empty(), workload);
  }

  /**
   * Result for a device that could not be assessed.
   *
   * @return {@code Error/DataReadError}
   */
  public static GradeResult dataReadError() {
    return new GradeResult(
        GradeStatus.ERROR, Optional.of(FailureReason.DATA_READ_ERROR), Optional.empty(), OptionalDouble.empty());
  }

  /**
   * Indicates a pass carrying a caveat.
   *
   * @return {@code true} when the status is pass and a flag is present
   */
  public boolean flagged() {
    return status == GradeStatus.PASS && flagReason.isPresent();
  }

  /**
   * Short label suitable for a report column, e.g. {@code Fail/PendingSectors} or {@code Pass/HeavyUse}.
   *
   * @return display label
   */
  public String label() {
    String head = switch (status) {
      case PASS -> "Pass";
      case FAIL -> "Fail";
      case ERROR -> "Error";
    };
    if (failureReason.isPresent()) {
      return head + '/' + failureReason.get().label();
    }
    return flagReason.map(flag -> head + '/' + flag.label()).orElse(head);
  }
}
