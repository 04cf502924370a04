package org.circulardrives.cdihealth.domain.grading;

/**
 * <strong>What:</strong> Immutable grading thresholds.
 * <p><strong>Why:</strong> Keeps every limit in one injected value so tests and operators can vary them without
 * touching the engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param pendingSectorsMax highest passing pending-sector count
 * @param reallocatedSectorsMax highest passing reallocated-sector count
 * @param uncorrectableErrorsMax highest passing media/uncorrectable error count
 * @param percentUsedMax highest passing endurance consumed, in percent
 * @param availableSpareMin spare percentage at or below which a device fails
 * @param workloadTbPerYearMax workload in TB/year above which a device is flagged heavy use
 * @param warningTempMinutesMax warning temperature minutes above which a device is flagged
 * @param criticalTempMinutesMax critical temperature minutes above which a device fails
 * @since 0.1.0
 */
public record ThresholdPolicy(
    long pendingSectorsMax,
    long reallocatedSectorsMax,
    long uncorrectableErrorsMax,
    long percentUsedMax,
    long availableSpareMin,
    double workloadTbPerYearMax,
    long warningTempMinutesMax,
    long criticalTempMinutesMax) {

  private static final ThresholdPolicy DEFAULTS = new ThresholdPolicy(10, 10, 10, 100, 97, 550.0, 60, 0);

  public ThresholdPolicy {
    requireNonNegative("pendingSectorsMax", pendingSectorsMax);
    requireNonNegative("reallocatedSectorsMax", reallocatedSectorsMax);
    requireNonNegative("uncorrectableErrorsMax", uncorrectableErrorsMax);
    requireNonNegative("percentUsedMax", percentUsedMax);
    requireNonNegative("availableSpareMin", availableSpareMin);
    requireNonNegative("warningTempMinutesMax", warningTempMinutesMax);
    requireNonNegative("criticalTempMinutesMax", criticalTempMinutesMax);
    if (!(workloadTbPerYearMax > 0) || Double.isInfinite(workloadTbPerYearMax)) {
      throw new IllegalArgumentException("workloadTbPerYearMax must be a positive finite number");
    }
    if (availableSpareMin > 100) {
      throw new IllegalArgumentException("availableSpareMin must be <= 100");
    }
  }

  /**
   * Returns the default policy: 10 pending, 10 reallocated, 10 uncorrectable, 100 percent used, spare 97,
   * 550 TB/year, 60 warning minutes and 0 critical minutes.
   *
   * @return shared default policy
   */
  public static ThresholdPolicy defaults() {
    return DEFAULTS;
  }

  private static void requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must be >= 0");
    }
  }
}
