package org.circulardrives.cdihealth.application.grading;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.function.LongPredicate;
import java.util.function.ToLongFunction;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.grading.FailureReason;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;

/**
 * Ordered protocol-specific failure checks.
 *
 * <p>Order matters: the engine reports the first check that fires.</p>
 *
 * @since 0.1.0
 */
public final class GradingRules {
  static final GradingRule PENDING_SECTORS = exceeds(
      CanonicalAttributes::pendingSectors, ThresholdPolicy::pendingSectorsMax, FailureReason.PENDING_SECTORS);
  static final GradingRule REALLOCATED_SECTORS = exceeds(
      CanonicalAttributes::reallocatedSectors,
      ThresholdPolicy::reallocatedSectorsMax,
      FailureReason.REALLOCATED_SECTORS);
  static final GradingRule PERCENT_USED = exceeds(
      CanonicalAttributes::percentUsed, ThresholdPolicy::percentUsedMax, FailureReason.PERCENT_USED);
  static final GradingRule AVAILABLE_SPARE = (attributes, policy) -> check(
      attributes.availableSparePct(), value -> value <= policy.availableSpareMin(), FailureReason.AVAILABLE_SPARE);
  static final GradingRule MEDIA_ERRORS = exceeds(
      CanonicalAttributes::mediaErrors, ThresholdPolicy::uncorrectableErrorsMax, FailureReason.MEDIA_ERRORS);
  static final GradingRule CRITICAL_TEMP = exceeds(
      CanonicalAttributes::criticalTempMinutes, ThresholdPolicy::criticalTempMinutesMax, FailureReason.CRITICAL_TEMP);

  private static final List<GradingRule> ATA_SCSI =
      List.of(PENDING_SECTORS, REALLOCATED_SECTORS, PERCENT_USED, AVAILABLE_SPARE);
  private static final List<GradingRule> NVME =
      List.of(PERCENT_USED, AVAILABLE_SPARE, MEDIA_ERRORS, CRITICAL_TEMP);

  private GradingRules() {
    // Utility
  }

  /**
   * Returns the checks for a protocol in evaluation order.
   *
   * @param protocol device protocol
   * @return NVMe checks for NVMe devices, ATA/SCSI checks otherwise
   */
  public static List<GradingRule> forProtocol(TransportProtocol protocol) {
    return protocol == TransportProtocol.NVME ? NVME : ATA_SCSI;
  }

  private static GradingRule exceeds(
      Function<CanonicalAttributes, OptionalLong> field,
      ToLongFunction<ThresholdPolicy> limit,
      FailureReason reason) {
    return (attributes, policy) -> {
      long max = limit.applyAsLong(policy);
      return check(field.apply(attributes), value -> value > max, reason);
    };
  }

  private static Optional<FailureReason> check(OptionalLong value, LongPredicate fires, FailureReason reason) {
    if (value.isPresent() && fires.test(value.getAsLong())) {
      return Optional.of(reason);
    }
    return Optional.empty();
  }
}
