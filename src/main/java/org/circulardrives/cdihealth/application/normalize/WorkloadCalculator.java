package org.circulardrives.cdihealth.application.normalize;

import java.util.OptionalDouble;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;

/**
 * Derives annualised host workload in TB/year.
 *
 * <p>{@code (reads + writes) / 1 TiB / (powerOnHours / 8766)}. The result is undetermined when power-on hours
 * are not reported or not positive, or when neither reads nor writes are reported. When only one direction is
 * reported, the other contributes nothing.</p>
 *
 * @since 0.1.0
 */
public final class WorkloadCalculator {
  /** Bytes in one tebibyte. */
  public static final double TIB = 1024d * 1024d * 1024d * 1024d;
  /** Average hours per year, including leap years. */
  public static final double HOURS_PER_YEAR = 8766d;

  private WorkloadCalculator() {
    // Utility
  }

  /**
   * Computes workload from canonical attributes.
   *
   * @param attributes normalized attributes
   * @return workload, or empty when undetermined
   */
  public static OptionalDouble tbPerYear(CanonicalAttributes attributes) {
    return tbPerYear(attributes.hostReadsBytes(), attributes.hostWritesBytes(), attributes.powerOnHours());
  }

  /**
   * Computes workload from its inputs.
   *
   * @param readsBytes bytes read by the host
   * @param writesBytes bytes written by the host
   * @param powerOnHours power-on hours
   * @return workload, or empty when undetermined
   */
  public static OptionalDouble tbPerYear(OptionalLong readsBytes, OptionalLong writesBytes, OptionalLong powerOnHours) {
    if (powerOnHours.isEmpty() || powerOnHours.getAsLong() <= 0) {
      return OptionalDouble.empty();
    }
    if (readsBytes.isEmpty() && writesBytes.isEmpty()) {
      return OptionalDouble.empty();
    }
    double totalBytes = (double) readsBytes.orElse(0L) + (double) writesBytes.orElse(0L);
    double years = powerOnHours.getAsLong() / HOURS_PER_YEAR;
    return OptionalDouble.of(totalBytes / TIB / years);
  }
}
