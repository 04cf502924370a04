package org.circulardrives.cdihealth.application.discovery;

import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.ProbeFailureKind;

/**
 * Builds the per-device result for a candidate whose probe did not succeed.
 *
 * @param <T> per-device result type
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProbeFallback<T> {
  /**
   * Creates the failure result.
   *
   * @param candidate failed candidate
   * @param kind failure classification
   * @param message operator-facing detail; may be {@code null}
   * @return per-device result; never {@code null}
   */
  T onFailure(DeviceCandidate candidate, ProbeFailureKind kind, String message);
}
