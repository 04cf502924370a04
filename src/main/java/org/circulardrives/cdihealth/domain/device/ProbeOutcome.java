package org.circulardrives.cdihealth.domain.device;

import java.util.Objects;
import java.util.Optional;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;

/**
 * <strong>What:</strong> Result of probing one discovered candidate: identity plus raw telemetry, or a failure.
 * <p><strong>Role:</strong> Domain value emitted by discovery, one per candidate, in discovery order.</p>
 *
 * @param candidate candidate that was probed
 * @param identity resolved identity; path and protocol only when the probe failed
 * @param telemetry raw telemetry; empty when the probe failed
 * @param failureKind failure classification when the probe failed
 * @param failureMessage operator-facing failure detail
 * @since 0.1.0
 */
public record ProbeOutcome(
    DeviceCandidate candidate,
    DeviceIdentity identity,
    RawTelemetry telemetry,
    Optional<ProbeFailureKind> failureKind,
    Optional<String> failureMessage) {

  public ProbeOutcome {
    Objects.requireNonNull(candidate, "candidate");
    Objects.requireNonNull(identity, "identity");
    telemetry = Objects.requireNonNullElse(telemetry, RawTelemetry.empty());
    failureKind = Objects.requireNonNullElse(failureKind, Optional.empty());
    failureMessage = Objects.requireNonNullElse(failureMessage, Optional.empty());
  }

  public static ProbeOutcome success(DeviceCandidate candidate, DeviceIdentity identity, RawTelemetry telemetry) {
    return new ProbeOutcome(candidate, identity, telemetry, Optional.empty(), Optional.empty());
  }

  public static ProbeOutcome failure(DeviceCandidate candidate, ProbeFailureKind kind, String message) {
    return new ProbeOutcome(
        candidate,
        DeviceIdentity.unidentified(candidate.path(), candidate.protocol()),
        RawTelemetry.empty(),
        Optional.of(Objects.requireNonNull(kind, "kind")),
        Optional.ofNullable(message));
  }

  public boolean succeeded() {
    return failureKind.isEmpty();
  }
}
