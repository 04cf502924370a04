package org.circulardrives.cdihealth.domain.grading;

import java.util.Objects;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;

/**
 * Flat per-device triple handed to report sinks.
 *
 * @param identity device identity
 * @param attributes normalized attributes
 * @param grade grading outcome
 * @since 0.1.0
 */
public record DeviceReport(DeviceIdentity identity, CanonicalAttributes attributes, GradeResult grade) {
  public DeviceReport {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(attributes, "attributes");
    Objects.requireNonNull(grade, "grade");
  }
}
