package org.circulardrives.cdihealth.application.pipeline;

import java.util.Objects;
import org.circulardrives.cdihealth.application.grading.GradingEngine;
import org.circulardrives.cdihealth.application.normalize.TelemetryNormalizers;
import org.circulardrives.cdihealth.application.port.MetricsPort;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.ProbeOutcome;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.grading.GradeResult;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Normalizes and grades one device.
 * <p><strong>Role:</strong> Per-device boundary shared by the live scan and offline grading.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Turn failed probes into {@code Error/DataReadError} reports.</li>
 *   <li>Contain normalizer failures so they never escape the batch.</li>
 *   <li>Count outcomes under {@code scan.device.pass}, {@code scan.device.fail} and {@code scan.device.error}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; called concurrently from probe workers.</p>
 *
 * @since 0.1.0
 */
public final class DeviceAssessor {
  private static final Logger log = LoggerFactory.getLogger(DeviceAssessor.class);

  private final TelemetryNormalizers normalizers;
  private final GradingEngine engine;
  private final MetricsPort metrics;

  public DeviceAssessor(TelemetryNormalizers normalizers, GradingEngine engine, MetricsPort metrics) {
    this.normalizers = Objects.requireNonNull(normalizers, "normalizers");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Assesses a probe outcome.
   *
   * @param outcome successful or failed probe
   * @return device report; never {@code null}
   */
  public DeviceReport assess(ProbeOutcome outcome) {
    if (!outcome.succeeded()) {
      log.info("Device {} not assessed: {} {}", outcome.candidate().path(),
          outcome.failureKind().orElseThrow(), outcome.failureMessage().orElse(""));
      return record(unreadable(outcome.identity()));
    }
    return assess(outcome.identity(), outcome.telemetry());
  }

  /**
   * Assesses raw telemetry for a known identity.
   *
   * @param identity device identity
   * @param raw raw telemetry
   * @return device report; never {@code null}
   */
  public DeviceReport assess(DeviceIdentity identity, RawTelemetry raw) {
    CanonicalAttributes attributes;
    try {
      attributes = normalizers.normalize(identity, raw);
    } catch (RuntimeException ex) {
      log.warn("Normalizing telemetry for {} failed; reporting DataReadError", identity.path(), ex);
      return record(unreadable(identity));
    }
    GradeResult grade = engine.gradeSafely(attributes);
    log.debug("Graded {} {}: {}", identity.path(), identity.model(), grade.label());
    return record(new DeviceReport(identity, attributes, grade));
  }

  private static DeviceReport unreadable(DeviceIdentity identity) {
    return new DeviceReport(identity, CanonicalAttributes.notObtained(identity.protocol()), GradeResult.dataReadError());
  }

  private DeviceReport record(DeviceReport report) {
    switch (report.grade().status()) {
      case PASS -> metrics.increment("scan.device.pass");
      case FAIL -> metrics.increment("scan.device.fail");
      case ERROR -> metrics.increment("scan.device.error");
    }
    if (report.grade().flagged()) {
      metrics.increment("scan.device.flagged");
    }
    return report;
  }
}
