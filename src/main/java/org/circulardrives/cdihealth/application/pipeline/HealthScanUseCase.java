package org.circulardrives.cdihealth.application.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.circulardrives.cdihealth.application.discovery.CancellationToken;
import org.circulardrives.cdihealth.application.discovery.DeviceDiscovery;
import org.circulardrives.cdihealth.application.discovery.DiscoveryException;
import org.circulardrives.cdihealth.application.discovery.DiscoveryFilter;
import org.circulardrives.cdihealth.application.port.ClockPort;
import org.circulardrives.cdihealth.application.port.ReportSink;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.ProbeOutcome;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.grading.GradeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs a full health scan: discover, probe, normalize, grade, publish.
 * <p><strong>Role:</strong> Application use case behind the {@code scan} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Produce exactly one {@link DeviceReport} per discovered device, in discovery order.</li>
 *   <li>Probe devices on the probe scheduler, then normalize and grade each outcome once, in discovery order.</li>
 *   <li>Hand the batch to every configured {@link ReportSink}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One scan at a time per instance.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code pipeline=scan} for the batch and logs a summary line.</p>
 *
 * @since 0.1.0
 */
public final class HealthScanUseCase {
  private static final Logger log = LoggerFactory.getLogger(HealthScanUseCase.class);

  private final DeviceDiscovery discovery;
  private final DeviceAssessor assessor;
  private final List<ReportSink> sinks;
  private final ClockPort clock;

  public HealthScanUseCase(
      DeviceDiscovery discovery, DeviceAssessor assessor, List<ReportSink> sinks, ClockPort clock) {
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.assessor = Objects.requireNonNull(assessor, "assessor");
    this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Runs the scan and publishes the result.
   *
   * @param filter ignore filters
   * @param cancellation token checked before each probe starts
   * @return the graded batch
   * @throws DiscoveryException when devices cannot be enumerated
   * @throws IOException when a report sink fails
   * @throws InterruptedException when the scan is interrupted
   */
  public ScanReport run(DiscoveryFilter filter, CancellationToken cancellation)
      throws DiscoveryException, IOException, InterruptedException {
    MDC.put("pipeline", "scan");
    try {
      List<DeviceCandidate> candidates = discovery.candidates(filter);
      List<ProbeOutcome> outcomes = discovery.probe(candidates, cancellation);
      List<DeviceReport> reports = new ArrayList<>(outcomes.size());
      for (ProbeOutcome outcome : outcomes) {
        reports.add(assessor.assess(outcome));
      }
      ScanReport report = new ScanReport(clock.nowMillis(), reports);
      log.info("Scan graded {} device(s): {} pass ({} flagged), {} fail, {} error",
          reports.size(), report.count(GradeStatus.PASS), report.flaggedCount(),
          report.count(GradeStatus.FAIL), report.count(GradeStatus.ERROR));
      for (ReportSink sink : sinks) {
        sink.publish(report.devices());
      }
      return report;
    } finally {
      MDC.remove("pipeline");
    }
  }
}
