package org.circulardrives.cdihealth.application.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.circulardrives.cdihealth.application.json.TelemetryJsonParser;
import org.circulardrives.cdihealth.application.normalize.IdentityResolver;
import org.circulardrives.cdihealth.application.port.ClockPort;
import org.circulardrives.cdihealth.application.port.ReportSink;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Grades telemetry documents saved from earlier probes, one report per file in argument order.
 *
 * <p>A file that cannot be read or parsed becomes an {@code Error/DataReadError} row named after the file; it never
 * aborts the batch. The device path comes from the document's {@code device.name}, falling back to the file
 * name.</p>
 *
 * @since 0.1.0
 */
public final class OfflineGradeUseCase {
  private static final Logger log = LoggerFactory.getLogger(OfflineGradeUseCase.class);

  private final TelemetryJsonParser json;
  private final DeviceAssessor assessor;
  private final List<ReportSink> sinks;
  private final ClockPort clock;

  public OfflineGradeUseCase(
      TelemetryJsonParser json, DeviceAssessor assessor, List<ReportSink> sinks, ClockPort clock) {
    this.json = Objects.requireNonNull(json, "json");
    this.assessor = Objects.requireNonNull(assessor, "assessor");
    this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Grades the files and publishes the batch.
   *
   * @param files saved telemetry documents
   * @return the graded batch
   * @throws IOException when a report sink fails
   */
  public ScanReport run(List<Path> files) throws IOException {
    MDC.put("pipeline", "grade");
    try {
      List<DeviceReport> reports = new ArrayList<>(files.size());
      for (Path file : files) {
        reports.add(gradeFile(file));
      }
      ScanReport report = new ScanReport(clock.nowMillis(), reports);
      log.info("Graded {} saved telemetry file(s)", reports.size());
      for (ReportSink sink : sinks) {
        sink.publish(report.devices());
      }
      return report;
    } finally {
      MDC.remove("pipeline");
    }
  }

  DeviceReport gradeFile(Path file) {
    String fallbackPath = file.toString();
    RawTelemetry raw;
    try {
      String text = Files.readString(file, StandardCharsets.UTF_8);
      Map<String, Object> document = json.parseObject(text);
      raw = RawTelemetry.of(document);
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Unable to read telemetry file {}: {}", file, ex.getMessage());
      return assessor.assess(DeviceIdentity.unidentified(fallbackPath, TransportProtocol.UNKNOWN), RawTelemetry.empty());
    }
    String path = raw.stringAt("device", "name").orElse(fallbackPath);
    TransportProtocol protocol = IdentityResolver.protocol(raw, TransportProtocol.UNKNOWN);
    return assessor.assess(IdentityResolver.resolve(path, protocol, raw), raw);
  }
}
