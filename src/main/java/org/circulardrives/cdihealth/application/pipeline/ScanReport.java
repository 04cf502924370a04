package org.circulardrives.cdihealth.application.pipeline;

import java.util.List;
import java.util.Objects;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.grading.GradeStatus;

/**
 * Graded batch plus its generation time.
 *
 * @param generatedAtMillis epoch milliseconds when the batch finished
 * @param devices one report per device, in discovery order
 * @since 0.1.0
 */
public record ScanReport(long generatedAtMillis, List<DeviceReport> devices) {
  public ScanReport {
    devices = List.copyOf(Objects.requireNonNull(devices, "devices"));
  }

  public long count(GradeStatus status) {
    return devices.stream().filter(report -> report.grade().status() == status).count();
  }

  public long flaggedCount() {
    return devices.stream().filter(report -> report.grade().flagged()).count();
  }
}
