package org.circulardrives.cdihealth.infrastructure.report;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import org.circulardrives.cdihealth.application.port.ReportSink;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;

/**
 * Prints the graded batch as a fixed-width table, one row per device.
 *
 * @since 0.1.0
 */
public final class ConsoleReportSink implements ReportSink {
  static final String HEADER_FORMAT = "%-14s %-5s %-10s %-28s %-20s %8s %6s %9s  %s";
  private static final String NONE = "-";

  private final Consumer<String> out;

  /**
   * Creates a sink.
   *
   * @param out line printer, e.g. the CLI printer
   */
  public ConsoleReportSink(Consumer<String> out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void publish(List<DeviceReport> reports) {
    out.accept(String.format(Locale.ROOT, HEADER_FORMAT,
        "DEVICE", "PROTO", "VENDOR", "MODEL", "SERIAL", "POH", "TEMP", "TB/YR", "RESULT"));
    for (DeviceReport report : reports) {
      out.accept(row(report));
    }
    if (reports.isEmpty()) {
      out.accept("(no devices discovered)");
    }
  }

  static String row(DeviceReport report) {
    DeviceIdentity id = report.identity();
    CanonicalAttributes attrs = report.attributes();
    String workload = report.grade().workloadTbPerYear().isPresent()
        ? String.format(Locale.ROOT, "%.1f", report.grade().workloadTbPerYear().getAsDouble())
        : NONE;
    return String.format(Locale.ROOT, HEADER_FORMAT,
        id.path(),
        id.protocol().name(),
        clip(id.vendor(), 10),
        clip(id.model(), 28),
        clip(id.serial(), 20),
        attrs.powerOnHours().isPresent() ? Long.toString(attrs.powerOnHours().getAsLong()) : NONE,
        attrs.currentTemperature().isPresent() ? attrs.currentTemperature().getAsLong() + "C" : NONE,
        workload,
        report.grade().label());
  }

  private static String clip(String value, int width) {
    return value.length() <= width ? value : value.substring(0, width - 1) + "~";
  }
}
