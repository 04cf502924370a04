package org.circulardrives.cdihealth.infrastructure.report;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.application.port.ClockPort;
import org.circulardrives.cdihealth.application.port.ReportSink;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.grading.GradeResult;
import org.circulardrives.cdihealth.domain.grading.GradeStatus;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.SelfTestOutcome;
import org.circulardrives.cdihealth.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes the graded batch as a JSON document.
 * <p><strong>Role:</strong> {@link ReportSink} behind {@code out=PATH}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit one entry per device with identity, grade and the attributes that were reported.</li>
 *   <li>Omit attributes the device did not report instead of writing zero.</li>
 *   <li>Write to a sibling temporary file and move it into place so readers never see a partial report.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one publish per scan.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportWriter implements ReportSink {
  private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);
  static final int SCHEMA_VERSION = 1;

  private static final JsonFactory SHARED_FACTORY = new JsonFactory();

  private final Path target;
  private final boolean allowOverwrite;
  private final ClockPort clock;

  /**
   * Creates a writer.
   *
   * @param target report file
   * @param allowOverwrite whether an existing report may be replaced
   * @param clock source of the {@code generatedAt} stamp
   */
  public JsonReportWriter(Path target, boolean allowOverwrite, ClockPort clock) {
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath().normalize();
    this.allowOverwrite = allowOverwrite;
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  public Path target() {
    return target;
  }

  @Override
  public void publish(List<DeviceReport> reports) throws IOException {
    Objects.requireNonNull(reports, "reports");
    try {
      Paths.validateOutputFile(target, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      throw new IOException(ex.getMessage(), ex);
    }
    Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
           JsonGenerator gen = SHARED_FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
        gen.useDefaultPrettyPrinter();
        write(gen, reports, clock.nowMillis());
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.info("Wrote report for {} device(s) to {}", reports.size(), target);
  }

  /**
   * Renders the report document as a string, e.g. for the console.
   *
   * @param reports graded devices
   * @param generatedAtMillis epoch milliseconds stamped into the document
   * @return pretty-printed JSON
   */
  public static String render(List<DeviceReport> reports, long generatedAtMillis) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = SHARED_FACTORY.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      write(gen, reports, generatedAtMillis);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toString();
  }

  private static void write(JsonGenerator gen, List<DeviceReport> reports, long generatedAtMillis)
      throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
    gen.writeStringField("generatedAt", Instant.ofEpochMilli(generatedAtMillis).toString());
    writeSummary(gen, reports);
    gen.writeArrayFieldStart("devices");
    for (DeviceReport report : reports) {
      gen.writeStartObject();
      writeIdentity(gen, report.identity());
      writeGrade(gen, report.grade());
      writeAttributes(gen, report.attributes());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeSummary(JsonGenerator gen, List<DeviceReport> reports) throws IOException {
    long pass = 0;
    long fail = 0;
    long error = 0;
    long flagged = 0;
    for (DeviceReport report : reports) {
      GradeStatus status = report.grade().status();
      if (status == GradeStatus.PASS) {
        pass++;
      } else if (status == GradeStatus.FAIL) {
        fail++;
      } else {
        error++;
      }
      if (report.grade().flagged()) {
        flagged++;
      }
    }
    gen.writeObjectFieldStart("summary");
    gen.writeNumberField("devices", reports.size());
    gen.writeNumberField("pass", pass);
    gen.writeNumberField("flagged", flagged);
    gen.writeNumberField("fail", fail);
    gen.writeNumberField("error", error);
    gen.writeEndObject();
  }

  private static void writeIdentity(JsonGenerator gen, DeviceIdentity identity) throws IOException {
    gen.writeObjectFieldStart("device");
    gen.writeStringField("path", identity.path());
    gen.writeStringField("protocol", identity.protocol().name());
    gen.writeStringField("vendor", identity.vendor());
    gen.writeStringField("model", identity.model());
    gen.writeStringField("serial", identity.serial());
    gen.writeStringField("firmware", identity.firmware());
    writeOptional(gen, "capacityBytes", identity.capacityBytes());
    writeOptional(gen, "logicalBlockSize", identity.logicalBlockSize());
    gen.writeStringField("mediaType", identity.mediaType().name());
    gen.writeEndObject();
  }

  private static void writeGrade(JsonGenerator gen, GradeResult grade) throws IOException {
    gen.writeObjectFieldStart("grade");
    gen.writeStringField("status", grade.status().name());
    gen.writeStringField("label", grade.label());
    if (grade.failureReason().isPresent()) {
      gen.writeStringField("failureReason", grade.failureReason().get().label());
    }
    if (grade.flagReason().isPresent()) {
      gen.writeStringField("flagReason", grade.flagReason().get().label());
    }
    OptionalDouble workload = grade.workloadTbPerYear();
    if (workload.isPresent()) {
      gen.writeNumberField("workloadTbPerYear", Math.round(workload.getAsDouble() * 100.0) / 100.0);
    }
    gen.writeEndObject();
  }

  private static void writeAttributes(JsonGenerator gen, CanonicalAttributes attrs) throws IOException {
    gen.writeObjectFieldStart("attributes");
    gen.writeBooleanField("telemetryObtained", attrs.telemetryObtained());
    writeOptional(gen, "pendingSectors", attrs.pendingSectors());
    writeOptional(gen, "reallocatedSectors", attrs.reallocatedSectors());
    writeOptional(gen, "uncorrectableErrors", attrs.uncorrectableErrors());
    writeOptional(gen, "percentUsed", attrs.percentUsed());
    writeOptional(gen, "availableSparePct", attrs.availableSparePct());
    writeOptional(gen, "powerOnHours", attrs.powerOnHours());
    writeOptional(gen, "hostReadsBytes", attrs.hostReadsBytes());
    writeOptional(gen, "hostWritesBytes", attrs.hostWritesBytes());
    writeOptional(gen, "currentTemperature", attrs.currentTemperature());
    writeOptional(gen, "highestTemperature", attrs.highestTemperature());
    writeOptional(gen, "warningTempMinutes", attrs.warningTempMinutes());
    writeOptional(gen, "criticalTempMinutes", attrs.criticalTempMinutes());
    writeOptional(gen, "startStopCount", attrs.startStopCount());
    writeOptional(gen, "powerCycleCount", attrs.powerCycleCount());
    Optional<Boolean> smart = attrs.smartStatus();
    if (smart.isPresent()) {
      gen.writeBooleanField("smartStatusPassed", smart.get());
    }
    gen.writeArrayFieldStart("selfTests");
    for (SelfTestOutcome outcome : attrs.selfTestOutcomes()) {
      gen.writeString(outcome.name());
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeOptional(JsonGenerator gen, String name, OptionalLong value) throws IOException {
    if (value.isPresent()) {
      gen.writeNumberField(name, value.getAsLong());
    }
  }
}
