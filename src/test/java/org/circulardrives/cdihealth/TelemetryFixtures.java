package org.circulardrives.cdihealth;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.circulardrives.cdihealth.application.grading.GradingEngine;
import org.circulardrives.cdihealth.application.json.TelemetryJsonParser;
import org.circulardrives.cdihealth.application.normalize.IdentityResolver;
import org.circulardrives.cdihealth.application.pipeline.DeviceAssessor;
import org.circulardrives.cdihealth.application.port.MetricsPort;
import org.circulardrives.cdihealth.config.CompositionRoot;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;

/**
 * Loads captured diagnostic tool output from {@code src/test/resources/fixtures}.
 */
public final class TelemetryFixtures {
  public static final String ATA_HDD = "ata-hdd.json";
  public static final String ATA_SSD = "ata-ssd.json";
  public static final String NVME = "nvme.json";
  public static final String SCSI = "scsi.json";
  public static final String SCAN = "scan-open.json";

  private static final TelemetryJsonParser PARSER = new TelemetryJsonParser();

  private TelemetryFixtures() {}

  public static String text(String name) {
    try (InputStream in = TelemetryFixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalStateException("missing fixture " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  public static Map<String, Object> document(String name) {
    return PARSER.parseObject(text(name));
  }

  public static RawTelemetry raw(String name) {
    return RawTelemetry.of(document(name));
  }

  /** Grades a fixture with the default policy. */
  public static DeviceReport report(String name, String path, TransportProtocol protocol) {
    RawTelemetry raw = raw(name);
    DeviceAssessor assessor = new DeviceAssessor(
        CompositionRoot.normalizers(), new GradingEngine(ThresholdPolicy.defaults()), MetricsPort.NO_OP);
    return assessor.assess(IdentityResolver.resolve(path, protocol, raw), raw);
  }
}
