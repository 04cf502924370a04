package org.circulardrives.cdihealth.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.circulardrives.cdihealth.TelemetryFixtures;
import org.circulardrives.cdihealth.application.grading.GradingEngine;
import org.circulardrives.cdihealth.application.json.TelemetryJsonParser;
import org.circulardrives.cdihealth.application.normalize.TelemetryNormalizers;
import org.circulardrives.cdihealth.application.port.MetricsPort;
import org.circulardrives.cdihealth.application.port.ReportSink;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.infrastructure.protocol.ata.AtaTelemetryNormalizer;
import org.circulardrives.cdihealth.infrastructure.protocol.nvme.NvmeTelemetryNormalizer;
import org.circulardrives.cdihealth.infrastructure.protocol.scsi.ScsiTelemetryNormalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OfflineGradeUseCaseTest {
  @TempDir Path tempDir;

  private final List<List<DeviceReport>> published = new ArrayList<>();
  private final OfflineGradeUseCase useCase = new OfflineGradeUseCase(
      new TelemetryJsonParser(),
      new DeviceAssessor(
          new TelemetryNormalizers(List.of(
              new AtaTelemetryNormalizer(), new NvmeTelemetryNormalizer(), new ScsiTelemetryNormalizer())),
          new GradingEngine(ThresholdPolicy.defaults()),
          MetricsPort.NO_OP),
      List.<ReportSink>of(published::add),
      () -> 42L);

  @Test
  void gradesSavedTelemetryInFileOrder() throws Exception {
    Path ssd = write("ssd.json", TelemetryFixtures.text(TelemetryFixtures.ATA_SSD));
    Path nvme = write("nvme.json", TelemetryFixtures.text(TelemetryFixtures.NVME));

    ScanReport report = useCase.run(List.of(ssd, nvme));

    assertEquals(2, report.devices().size());
    DeviceReport first = report.devices().get(0);
    assertEquals("/dev/sdb", first.identity().path());
    assertEquals(TransportProtocol.ATA, first.identity().protocol());
    assertEquals("Pass", first.grade().label());
    assertEquals(9.155, first.grade().workloadTbPerYear().getAsDouble(), 0.001);
    assertEquals("/dev/nvme0", report.devices().get(1).identity().path());
    assertEquals(42L, report.generatedAtMillis());
    assertEquals(1, published.size());
  }

  @Test
  void unreadableFilesBecomeErrorRows() throws Exception {
    Path broken = write("broken.json", "{\"device\": ");
    Path missing = tempDir.resolve("missing.json");

    ScanReport report = useCase.run(List.of(broken, missing));

    assertEquals(List.of(broken.toString(), missing.toString()),
        report.devices().stream().map(device -> device.identity().path()).toList());
    report.devices().forEach(device -> {
      assertEquals("Error/DataReadError", device.grade().label());
      assertFalse(device.attributes().telemetryObtained());
    });
  }

  @Test
  void fileWithoutDeviceNameUsesFilePath() throws Exception {
    String anonymous = TelemetryFixtures.text(TelemetryFixtures.SCSI)
        .replace("\"name\": \"/dev/sdc\", ", "");
    Path file = write("anonymous.json", anonymous);

    DeviceReport report = useCase.gradeFile(file);

    assertEquals(file.toString(), report.identity().path());
    assertEquals(TransportProtocol.SCSI, report.identity().protocol());
    assertEquals("Pass", report.grade().label());
  }

  private Path write(String name, String content) throws Exception {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
