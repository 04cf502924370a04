package org.circulardrives.cdihealth.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.circulardrives.cdihealth.TelemetryFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class GradeCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Path hdd;
  private Path nvme;

  @BeforeEach
  void setUp() throws IOException {
    logger = (Logger) LoggerFactory.getLogger(GradeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    hdd = Files.writeString(tempDir.resolve("sda.json"), TelemetryFixtures.text(TelemetryFixtures.ATA_HDD));
    nvme = Files.writeString(tempDir.resolve("nvme0.json"), TelemetryFixtures.text(TelemetryFixtures.NVME));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void gradesSavedFilesAsTable() {
    ExitCode code = GradeCli.run(new String[] {"file=" + hdd + "," + nvme});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.startsWith("DEVICE"));
    assertTrue(out.contains("/dev/sda"));
    assertTrue(out.contains("/dev/nvme0"));
  }

  @Test
  void jsonFormatPrintsReportDocument() {
    ExitCode code = GradeCli.run(new String[] {"file=" + nvme, "format=json"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("\"schemaVersion\" : 1"));
    assertTrue(buffer.toString().contains("\"status\" : \"PASS\""));
  }

  @Test
  void unreadableFileBecomesErrorRow() throws IOException {
    Path broken = Files.writeString(tempDir.resolve("broken.json"), "{ not json");

    ExitCode code = GradeCli.run(new String[] {"file=" + broken});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Error/DataReadError"));
  }

  @Test
  void writesReportFileAndRefusesToOverwriteIt() throws IOException {
    Path out = tempDir.resolve("graded.json");

    assertEquals(ExitCode.SUCCESS, GradeCli.run(new String[] {"file=" + hdd, "out=" + out, "format=none"}));
    assertTrue(Files.readString(out).contains("\"serial\" : \"ZC1A2B3C\""));
    assertEquals("", buffer.toString());

    assertEquals(ExitCode.INVALID_ARGS, GradeCli.run(new String[] {"file=" + hdd, "out=" + out}));
    assertTrue(hasLogContaining("already exists"));

    assertEquals(ExitCode.SUCCESS,
        GradeCli.run(new String[] {"file=" + hdd, "out=" + out, "format=none", "--allow-overwrite"}));
  }

  @Test
  void missingFileArgumentIsInvalid() {
    ExitCode code = GradeCli.run(new String[] {"format=json"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: cdi-health grade"));
    assertTrue(hasLogContaining("grade requires file=PATH"));
  }

  @Test
  void malformedArgumentIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, GradeCli.run(new String[] {"file"}));
    assertTrue(hasLogContaining("Invalid argument"));
  }

  @Test
  void dryRunReportsReadabilityWithoutGrading() {
    Path missing = tempDir.resolve("missing.json");

    ExitCode code = GradeCli.run(new String[] {"file=" + hdd + "," + missing, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Grade dry-run: 2 file(s) will not be read."));
    assertTrue(out.contains(hdd + " (readable)"));
    assertTrue(out.contains("input file does not exist"));
    assertFalse(out.contains("DEVICE"));
  }

  @Test
  void yamlConfigSuppliesPolicyAndFormat() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("cdi.yaml"), """
        grade:
          format: json
          policy:
            percentUsedMax: 1
        """);

    ExitCode code = GradeCli.run(new String[] {"config=" + yaml, "file=" + nvme});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("\"failureReason\" : \"PercentUsed\""));
  }

  @Test
  void unknownYamlKeyIsConfigError() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("bad.yaml"), """
        grade:
          iface: en0
        """);

    assertEquals(ExitCode.CONFIG_ERROR, GradeCli.run(new String[] {"config=" + yaml, "file=" + nvme}));
    assertTrue(hasLogContaining("Unknown YAML setting for grade: iface"));
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode code = GradeCli.run(new String[] {"config=" + tempDir.resolve("nope.yaml"), "file=" + nvme});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("Configuration file does not exist"));
  }

  private boolean hasLogContaining(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
