package org.circulardrives.cdihealth.api;

import java.io.IOException;
import java.nio.file.Path;
import org.circulardrives.cdihealth.application.pipeline.ScanReport;
import org.circulardrives.cdihealth.config.CompositionRoot;
import org.circulardrives.cdihealth.config.DefaultsForMode;
import org.circulardrives.cdihealth.config.HealthConfig;
import org.circulardrives.cdihealth.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code grade}: grade telemetry saved earlier with {@code smartctl --xall --json}, without touching devices.
 */
public final class GradeCli {
  private static final Logger log = LoggerFactory.getLogger(GradeCli.class);
  static final String SUMMARY_USAGE =
      "usage: cdi-health grade file=PATH[,PATH...] [out=PATH] [format=table|json|none] [policy.KEY=VALUE] "
          + "[config=PATH] [--dry-run] [--allow-overwrite] [--quiet|--verbose]";
  private static final String HELP_TEXT = """
      cdi-health grade

      Usage:
        cdi-health grade file=sda.json,nvme0.json [options]

      Required:
        file=PATH[,PATH...]        Saved smartctl --xall --json documents

      Optional:
        policy.KEY=VALUE           Override a grading threshold (see scan --help)
        format=table|json|none     Console rendering (default table)
        out=PATH                   Also write the JSON report to PATH
        --allow-overwrite          Replace an existing report file
        config=PATH                YAML file with common/grade sections
        --dry-run                  Print the plan without grading
        --quiet | --verbose        Adjust logging
        --help                     Show this message

      Files that cannot be read or parsed are reported as Error/DataReadError.
      """;

  private GradeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    ConfigCliUtils.applyLogging(input);
    ConfigCliUtils.Resolution resolution =
        ConfigCliUtils.resolve(DefaultsForMode.GRADE, input, log, SUMMARY_USAGE);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    HealthConfig config = resolution.config();
    if (config.files().isEmpty()) {
      log.error("grade requires file=PATH");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    try {
      config.out().ifPresent(path -> Paths.validateOutputFile(path, config.allowOverwrite()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid report path: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    if (resolution.dryRun()) {
      CliPrinter.println("Grade dry-run: " + config.files().size() + " file(s) will not be read.");
      for (Path file : config.files()) {
        CliPrinter.println(" File              : " + file + " (" + readability(file) + ")");
      }
      CliPrinter.printLines(
          " Policy            : " + config.policy(),
          " Console format    : " + config.format(),
          " Report file       : " + config.out().map(Object::toString).orElse("<none>"));
      return ExitCode.SUCCESS;
    }
    try (CompositionRoot root = new CompositionRoot(config)) {
      ScanReport report = root.offlineGrade(root.reportSinks(CliPrinter::println)).run(config.files());
      log.debug("Graded {} file(s)", report.devices().size());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to write grade report", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while grading", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static String readability(Path file) {
    try {
      Paths.requireReadableFile(file);
      return "readable";
    } catch (IllegalArgumentException ex) {
      return ex.getMessage();
    }
  }
}
