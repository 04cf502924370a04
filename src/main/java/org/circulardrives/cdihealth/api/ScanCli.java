package org.circulardrives.cdihealth.api;

import java.io.IOException;
import java.util.List;
import org.circulardrives.cdihealth.application.discovery.CancellationToken;
import org.circulardrives.cdihealth.application.discovery.DiscoveryException;
import org.circulardrives.cdihealth.application.pipeline.ScanReport;
import org.circulardrives.cdihealth.application.port.ReportSink;
import org.circulardrives.cdihealth.config.CompositionRoot;
import org.circulardrives.cdihealth.config.DefaultsForMode;
import org.circulardrives.cdihealth.config.HealthConfig;
import org.circulardrives.cdihealth.config.ProbeConfig;
import org.circulardrives.cdihealth.domain.grading.GradeStatus;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.infrastructure.command.SmartctlCommandCatalog;
import org.circulardrives.cdihealth.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code scan}: discover every drive, probe it, grade it and report the batch.
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  static final String SUMMARY_USAGE =
      "usage: cdi-health scan [out=PATH] [format=table|json|none] [workers=N] [probeTimeoutSeconds=N] "
          + "[smartctl=PATH] [--sudo] [ignoreAta|ignoreNvme|ignoreScsi|ignoreUsb=true] [policy.KEY=VALUE] "
          + "[config=PATH] [--dry-run] [--allow-overwrite] [--quiet|--verbose]";
  private static final String HELP_TEXT = """
      cdi-health scan

      Usage:
        cdi-health scan [options]

      Discovery:
        smartctl=PATH              smartctl executable (default smartctl on PATH)
        sudo=true|--sudo           Run smartctl through non-interactive sudo
        workers=N                  Concurrent probes (default max(4, CPUs))
        probeTimeoutSeconds=N      Per-device time box (default 30)
        ignoreAta=true             Skip ATA/SATA drives (also ignoreNvme, ignoreScsi, ignoreUsb)

      Grading thresholds:
        policy.pendingSectorsMax=10       policy.reallocatedSectorsMax=10
        policy.uncorrectableErrorsMax=10  policy.percentUsedMax=100
        policy.availableSpareMin=97       policy.workloadTbPerYearMax=550
        policy.warningTempMinutesMax=60   policy.criticalTempMinutesMax=0

      Output:
        format=table|json|none     Console rendering (default table)
        out=PATH                   Also write the JSON report to PATH
        --allow-overwrite          Replace an existing report file

      General:
        config=PATH                YAML file with common/scan sections
        metricsExporter=otlp|none  Metrics export (default none)
        otelEndpoint=URL           OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated resource attributes
        --dry-run                  Print the plan without touching devices
        --quiet                    Only log warnings and errors
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ScanCli() {}

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
        ConfigCliUtils.resolve(DefaultsForMode.SCAN, input, log, SUMMARY_USAGE);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    HealthConfig config = resolution.config();
    try {
      config.out().ifPresent(path -> Paths.validateOutputFile(path, config.allowOverwrite()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid report path: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    if (resolution.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return execute(new CompositionRoot(config));
  }

  static ExitCode execute(CompositionRoot root) {
    HealthConfig config = root.config();
    CancellationToken cancellation = new CancellationToken();
    Thread hook = new Thread(cancellation::cancel, "cdi-scan-cancel");
    Runtime.getRuntime().addShutdownHook(hook);
    try (root) {
      List<ReportSink> sinks = root.reportSinks(CliPrinter::println);
      log.info("Starting scan with {} worker(s), probe timeout {}s",
          config.probe().workers(), config.probe().probeTimeout().toSeconds());
      ScanReport report = root.healthScan(sinks).run(config.probe().filter(), cancellation);
      log.info("Scan finished: {} device(s), {} failing, {} unreadable",
          report.devices().size(), report.count(GradeStatus.FAIL), report.count(GradeStatus.ERROR));
      return ExitCode.SUCCESS;
    } catch (DiscoveryException ex) {
      log.error("Device discovery failed: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Unable to write scan report", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Scan interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Scan configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during scan", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeHook(hook);
    }
  }

  static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; cancel hook left in place");
    }
  }

  private static void printDryRunPlan(HealthConfig config) {
    ProbeConfig probe = config.probe();
    ThresholdPolicy policy = config.policy();
    SmartctlCommandCatalog commands = new SmartctlCommandCatalog(probe.smartctl(), probe.sudo());
    CliPrinter.printLines(
        "Scan dry-run: no devices will be probed.",
        " Scan command      : " + commands.scan(),
        " Workers           : " + probe.workers(),
        " Probe timeout     : " + probe.probeTimeout().toSeconds() + "s",
        " Ignore filters    : " + probe.filter(),
        " Policy            : " + policy,
        " Console format    : " + config.format(),
        " Report file       : " + config.out().map(Object::toString).orElse("<none>"),
        " Allow overwrite   : " + config.allowOverwrite(),
        " Metrics exporter  : " + config.metrics().exporter(),
        " Re-run without --dry-run to scan devices.");
  }
}
