package org.circulardrives.cdihealth.api;

import java.util.List;
import java.util.Locale;
import org.circulardrives.cdihealth.application.discovery.CancellationToken;
import org.circulardrives.cdihealth.application.discovery.DeviceDiscovery;
import org.circulardrives.cdihealth.application.discovery.DiscoveryException;
import org.circulardrives.cdihealth.application.discovery.DiscoveryResult;
import org.circulardrives.cdihealth.config.CompositionRoot;
import org.circulardrives.cdihealth.config.DefaultsForMode;
import org.circulardrives.cdihealth.config.HealthConfig;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.ProbeOutcome;
import org.circulardrives.cdihealth.infrastructure.command.SmartctlCommandCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code discover}: list the drives smartctl can see and whether each one answered a probe, without grading.
 */
public final class DiscoverCli {
  private static final Logger log = LoggerFactory.getLogger(DiscoverCli.class);
  static final String SUMMARY_USAGE =
      "usage: cdi-health discover [smartctl=PATH] [--sudo] [workers=N] [probeTimeoutSeconds=N] "
          + "[ignoreAta|ignoreNvme|ignoreScsi|ignoreUsb=true] [--no-probe] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      cdi-health discover

      Usage:
        cdi-health discover [options]

      Options:
        smartctl=PATH              smartctl executable (default smartctl on PATH)
        sudo=true|--sudo           Run smartctl through non-interactive sudo
        workers=N                  Concurrent probes (default max(4, CPUs))
        probeTimeoutSeconds=N      Per-device time box (default 30)
        ignoreAta=true             Skip ATA/SATA drives (also ignoreNvme, ignoreScsi, ignoreUsb)
        --no-probe                 List scan results only
        config=PATH                YAML file with common/discover sections
        --dry-run                  Print the plan without running smartctl
        --quiet | --verbose        Adjust logging
        --help                     Show this message
      """;
  private static final String ROW_FORMAT = "%-14s %-8s %-10s %-28s %-20s %s";

  private DiscoverCli() {}

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
        ConfigCliUtils.resolve(DefaultsForMode.DISCOVER, input, log, SUMMARY_USAGE);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    HealthConfig config = resolution.config();
    if (resolution.dryRun()) {
      SmartctlCommandCatalog commands =
          new SmartctlCommandCatalog(config.probe().smartctl(), config.probe().sudo());
      CliPrinter.printLines(
          "Discover dry-run: smartctl will not be run.",
          " Scan command      : " + commands.scan(),
          " Workers           : " + config.probe().workers(),
          " Probe timeout     : " + config.probe().probeTimeout().toSeconds() + "s",
          " Ignore filters    : " + config.probe().filter());
      return ExitCode.SUCCESS;
    }
    return execute(new CompositionRoot(config), !input.hasFlag("--no-probe"));
  }

  static ExitCode execute(CompositionRoot root, boolean probe) {
    CancellationToken cancellation = new CancellationToken();
    Thread hook = new Thread(cancellation::cancel, "cdi-discover-cancel");
    Runtime.getRuntime().addShutdownHook(hook);
    try (root) {
      DeviceDiscovery discovery = root.discovery();
      List<DeviceCandidate> candidates = discovery.candidates(root.config().probe().filter());
      if (!probe) {
        CliPrinter.println(String.format(Locale.ROOT, "%-14s %-8s %-6s %s", "DEVICE", "PROTO", "TYPE", "STATUS"));
        for (DeviceCandidate candidate : candidates) {
          CliPrinter.println(String.format(Locale.ROOT, "%-14s %-8s %-6s %s",
              candidate.path(), candidate.protocol(), candidate.deviceType(),
              candidate.openError().map(error -> "open error: " + error).orElse("ok")));
        }
        return ExitCode.SUCCESS;
      }
      DiscoveryResult result = discovery.probeAll(candidates, cancellation);
      CliPrinter.println(String.format(Locale.ROOT, ROW_FORMAT,
          "DEVICE", "PROTO", "VENDOR", "MODEL", "SERIAL", "STATUS"));
      for (ProbeOutcome outcome : result.outcomes()) {
        DeviceIdentity id = outcome.identity();
        String status = outcome.succeeded()
            ? "ok"
            : outcome.failureKind().orElseThrow() + outcome.failureMessage().map(m -> ": " + m).orElse("");
        CliPrinter.println(String.format(Locale.ROOT, ROW_FORMAT,
            id.path(), id.protocol(), id.vendor(), id.model(), id.serial(), status));
      }
      return ExitCode.SUCCESS;
    } catch (DiscoveryException ex) {
      log.error("Device discovery failed: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Discovery interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during discovery", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      ScanCli.removeHook(hook);
    }
  }
}
