package org.circulardrives.cdihealth.application.discovery;

import java.util.Map;
import java.util.Objects;
import org.circulardrives.cdihealth.application.json.TelemetryJsonParser;
import org.circulardrives.cdihealth.application.normalize.IdentityResolver;
import org.circulardrives.cdihealth.application.port.CommandExecutionException;
import org.circulardrives.cdihealth.application.port.CommandExecutor;
import org.circulardrives.cdihealth.application.port.DiagnosticCommands;
import org.circulardrives.cdihealth.domain.command.CommandResult;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.ProbeFailureKind;
import org.circulardrives.cdihealth.domain.device.ProbeOutcome;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.circulardrives.cdihealth.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads raw telemetry and identity for one device.
 * <p><strong>Role:</strong> Per-device step scheduled by {@link ProbeScheduler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the probe command and classify fatal exit statuses.</li>
 *   <li>Parse the JSON output into {@link RawTelemetry}.</li>
 *   <li>Detect the protocol when the scan could not and resolve the device identity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent probes of
 * different devices.</p>
 *
 * @since 0.1.0
 */
public final class DeviceProber {
  private static final Logger log = LoggerFactory.getLogger(DeviceProber.class);
  /** smartctl exit bits 0 (command line) and 1 (device open); higher bits describe drive health. */
  static final int FATAL_EXIT_BITS = 0x03;
  private static final int MAX_ERROR_BYTES = 512;

  private final CommandExecutor executor;
  private final DiagnosticCommands commands;
  private final TelemetryJsonParser json;

  public DeviceProber(CommandExecutor executor, DiagnosticCommands commands, TelemetryJsonParser json) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.commands = Objects.requireNonNull(commands, "commands");
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Probes a device.
   *
   * @param candidate reachable candidate
   * @return successful outcome with identity and telemetry
   * @throws ProbeException when the command fails or its output is unusable
   * @throws InterruptedException when interrupted while the command runs
   */
  public ProbeOutcome probe(DeviceCandidate candidate) throws ProbeException, InterruptedException {
    CommandResult result;
    try {
      result = executor.execute(commands.probe(candidate));
    } catch (CommandExecutionException ex) {
      throw new ProbeException(ProbeFailureKind.COMMAND_FAILED, ex.getMessage(), ex);
    }
    if ((result.exitCode() & FATAL_EXIT_BITS) != 0) {
      throw new ProbeException(
          ProbeFailureKind.COMMAND_FAILED,
          "probe exited with status " + result.exitCode() + ": "
              + Logs.truncate(result.stderrText().strip(), MAX_ERROR_BYTES));
    }
    String stdout = result.stdoutText();
    if (stdout.isBlank()) {
      throw new ProbeException(ProbeFailureKind.UNPARSEABLE, "probe produced no output");
    }
    Map<String, Object> document;
    try {
      document = json.parseObject(stdout);
    } catch (IllegalArgumentException ex) {
      throw new ProbeException(ProbeFailureKind.UNPARSEABLE, ex.getMessage(), ex);
    }
    RawTelemetry raw = RawTelemetry.of(document);
    TransportProtocol protocol = IdentityResolver.protocol(raw, candidate.protocol());
    DeviceIdentity identity = IdentityResolver.resolve(candidate.path(), protocol, raw);
    log.debug("Probed {} as {} {} serial {} (exit {}, {} ms)", candidate.path(), protocol, identity.model(),
        Logs.maskSerial(identity.serial()), result.exitCode(), result.duration().toMillis());
    return ProbeOutcome.success(candidate, identity, raw);
  }
}
