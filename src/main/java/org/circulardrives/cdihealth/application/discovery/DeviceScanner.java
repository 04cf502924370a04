package org.circulardrives.cdihealth.application.discovery;

import java.util.List;
import java.util.Objects;
import org.circulardrives.cdihealth.application.port.CommandExecutionException;
import org.circulardrives.cdihealth.application.port.CommandExecutor;
import org.circulardrives.cdihealth.application.port.DiagnosticCommands;
import org.circulardrives.cdihealth.domain.command.CommandResult;
import org.circulardrives.cdihealth.domain.command.DiagnosticCommand;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the scan command and returns the filtered candidate list.
 *
 * @since 0.1.0
 */
public final class DeviceScanner {
  private static final Logger log = LoggerFactory.getLogger(DeviceScanner.class);

  private final CommandExecutor executor;
  private final DiagnosticCommands commands;
  private final DeviceScanParser parser;

  public DeviceScanner(CommandExecutor executor, DiagnosticCommands commands, DeviceScanParser parser) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.commands = Objects.requireNonNull(commands, "commands");
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  /**
   * Enumerates devices.
   *
   * @param filter ignore filters applied before probing
   * @return candidates in scan order
   * @throws DiscoveryException when the scan command cannot run or prints no usable device list
   * @throws InterruptedException when interrupted while waiting for the scan command
   */
  public List<DeviceCandidate> scan(DiscoveryFilter filter) throws DiscoveryException, InterruptedException {
    DiagnosticCommand command = commands.scan();
    CommandResult result;
    try {
      result = executor.execute(command);
    } catch (CommandExecutionException ex) {
      throw new DiscoveryException("Device scan failed to run: " + ex.getMessage(), ex);
    }
    String stdout = result.stdoutText();
    if (stdout.isBlank()) {
      throw new DiscoveryException("Device scan produced no output (exit " + result.exitCode() + "): "
          + Logs.truncate(result.stderrText().strip(), 512));
    }
    if (result.exitCode() != 0) {
      log.warn("Device scan exited with status {}; using its output anyway", result.exitCode());
    }
    try {
      return parser.parse(stdout, filter);
    } catch (IllegalArgumentException ex) {
      throw new DiscoveryException("Device scan output is unusable: " + ex.getMessage(), ex);
    }
  }
}
