package org.circulardrives.cdihealth.infrastructure.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.circulardrives.cdihealth.application.port.DiagnosticCommands;
import org.circulardrives.cdihealth.domain.command.DiagnosticCommand;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;

/**
 * smartmontools command lines: {@code smartctl --scan-open --json} to enumerate devices and
 * {@code smartctl --xall --json [-d TYPE] PATH} to probe one.
 *
 * <p>When {@code sudo} is enabled every command is prefixed with {@code sudo -n} so a missing credential fails
 * fast instead of prompting.</p>
 *
 * @since 0.1.0
 */
public final class SmartctlCommandCatalog implements DiagnosticCommands {
  /** Default executable, resolved on {@code PATH}. */
  public static final String DEFAULT_SMARTCTL = "smartctl";

  private final String smartctl;
  private final boolean sudo;

  /**
   * Creates a catalog.
   *
   * @param smartctl smartctl executable name or path
   * @param sudo whether to run commands through non-interactive sudo
   */
  public SmartctlCommandCatalog(String smartctl, boolean sudo) {
    Objects.requireNonNull(smartctl, "smartctl");
    if (smartctl.isBlank()) {
      throw new IllegalArgumentException("smartctl path must not be blank");
    }
    this.smartctl = smartctl.trim();
    this.sudo = sudo;
  }

  @Override
  public DiagnosticCommand scan() {
    return command(List.of("--scan-open", "--json"));
  }

  @Override
  public DiagnosticCommand probe(DeviceCandidate candidate) {
    List<String> args = new ArrayList<>(List.of("--xall", "--json"));
    if (!candidate.deviceType().isEmpty()) {
      args.add("-d");
      args.add(candidate.deviceType());
    }
    args.add(candidate.path());
    return command(args);
  }

  private DiagnosticCommand command(List<String> args) {
    if (!sudo) {
      return new DiagnosticCommand(smartctl, args);
    }
    List<String> elevated = new ArrayList<>(args.size() + 2);
    elevated.add("-n");
    elevated.add(smartctl);
    elevated.addAll(args);
    return new DiagnosticCommand("sudo", elevated);
  }
}
