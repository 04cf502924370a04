package org.circulardrives.cdihealth.application.port;

import org.circulardrives.cdihealth.domain.command.DiagnosticCommand;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;

/**
 * Catalog of the commands discovery runs.
 *
 * <p>Implementations decide the tool, its path and privilege escalation; discovery only relies on the JSON the
 * commands print.</p>
 *
 * @since 0.1.0
 */
public interface DiagnosticCommands {
  /**
   * Command that lists devices, printing a {@code devices[]} JSON document.
   *
   * @return scan command
   */
  DiagnosticCommand scan();

  /**
   * Command that prints all health telemetry for one device as JSON.
   *
   * @param candidate device to probe
   * @return probe command
   */
  DiagnosticCommand probe(DeviceCandidate candidate);
}
