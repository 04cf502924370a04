package org.circulardrives.cdihealth.application.port;

import org.circulardrives.cdihealth.domain.command.CommandResult;
import org.circulardrives.cdihealth.domain.command.DiagnosticCommand;

/**
 * <strong>What:</strong> Port for running diagnostic binaries such as smartctl.
 * <p><strong>Why:</strong> Discovery depends on the tool's output format, never on how it is launched.</p>
 * <p><strong>Role:</strong> Implemented by {@code ProcessCommandExecutor}; tests supply canned results.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from probe workers.</p>
 * <p><strong>Observability:</strong> Implementations log the command line at DEBUG.</p>
 *
 * @since 0.1.0
 */
public interface CommandExecutor {
  /**
   * Runs a command to completion.
   *
   * @param command command to run; must not be {@code null}
   * @return exit status, captured output and duration; a non-zero exit status is not an exception
   * @throws CommandExecutionException if the command cannot be started or its output cannot be read
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  CommandResult execute(DiagnosticCommand command) throws CommandExecutionException, InterruptedException;
}
