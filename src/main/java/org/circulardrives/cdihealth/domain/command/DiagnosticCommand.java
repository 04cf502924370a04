package org.circulardrives.cdihealth.domain.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Program and argument vector for one diagnostic tool invocation.
 *
 * @param program executable name or path
 * @param arguments arguments passed verbatim, without shell interpretation
 * @since 0.1.0
 */
public record DiagnosticCommand(String program, List<String> arguments) {
  public DiagnosticCommand {
    Objects.requireNonNull(program, "program");
    if (program.isBlank()) {
      throw new IllegalArgumentException("program must not be blank");
    }
    arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
  }

  /**
   * Full argument vector including the program.
   *
   * @return immutable command line
   */
  public List<String> commandLine() {
    List<String> line = new ArrayList<>(arguments.size() + 1);
    line.add(program);
    line.addAll(arguments);
    return List.copyOf(line);
  }

  @Override
  public String toString() {
    return String.join(" ", commandLine());
  }
}
