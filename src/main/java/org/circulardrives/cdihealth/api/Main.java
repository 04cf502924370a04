package org.circulardrives.cdihealth.api;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code cdi-health} dispatcher that routes to subcommands.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: cdi-health <scan|discover|grade|version> [options]";
  private static final String HELP_TEXT = """
      cdi-health: drive health assessment for refurbishment and reuse

      Usage:
        cdi-health <command> [options]

      Commands:
        scan       Discover, probe and grade every drive (scan --help for details)
        discover   List drives and probe outcomes without grading
        grade      Grade saved smartctl JSON documents offline
        version    Print the version

      Global flags:
        --help     Show this message
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the subcommand
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      if (CliInput.parse(safeArgs).help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    List<String> rest = new ArrayList<>(List.of(safeArgs).subList(0, commandIndex));
    rest.addAll(List.of(safeArgs).subList(commandIndex + 1, safeArgs.length));
    String[] delegateArgs = rest.toArray(String[]::new);

    return switch (command) {
      case "scan" -> ScanCli.run(delegateArgs);
      case "discover" -> DiscoverCli.run(delegateArgs);
      case "grade" -> GradeCli.run(delegateArgs);
      case "version" -> {
        CliPrinter.println("cdi-health " + version());
        yield ExitCode.SUCCESS;
      }
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  static String version() {
    Package pkg = Main.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = Main.class.getResourceAsStream(
        "/META-INF/maven/org.circulardrives/cdi-health/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        return props.getProperty("version", "0.0.0-dev");
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }
}
