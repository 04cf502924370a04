package org.circulardrives.cdihealth.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.circulardrives.cdihealth.config.ConfigMerger;
import org.circulardrives.cdihealth.config.DefaultsForMode;
import org.circulardrives.cdihealth.config.HealthConfig;
import org.circulardrives.cdihealth.config.YamlConfigLoader;
import org.circulardrives.cdihealth.logging.LoggingConfigurator;
import org.slf4j.Logger;

/**
 * Shared argument handling for the configurable commands: logging flags, YAML loading and merge precedence.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Applies {@code --verbose}/{@code --quiet}; verbose wins when both are present.
   *
   * @param input parsed input
   */
  static void applyLogging(CliInput input) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /**
   * Resolves the effective configuration for a command.
   *
   * @param mode command name
   * @param input parsed input
   * @param log logger of the calling command
   * @param usage summary usage printed on argument errors
   * @return resolved configuration or the exit code to return
   */
  static Resolution resolve(String mode, CliInput input, Logger log, String usage) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    if (input.hasFlag("--allow-overwrite")) {
      kv.put("allowOverwrite", "true");
    }
    if (input.hasFlag("--sudo")) {
      kv.put("sudo", "true");
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Resolution.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    HealthConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      config = HealthConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(yaml.isPresent() ? ExitCode.CONFIG_ERROR : ExitCode.INVALID_ARGS);
    }
    if (!input.verbose() && !input.quiet()) {
      if (parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      } else if (parseBoolean(effective, "quiet")) {
        LoggingConfigurator.enableQuietLogging();
      }
    }
    boolean dryRun = input.hasFlag("--dry-run") || parseBoolean(effective, "dryRun");
    return new Resolution(config, effective, dryRun, null);
  }

  /**
   * Outcome of {@link #resolve}.
   *
   * @param config validated configuration; {@code null} on failure
   * @param effective merged flat settings; {@code null} on failure
   * @param dryRun whether to print the plan only
   * @param failure exit code when resolution failed
   */
  record Resolution(HealthConfig config, Map<String, String> effective, boolean dryRun, ExitCode failure) {
    static Resolution failed(ExitCode code) {
      return new Resolution(null, null, false, code);
    }

    boolean ok() {
      return failure == null;
    }
  }
}
