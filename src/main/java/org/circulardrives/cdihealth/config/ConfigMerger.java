package org.circulardrives.cdihealth.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for a command.
   *
   * @param mode active command
   * @param yaml optional YAML settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives a message whenever a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a key is unknown for the command
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    requireKnown(mode, "YAML", yamlCopy.keySet(), defaultsCopy.keySet());
    requireKnown(mode, "CLI", cliCopy.keySet(), defaultsCopy.keySet());

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    cliCopy.forEach((key, value) -> {
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    });
    return Map.copyOf(merged);
  }

  private static void requireKnown(String mode, String source, Set<String> keys, Set<String> known) {
    if (known.isEmpty()) {
      return;
    }
    for (String key : keys) {
      if (!known.contains(key)) {
        throw new IllegalArgumentException("Unknown " + source + " setting for " + mode + ": " + key);
      }
    }
  }
}
