package org.circulardrives.cdihealth.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a YAML configuration file and flattens the {@code common} section plus one command section into dotted
 * keys, so {@code policy: {pendingSectorsMax: 5}} becomes {@code policy.pendingSectorsMax=5}.
 *
 * <pre>
 * common:
 *   smartctl: /usr/sbin/smartctl
 *   sudo: true
 * scan:
 *   workers: 8
 *   policy:
 *     availableSpareMin: 95
 * </pre>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} for {@code mode}; mode keys override common keys.
   *
   * @param path YAML file
   * @param mode command name ({@code scan}, {@code discover}, {@code grade})
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or uses sequences
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = mapping(document, "root");
    Map<String, String> flat = new LinkedHashMap<>();
    Object common = section(root, "common");
    if (common != null) {
      flatten(mapping(common, "common"), "", flat);
    }
    Object modeSection = section(root, section);
    if (modeSection != null) {
      flatten(mapping(modeSection, section), "", flat);
    }
    return Optional.of(Map.copyOf(flat));
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(name.trim(), value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML sequences are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    });
  }
}
