package org.circulardrives.cdihealth.domain.telemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Read-only view over the JSON document a diagnostic tool returned for one device.
 * <p><strong>Role:</strong> Domain value consumed by exactly one protocol normalizer.</p>
 * <p><strong>Thread-safety:</strong> The wrapped graph is deep-copied into unmodifiable maps and lists on
 * construction, so instances are immutable.</p>
 *
 * @since 0.1.0
 */
public final class RawTelemetry {
  private static final RawTelemetry EMPTY = new RawTelemetry(Map.of());

  private final Map<String, Object> root;

  private RawTelemetry(Map<String, Object> root) {
    this.root = root;
  }

  /**
   * Wraps a parsed object graph of maps, lists, strings, numbers and booleans.
   *
   * @param root parsed JSON object; {@code null} yields {@link #empty()}
   * @return immutable telemetry view
   */
  public static RawTelemetry of(Map<String, ?> root) {
    if (root == null || root.isEmpty()) {
      return EMPTY;
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> frozen = (Map<String, Object>) freeze(root);
    return new RawTelemetry(frozen);
  }

  /**
   * Returns the telemetry view representing "nothing was read".
   *
   * @return shared empty instance
   */
  public static RawTelemetry empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return root.isEmpty();
  }

  /**
   * Returns the top-level object.
   *
   * @return unmodifiable root map
   */
  public Map<String, Object> root() {
    return root;
  }

  /**
   * Walks nested objects by field name.
   *
   * @param path field names from the root
   * @return value at the path, or empty when any step is missing, {@code null} or not an object
   */
  public Optional<Object> at(String... path) {
    Object current = root;
    for (String segment : path) {
      if (!(current instanceof Map<?, ?> map)) {
        return Optional.empty();
      }
      current = map.get(segment);
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(current);
  }

  /**
   * Resolves a nested object.
   *
   * @param path field names from the root
   * @return object at the path when present and a JSON object
   */
  @SuppressWarnings("unchecked")
  public Optional<Map<String, Object>> objectAt(String... path) {
    return at(path).filter(Map.class::isInstance).map(value -> (Map<String, Object>) value);
  }

  /**
   * Resolves a nested array.
   *
   * @param path field names from the root
   * @return array at the path when present and a JSON array
   */
  @SuppressWarnings("unchecked")
  public Optional<List<Object>> listAt(String... path) {
    return at(path).filter(List.class::isInstance).map(value -> (List<Object>) value);
  }

  /**
   * Resolves a nested string value.
   *
   * @param path field names from the root
   * @return trimmed non-blank string at the path
   */
  public Optional<String> stringAt(String... path) {
    return at(path)
        .filter(value -> value instanceof String || value instanceof Number)
        .map(value -> value.toString().trim())
        .filter(value -> !value.isEmpty());
  }

  private static Object freeze(Object node) {
    if (node instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
      }
      return Collections.unmodifiableMap(copy);
    }
    if (node instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(freeze(element));
      }
      return Collections.unmodifiableList(copy);
    }
    return node;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawTelemetry other)) {
      return false;
    }
    return root.equals(other.root);
  }

  @Override
  public int hashCode() {
    return Objects.hash(root);
  }

  @Override
  public String toString() {
    return "RawTelemetry" + root.keySet();
  }
}
