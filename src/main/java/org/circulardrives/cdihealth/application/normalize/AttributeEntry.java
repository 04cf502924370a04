package org.circulardrives.cdihealth.application.normalize;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One row of a SMART attribute table.
 *
 * @param id attribute ID
 * @param name vendor attribute name; empty string when missing
 * @param normalized normalized value
 * @param worst worst normalized value
 * @param threshold failure threshold
 * @param raw raw counter
 * @param rawString raw value as rendered by the tool, e.g. {@code "30 (Min/Max 25/40)"}
 * @since 0.1.0
 */
public record AttributeEntry(
    int id,
    String name,
    OptionalLong normalized,
    OptionalLong worst,
    OptionalLong threshold,
    OptionalLong raw,
    Optional<String> rawString) {

  public AttributeEntry {
    name = name == null ? "" : name.trim();
    normalized = Objects.requireNonNullElse(normalized, OptionalLong.empty());
    worst = Objects.requireNonNullElse(worst, OptionalLong.empty());
    threshold = Objects.requireNonNullElse(threshold, OptionalLong.empty());
    raw = Objects.requireNonNullElse(raw, OptionalLong.empty());
    rawString = Objects.requireNonNullElse(rawString, Optional.empty());
  }

  /**
   * Selects one column.
   *
   * @param field requested column
   * @return value of the column, or empty when not reported
   */
  public OptionalLong get(AttributeField field) {
    return switch (field) {
      case RAW -> raw;
      case NORMALIZED -> normalized;
      case WORST -> worst;
      case THRESHOLD -> threshold;
    };
  }
}
