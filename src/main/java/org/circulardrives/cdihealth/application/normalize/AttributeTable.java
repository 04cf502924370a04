package org.circulardrives.cdihealth.application.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;

/**
 * <strong>What:</strong> Lookup of SMART attributes by numeric ID with a name fallback.
 * <p><strong>Why:</strong> Vendors reuse names inconsistently but IDs are structured; every ATA extraction goes
 * through this one helper so the precedence rule lives in a single place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse {@code ata_smart_attributes.table[]} rows, skipping rows without a usable ID.</li>
 *   <li>Return the first row whose ID matches; only when none does, the first row whose name matches.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built.</p>
 *
 * @since 0.1.0
 */
public final class AttributeTable {
  private static final AttributeTable EMPTY = new AttributeTable(List.of());

  private final List<AttributeEntry> entries;

  private AttributeTable(List<AttributeEntry> entries) {
    this.entries = List.copyOf(entries);
  }

  /**
   * Builds the table from ATA telemetry.
   *
   * @param raw raw telemetry
   * @return parsed table; empty when the device exposes no attribute table
   */
  public static AttributeTable from(RawTelemetry raw) {
    return raw.listAt("ata_smart_attributes", "table").map(AttributeTable::fromRows).orElse(EMPTY);
  }

  /**
   * Builds the table from already extracted rows.
   *
   * @param rows JSON rows
   * @return parsed table
   */
  public static AttributeTable fromRows(List<?> rows) {
    List<AttributeEntry> parsed = new ArrayList<>(rows.size());
    for (Object row : rows) {
      if (!(row instanceof Map<?, ?> map)) {
        continue;
      }
      OptionalLong id = TelemetryValues.asCount(map.get("id"));
      if (id.isEmpty() || id.getAsLong() > 255) {
        continue;
      }
      Object name = map.get("name");
      Object rawNode = map.get("raw");
      OptionalLong rawValue = OptionalLong.empty();
      Optional<String> rawString = Optional.empty();
      if (rawNode instanceof Map<?, ?> rawMap) {
        rawValue = TelemetryValues.asCount(rawMap.get("value"));
        Object text = rawMap.get("string");
        if (text instanceof String s && !s.isBlank()) {
          rawString = Optional.of(s.trim());
        }
      } else {
        rawValue = TelemetryValues.asCount(rawNode);
      }
      parsed.add(new AttributeEntry(
          (int) id.getAsLong(),
          name instanceof String s ? s : "",
          TelemetryValues.asCount(map.get("value")),
          TelemetryValues.asCount(map.get("worst")),
          TelemetryValues.asCount(map.get("thresh")),
          rawValue,
          rawString));
    }
    return parsed.isEmpty() ? EMPTY : new AttributeTable(parsed);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public List<AttributeEntry> entries() {
    return entries;
  }

  /**
   * Finds an attribute, preferring the ID over the name.
   *
   * @param id attribute ID
   * @param fallbackName vendor name matched case-insensitively when no row has the ID; may be {@code null}
   * @return matching row, or empty
   */
  public Optional<AttributeEntry> find(int id, String fallbackName) {
    String wanted = normalizeName(fallbackName);
    AttributeEntry byName = null;
    for (AttributeEntry entry : entries) {
      if (entry.id() == id) {
        return Optional.of(entry);
      }
      if (byName == null && wanted != null && wanted.equals(normalizeName(entry.name()))) {
        byName = entry;
      }
    }
    return Optional.ofNullable(byName);
  }

  /**
   * Finds an attribute by name only.
   *
   * @param name vendor name, matched case-insensitively
   * @return first matching row, or empty
   */
  public Optional<AttributeEntry> findByName(String name) {
    String wanted = normalizeName(name);
    if (wanted == null) {
      return Optional.empty();
    }
    return entries.stream().filter(entry -> wanted.equals(normalizeName(entry.name()))).findFirst();
  }

  /**
   * Reads one column of an attribute.
   *
   * @param id attribute ID
   * @param fallbackName name used when the ID is absent; may be {@code null}
   * @param field requested column
   * @return column value, or empty when the attribute or column is not reported
   */
  public OptionalLong value(int id, String fallbackName, AttributeField field) {
    return find(id, fallbackName).map(entry -> entry.get(field)).orElse(OptionalLong.empty());
  }

  private static String normalizeName(String name) {
    if (name == null || name.isBlank()) {
      return null;
    }
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
