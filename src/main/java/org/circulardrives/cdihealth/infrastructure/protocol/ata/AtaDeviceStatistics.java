package org.circulardrives.cdihealth.infrastructure.protocol.ata;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.application.normalize.TelemetryValues;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;

/**
 * Reads entries from the ATA Device Statistics log ({@code ata_device_statistics.pages[].table[]}).
 *
 * <p>Entries are matched by name across all pages, case-insensitively. Entries flagged invalid by the device
 * ({@code flags.valid == false}) are not reported.</p>
 */
final class AtaDeviceStatistics {
  static final String LOGICAL_SECTORS_WRITTEN = "Logical Sectors Written";
  static final String LOGICAL_SECTORS_READ = "Logical Sectors Read";
  static final String PERCENT_USED_ENDURANCE = "Percentage Used Endurance Indicator";
  static final String CURRENT_TEMPERATURE = "Current Temperature";
  static final String HIGHEST_TEMPERATURE = "Highest Temperature";

  private final List<Object> pages;

  private AtaDeviceStatistics(List<Object> pages) {
    this.pages = pages;
  }

  static AtaDeviceStatistics from(RawTelemetry raw) {
    return new AtaDeviceStatistics(raw.listAt("ata_device_statistics", "pages").orElse(List.of()));
  }

  boolean isEmpty() {
    return pages.isEmpty();
  }

  OptionalLong value(String entryName) {
    String wanted = entryName.toLowerCase(Locale.ROOT);
    for (Object page : pages) {
      if (!(page instanceof Map<?, ?> pageMap) || !(pageMap.get("table") instanceof List<?> table)) {
        continue;
      }
      for (Object row : table) {
        if (!(row instanceof Map<?, ?> entry) || !(entry.get("name") instanceof String name)) {
          continue;
        }
        if (!name.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
          continue;
        }
        if (entry.get("flags") instanceof Map<?, ?> flags && Boolean.FALSE.equals(flags.get("valid"))) {
          return OptionalLong.empty();
        }
        return TelemetryValues.asCount(entry.get("value"));
      }
    }
    return OptionalLong.empty();
  }
}
