package org.circulardrives.cdihealth.config;

import java.util.Locale;

/** Parsing helpers shared by the configuration records. */
final class ConfigValues {
  private ConfigValues() {}

  static boolean parseBoolean(String name, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + raw + "')");
    };
  }

  static String trimToEmpty(String raw) {
    return raw == null ? "" : raw.trim();
  }
}
