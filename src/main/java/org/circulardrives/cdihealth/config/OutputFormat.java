package org.circulardrives.cdihealth.config;

import java.util.Locale;

/** Console rendering of a graded batch. */
public enum OutputFormat {
  /** Fixed-width table. */
  TABLE,
  /** JSON report document on stdout. */
  JSON,
  /** Nothing on stdout; useful with {@code out=PATH}. */
  NONE;

  /**
   * Parses a format name.
   *
   * @param raw {@code table}, {@code json} or {@code none}; blank means table
   * @return format
   * @throws IllegalArgumentException for any other value
   */
  public static OutputFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return TABLE;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("format must be table, json or none (was '" + raw + "')", ex);
    }
  }
}
