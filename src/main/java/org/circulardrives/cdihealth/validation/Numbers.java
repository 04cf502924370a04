package org.circulardrives.cdihealth.validation;

/**
 * <strong>What:</strong> Numeric validation helpers for configuration values such as worker counts and timeouts.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Violations raise {@link IllegalArgumentException} for the CLI to report.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures a value lies within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer configuration value and checks its range.
   *
   * @param name configuration key used in diagnostics
   * @param raw raw text; blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or out of range
   */
  public static long parseLong(String name, String raw, long defaultValue, long min, long max) {
    if (raw == null || raw.isBlank()) {
      return requireRange(name, defaultValue, min, max);
    }
    try {
      return requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a finite positive decimal configuration value.
   *
   * @param name configuration key used in diagnostics
   * @param raw raw text; blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is blank
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a positive finite number
   */
  public static double parsePositiveDouble(String name, String raw, double defaultValue) {
    double value;
    if (raw == null || raw.isBlank()) {
      value = defaultValue;
    } else {
      try {
        value = Double.parseDouble(raw.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(label(name) + " must be a number (was '" + raw + "')", ex);
      }
    }
    if (!(value > 0) || Double.isInfinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be a positive finite number (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
