package org.circulardrives.cdihealth.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI and YAML configuration.
 * <p><strong>Why:</strong> Keeps control characters and blank values out of command lines and telemetry settings.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains printable ASCII only and does not exceed {@code maxLength}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @param maxLength maximum accepted length
   * @return the unchanged value
   * @throws IllegalArgumentException if the value is too long or contains non printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    Objects.requireNonNull(value, name == null ? "value" : name);
    if (value.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "must be at most " + maxLength + " characters"));
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7e) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII only"));
      }
    }
    return value;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String detail) {
    return (name == null || name.isBlank() ? "value" : name) + ' ' + detail;
  }
}
