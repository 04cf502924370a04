package org.circulardrives.cdihealth.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Exporter settings for scan metrics.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes as {@code key=value,key=value}; may be blank
 * @since 0.1.0
 */
public record MetricsSettings(Exporter exporter, String endpoint, String resourceAttributes) {
  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public MetricsSettings {
    exporter = Objects.requireNonNullElse(exporter, Exporter.NONE);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings that disable metric export.
   *
   * @return disabled settings
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings(Exporter.NONE, DEFAULT_ENDPOINT, "");
  }

  /** Supported exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive; blank means none
     * @return exporter
     * @throws IllegalArgumentException for any other value
     */
    public static Exporter parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
      };
    }
  }
}
