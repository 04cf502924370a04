package org.circulardrives.cdihealth.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.infrastructure.metrics.MetricsSettings;
import org.circulardrives.cdihealth.validation.Numbers;

/**
 * <strong>What:</strong> Effective configuration for one {@code scan}, {@code discover} or {@code grade} run.
 * <p><strong>Role:</strong> Built from the merged flat map and handed to {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param probe discovery and probe settings
 * @param policy grading thresholds
 * @param out JSON report file, when requested
 * @param format console rendering
 * @param allowOverwrite whether {@code out} may replace an existing file
 * @param metrics metrics exporter settings
 * @param files saved telemetry documents for offline grading
 * @since 0.1.0
 */
public record HealthConfig(
    ProbeConfig probe,
    ThresholdPolicy policy,
    Optional<Path> out,
    OutputFormat format,
    boolean allowOverwrite,
    MetricsSettings metrics,
    List<Path> files) {

  public HealthConfig {
    probe = Objects.requireNonNullElseGet(probe, ProbeConfig::defaults);
    policy = Objects.requireNonNullElseGet(policy, ThresholdPolicy::defaults);
    out = Objects.requireNonNullElse(out, Optional.empty());
    format = Objects.requireNonNullElse(format, OutputFormat.TABLE);
    metrics = Objects.requireNonNullElseGet(metrics, MetricsSettings::disabled);
    files = files == null ? List.of() : List.copyOf(files);
  }

  /**
   * Builds the configuration from a merged flat map.
   *
   * @param options merged configuration
   * @return configuration
   * @throws IllegalArgumentException when any value is invalid
   */
  public static HealthConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String outRaw = ConfigValues.trimToEmpty(options.get("out"));
    Optional<Path> out = outRaw.isEmpty() ? Optional.empty() : Optional.of(parsePath("out", outRaw));
    MetricsSettings metrics = new MetricsSettings(
        MetricsSettings.Exporter.parse(options.get("metricsExporter")),
        options.get("otelEndpoint"),
        options.get("otelResourceAttributes"));
    return new HealthConfig(
        ProbeConfig.fromMap(options),
        policyFromMap(options),
        out,
        OutputFormat.parse(options.get("format")),
        ConfigValues.parseBoolean("allowOverwrite", options.get("allowOverwrite"), false),
        metrics,
        parseFiles(options.get("file")));
  }

  /**
   * Reads the {@code policy.*} thresholds; absent keys keep their defaults.
   *
   * @param options flat configuration
   * @return threshold policy
   * @throws IllegalArgumentException when a threshold is invalid
   */
  public static ThresholdPolicy policyFromMap(Map<String, String> options) {
    ThresholdPolicy d = ThresholdPolicy.defaults();
    return new ThresholdPolicy(
        threshold(options, "pendingSectorsMax", d.pendingSectorsMax()),
        threshold(options, "reallocatedSectorsMax", d.reallocatedSectorsMax()),
        threshold(options, "uncorrectableErrorsMax", d.uncorrectableErrorsMax()),
        threshold(options, "percentUsedMax", d.percentUsedMax()),
        threshold(options, "availableSpareMin", d.availableSpareMin()),
        Numbers.parsePositiveDouble(
            "policy.workloadTbPerYearMax", options.get("policy.workloadTbPerYearMax"), d.workloadTbPerYearMax()),
        threshold(options, "warningTempMinutesMax", d.warningTempMinutesMax()),
        threshold(options, "criticalTempMinutesMax", d.criticalTempMinutesMax()));
  }

  private static long threshold(Map<String, String> options, String name, long defaultValue) {
    String key = "policy." + name;
    return Numbers.parseLong(key, options.get(key), defaultValue, 0, Long.MAX_VALUE);
  }

  private static List<Path> parseFiles(String raw) {
    List<Path> files = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return files;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        files.add(parsePath("file", trimmed));
      }
    }
    return files;
  }

  private static Path parsePath(String name, String raw) {
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }
}
