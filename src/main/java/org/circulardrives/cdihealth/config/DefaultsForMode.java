package org.circulardrives.cdihealth.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.infrastructure.command.SmartctlCommandCatalog;

/**
 * Embedded defaults for each command, flattened the same way as YAML and CLI input.
 */
public final class DefaultsForMode {
  /** Commands that accept configuration. */
  public static final String SCAN = "scan";
  public static final String DISCOVER = "discover";
  public static final String GRADE = "grade";

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode}.
   *
   * @param mode {@code scan}, {@code discover} or {@code grade}
   * @return unmodifiable flat map
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    String normalized = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("metricsExporter", "none");
    defaults.put("otelEndpoint", "");
    defaults.put("otelResourceAttributes", "");
    defaults.put("verbose", "false");
    defaults.put("quiet", "false");
    switch (normalized) {
      case SCAN -> {
        probeDefaults(defaults);
        policyDefaults(defaults);
        outputDefaults(defaults);
      }
      case DISCOVER -> probeDefaults(defaults);
      case GRADE -> {
        defaults.put("file", "");
        policyDefaults(defaults);
        outputDefaults(defaults);
      }
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    defaults.put("dryRun", "false");
    return Map.copyOf(defaults);
  }

  private static void probeDefaults(Map<String, String> map) {
    map.put("smartctl", SmartctlCommandCatalog.DEFAULT_SMARTCTL);
    map.put("sudo", "false");
    map.put("workers", "");
    map.put("probeTimeoutSeconds", Long.toString(ProbeConfig.DEFAULT_TIMEOUT.toSeconds()));
    map.put("ignoreAta", "false");
    map.put("ignoreNvme", "false");
    map.put("ignoreScsi", "false");
    map.put("ignoreUsb", "false");
  }

  private static void policyDefaults(Map<String, String> map) {
    ThresholdPolicy policy = ThresholdPolicy.defaults();
    map.put("policy.pendingSectorsMax", Long.toString(policy.pendingSectorsMax()));
    map.put("policy.reallocatedSectorsMax", Long.toString(policy.reallocatedSectorsMax()));
    map.put("policy.uncorrectableErrorsMax", Long.toString(policy.uncorrectableErrorsMax()));
    map.put("policy.percentUsedMax", Long.toString(policy.percentUsedMax()));
    map.put("policy.availableSpareMin", Long.toString(policy.availableSpareMin()));
    map.put("policy.workloadTbPerYearMax", Double.toString(policy.workloadTbPerYearMax()));
    map.put("policy.warningTempMinutesMax", Long.toString(policy.warningTempMinutesMax()));
    map.put("policy.criticalTempMinutesMax", Long.toString(policy.criticalTempMinutesMax()));
  }

  private static void outputDefaults(Map<String, String> map) {
    map.put("out", "");
    map.put("format", OutputFormat.TABLE.name().toLowerCase(Locale.ROOT));
    map.put("allowOverwrite", "false");
  }
}
