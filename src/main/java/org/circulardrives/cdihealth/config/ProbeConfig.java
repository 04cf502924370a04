package org.circulardrives.cdihealth.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.circulardrives.cdihealth.application.discovery.DiscoveryFilter;
import org.circulardrives.cdihealth.application.discovery.ProbeScheduler;
import org.circulardrives.cdihealth.infrastructure.command.SmartctlCommandCatalog;
import org.circulardrives.cdihealth.validation.Numbers;
import org.circulardrives.cdihealth.validation.Strings;

/**
 * <strong>What:</strong> Settings for device discovery and probing.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param smartctl smartctl executable name or path
 * @param sudo run commands through {@code sudo -n}
 * @param workers probe pool size
 * @param probeTimeout per-probe time box
 * @param filter protocol ignore filters
 * @since 0.1.0
 */
public record ProbeConfig(
    String smartctl, boolean sudo, int workers, Duration probeTimeout, DiscoveryFilter filter) {

  /** Default per-probe time box. */
  public static final Duration DEFAULT_TIMEOUT = ProbeScheduler.DEFAULT_TIMEOUT;
  static final int MAX_WORKERS = 256;
  static final long MAX_TIMEOUT_SECONDS = 3600;

  public ProbeConfig {
    smartctl = Strings.requirePrintableAscii("smartctl", Strings.requireNonBlank("smartctl", smartctl), 4096);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Objects.requireNonNull(probeTimeout, "probeTimeout");
    Numbers.requireRange("probeTimeoutSeconds", probeTimeout.toSeconds(), 1, MAX_TIMEOUT_SECONDS);
    filter = Objects.requireNonNullElse(filter, DiscoveryFilter.none());
  }

  public static ProbeConfig defaults() {
    return new ProbeConfig(
        SmartctlCommandCatalog.DEFAULT_SMARTCTL,
        false,
        ProbeScheduler.defaultWorkerCount(),
        DEFAULT_TIMEOUT,
        DiscoveryFilter.none());
  }

  /**
   * Builds probe settings from flat configuration.
   *
   * @param options keys {@code smartctl}, {@code sudo}, {@code workers}, {@code probeTimeoutSeconds} and the
   *     {@code ignore*} filters; absent keys take defaults
   * @return settings
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ProbeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ProbeConfig defaults = defaults();
    String smartctl = ConfigValues.trimToEmpty(options.get("smartctl"));
    long workers = Numbers.parseLong("workers", options.get("workers"), defaults.workers(), 1, MAX_WORKERS);
    long timeoutSeconds = Numbers.parseLong(
        "probeTimeoutSeconds", options.get("probeTimeoutSeconds"), DEFAULT_TIMEOUT.toSeconds(), 1, MAX_TIMEOUT_SECONDS);
    DiscoveryFilter filter = new DiscoveryFilter(
        ConfigValues.parseBoolean("ignoreAta", options.get("ignoreAta"), false),
        ConfigValues.parseBoolean("ignoreNvme", options.get("ignoreNvme"), false),
        ConfigValues.parseBoolean("ignoreScsi", options.get("ignoreScsi"), false),
        ConfigValues.parseBoolean("ignoreUsb", options.get("ignoreUsb"), false));
    return new ProbeConfig(
        smartctl.isEmpty() ? defaults.smartctl() : smartctl,
        ConfigValues.parseBoolean("sudo", options.get("sudo"), false),
        (int) workers,
        Duration.ofSeconds(timeoutSeconds),
        filter);
  }
}
