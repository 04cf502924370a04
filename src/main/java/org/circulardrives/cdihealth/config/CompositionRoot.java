package org.circulardrives.cdihealth.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.circulardrives.cdihealth.application.discovery.DeviceDiscovery;
import org.circulardrives.cdihealth.application.discovery.DeviceProber;
import org.circulardrives.cdihealth.application.discovery.DeviceScanParser;
import org.circulardrives.cdihealth.application.discovery.DeviceScanner;
import org.circulardrives.cdihealth.application.discovery.ProbeScheduler;
import org.circulardrives.cdihealth.application.grading.GradingEngine;
import org.circulardrives.cdihealth.application.json.TelemetryJsonParser;
import org.circulardrives.cdihealth.application.normalize.TelemetryNormalizers;
import org.circulardrives.cdihealth.application.pipeline.DeviceAssessor;
import org.circulardrives.cdihealth.application.pipeline.HealthScanUseCase;
import org.circulardrives.cdihealth.application.pipeline.OfflineGradeUseCase;
import org.circulardrives.cdihealth.application.port.ClockPort;
import org.circulardrives.cdihealth.application.port.CommandExecutor;
import org.circulardrives.cdihealth.application.port.MetricsPort;
import org.circulardrives.cdihealth.application.port.ReportSink;
import org.circulardrives.cdihealth.infrastructure.command.SmartctlCommandCatalog;
import org.circulardrives.cdihealth.infrastructure.exec.ExecutorFactories;
import org.circulardrives.cdihealth.infrastructure.exec.ProcessCommandExecutor;
import org.circulardrives.cdihealth.infrastructure.metrics.MetricsSettings;
import org.circulardrives.cdihealth.infrastructure.metrics.NoOpMetricsAdapter;
import org.circulardrives.cdihealth.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.circulardrives.cdihealth.infrastructure.protocol.ata.AtaTelemetryNormalizer;
import org.circulardrives.cdihealth.infrastructure.protocol.nvme.NvmeTelemetryNormalizer;
import org.circulardrives.cdihealth.infrastructure.protocol.scsi.ScsiTelemetryNormalizer;
import org.circulardrives.cdihealth.infrastructure.report.ConsoleReportSink;
import org.circulardrives.cdihealth.infrastructure.report.JsonReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the discovery, grading and reporting graph from a {@link HealthConfig}.
 * <p><strong>Role:</strong> Composition root used by the CLI commands and by end-to-end tests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register the ATA, NVMe and SCSI normalizers.</li>
 *   <li>Create the probe pool lazily so {@code grade} never starts worker threads.</li>
 *   <li>Own the pool and the metrics exporter; {@link #close()} releases both.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final HealthConfig config;
  private final CommandExecutor executor;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final TelemetryJsonParser json = new TelemetryJsonParser();
  private ProbeScheduler scheduler;

  /**
   * Creates a root that runs real processes and exports metrics per {@code config}.
   *
   * @param config effective configuration
   */
  public CompositionRoot(HealthConfig config) {
    this(config, new ProcessCommandExecutor(), metricsFor(config.metrics()), ClockPort.SYSTEM);
  }

  /**
   * Creates a root with explicit adapters.
   *
   * @param config effective configuration
   * @param executor command executor
   * @param metrics metrics port
   * @param clock report clock
   */
  public CompositionRoot(HealthConfig config, CommandExecutor executor, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  private static MetricsPort metricsFor(MetricsSettings settings) {
    if (settings.exporter() == MetricsSettings.Exporter.NONE) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  public HealthConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Registry of the protocol normalizers.
   *
   * @return normalizers for ATA, NVMe and SCSI
   */
  public static TelemetryNormalizers normalizers() {
    return new TelemetryNormalizers(List.of(
        new AtaTelemetryNormalizer(), new NvmeTelemetryNormalizer(), new ScsiTelemetryNormalizer()));
  }

  public DeviceAssessor assessor() {
    return new DeviceAssessor(normalizers(), new GradingEngine(config.policy()), metrics);
  }

  /**
   * Discovery use case backed by smartctl and the probe pool.
   *
   * @return discovery
   */
  public DeviceDiscovery discovery() {
    ProbeConfig probe = config.probe();
    SmartctlCommandCatalog commands = new SmartctlCommandCatalog(probe.smartctl(), probe.sudo());
    return new DeviceDiscovery(
        new DeviceScanner(executor, commands, new DeviceScanParser(json)),
        new DeviceProber(executor, commands, json),
        scheduler());
  }

  public HealthScanUseCase healthScan(List<ReportSink> sinks) {
    return new HealthScanUseCase(discovery(), assessor(), sinks, clock);
  }

  public OfflineGradeUseCase offlineGrade(List<ReportSink> sinks) {
    return new OfflineGradeUseCase(json, assessor(), sinks, clock);
  }

  /**
   * Report sinks for the configured console format and output file.
   *
   * @param console line printer for stdout
   * @return sinks in publish order
   */
  public List<ReportSink> reportSinks(Consumer<String> console) {
    List<ReportSink> sinks = new ArrayList<>(2);
    switch (config.format()) {
      case TABLE -> sinks.add(new ConsoleReportSink(console));
      case JSON -> sinks.add(reports -> console.accept(JsonReportWriter.render(reports, clock.nowMillis())));
      case NONE -> { }
    }
    config.out().ifPresent(path -> sinks.add(new JsonReportWriter(path, config.allowOverwrite(), clock)));
    return sinks;
  }

  private ProbeScheduler scheduler() {
    if (scheduler == null) {
      ProbeConfig probe = config.probe();
      scheduler = new ProbeScheduler(
          ExecutorFactories.newProbePool(probe.workers(), "cdi-probe", null), probe.probeTimeout(), metrics);
      log.debug("Probe pool started with {} worker(s), timeout {}", probe.workers(), probe.probeTimeout());
    }
    return scheduler;
  }

  /** Stops the probe pool and flushes metrics. */
  @Override
  public void close() {
    if (scheduler != null) {
      scheduler.close();
      scheduler = null;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
