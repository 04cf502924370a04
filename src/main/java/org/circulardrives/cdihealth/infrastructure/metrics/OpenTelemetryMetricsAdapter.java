package org.circulardrives.cdihealth.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.circulardrives.cdihealth.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 *
 * <p>Instruments are created lazily per metric key and cached. Keys are lower-cased and any character outside
 * {@code [a-z0-9._-]} becomes {@code _}; the original key travels as the {@code cdi.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("cdi.metric.key");
  private static final String FALLBACK_NAME = "cdi.metric";

  private final OpenTelemetryBootstrap.Handle handle;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings exporter settings
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  boolean exporting() {
    return !handle.isNoop();
  }

  void forceFlush() {
    handle.forceFlush();
  }

  /** Flushes recorded metrics and shuts the provider down. */
  @Override
  public void close() {
    handle.close();
  }

  private Counter counter(String key) {
    String name = instrumentName(key);
    LongCounter counter = meter.counterBuilder(name).setUnit("1").setDescription("cdi-health counter " + key).build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram histogram(String key) {
    String name = instrumentName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription("cdi-health observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  static String instrumentName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Metric key '{}' exported as '{}'", key, result);
    }
    return result;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
