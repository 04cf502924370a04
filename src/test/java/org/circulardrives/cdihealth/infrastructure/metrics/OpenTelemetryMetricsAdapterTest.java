package org.circulardrives.cdihealth.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("cdi.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithResourceAttributes() {
    adapter.increment("scan.device.fail");
    adapter.increment("scan.device.fail");
    adapter.increment("scan.device.pass");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "scan.device.fail").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("scan.device.fail", point.getAttributes().get(METRIC_KEY));
    assertEquals("cdi-health", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("org.circulardrives",
        counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertTrue(adapter.exporting());
  }

  @Test
  void observeRecordsProbeLatencyHistogram() {
    adapter.observe("discovery.probe.latencyNanos", 1_000L);
    adapter.observe("discovery.probe.latencyNanos", 5_000L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "discovery.probe.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(6_000.0, point.getSum());
    assertEquals("discovery.probe.latencyNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void instrumentNameSanitizesKeys() {
    assertEquals("scan.device.pass", OpenTelemetryMetricsAdapter.instrumentName("scan.device.pass"));
    assertEquals("scan_device_pass", OpenTelemetryMetricsAdapter.instrumentName("Scan Device/Pass"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.instrumentName("9lives"));
    assertEquals("cdi.metric", OpenTelemetryMetricsAdapter.instrumentName("  "));
  }

  @Test
  void disabledSettingsProduceNoopHandle() {
    OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter(MetricsSettings.disabled());
    disabled.increment("scan.device.pass");
    assertFalse(disabled.exporting());
    disabled.close();
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
