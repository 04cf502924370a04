package org.circulardrives.cdihealth.infrastructure.metrics;

import org.circulardrives.cdihealth.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used for dry runs and when export is disabled.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
