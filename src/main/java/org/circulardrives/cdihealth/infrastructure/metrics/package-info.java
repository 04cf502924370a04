/**
 * Metrics adapters that bridge {@code MetricsPort} to OpenTelemetry or discard updates.
 * <p><strong>Concurrency:</strong> Implementations accept concurrent updates from probe workers.</p>
 * <p><strong>Metrics:</strong> Publishes {@code scan.device.*} and {@code discovery.probe.*} instruments.</p>
 */
package org.circulardrives.cdihealth.infrastructure.metrics;
