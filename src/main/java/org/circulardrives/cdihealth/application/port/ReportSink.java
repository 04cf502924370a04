package org.circulardrives.cdihealth.application.port;

import java.io.IOException;
import java.util.List;
import org.circulardrives.cdihealth.domain.grading.DeviceReport;

/**
 * Receives the graded batch for rendering.
 *
 * @since 0.1.0
 */
public interface ReportSink {
  /**
   * Publishes the batch, one entry per discovered device in discovery order.
   *
   * @param reports graded devices
   * @throws IOException when the report cannot be written
   */
  void publish(List<DeviceReport> reports) throws IOException;
}
