package org.circulardrives.cdihealth.application.discovery;

import org.circulardrives.cdihealth.domain.device.DeviceCandidate;

/**
 * Work performed for one reachable candidate on a probe worker.
 *
 * @param <T> per-device result type
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProbeTask<T> {
  /**
   * Probes and optionally assesses a device.
   *
   * @param candidate device to probe
   * @return per-device result
   * @throws ProbeException when the device cannot be probed
   * @throws InterruptedException when the worker is interrupted, e.g. after a time-out
   */
  T run(DeviceCandidate candidate) throws ProbeException, InterruptedException;
}
