package org.circulardrives.cdihealth.application.discovery;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.ProbeOutcome;
import org.circulardrives.cdihealth.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Discovery use case: enumerate devices, then probe each one on the scheduler.
 * <p><strong>Role:</strong> Backs the {@code discover} command and feeds the scan pipeline.</p>
 * <p><strong>Thread-safety:</strong> One discovery at a time per instance.</p>
 *
 * @since 0.1.0
 */
public final class DeviceDiscovery {
  private static final Logger log = LoggerFactory.getLogger(DeviceDiscovery.class);

  private final DeviceScanner scanner;
  private final DeviceProber prober;
  private final ProbeScheduler scheduler;

  public DeviceDiscovery(DeviceScanner scanner, DeviceProber prober, ProbeScheduler scheduler) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.prober = Objects.requireNonNull(prober, "prober");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * Lists the devices that pass {@code filter}.
   *
   * @param filter ignore filters
   * @return candidates in scan order
   * @throws DiscoveryException when the scan fails
   * @throws InterruptedException when interrupted while scanning
   */
  public List<DeviceCandidate> candidates(DiscoveryFilter filter) throws DiscoveryException, InterruptedException {
    return scanner.scan(filter);
  }

  /**
   * Probes candidates without grading them.
   *
   * @param candidates candidates from {@link #candidates(DiscoveryFilter)}
   * @param cancellation token checked before each probe starts
   * @return one outcome per candidate
   * @throws InterruptedException when the caller is interrupted while waiting for probes
   */
  public DiscoveryResult probeAll(List<DeviceCandidate> candidates, CancellationToken cancellation)
      throws InterruptedException {
    List<ProbeOutcome> outcomes = probe(candidates, cancellation);
    DiscoveryResult result = new DiscoveryResult(outcomes);
    log.info("Discovery probed {} device(s): {} succeeded, {} failed",
        outcomes.size(), result.devices().size(), result.failures().size());
    return result;
  }

  /**
   * Probes candidates on the scheduler and warns when two paths resolve to the same model and serial.
   *
   * @param candidates candidates in discovery order
   * @param cancellation token checked before each probe starts
   * @return one outcome per candidate, in candidate order
   * @throws InterruptedException when the caller is interrupted while waiting for probes
   */
  public List<ProbeOutcome> probe(List<DeviceCandidate> candidates, CancellationToken cancellation)
      throws InterruptedException {
    List<ProbeOutcome> outcomes = scheduler.runAll(candidates, prober::probe, ProbeOutcome::failure, cancellation);
    warnOnSharedUnits(outcomes);
    return outcomes;
  }

  static int warnOnSharedUnits(List<ProbeOutcome> outcomes) {
    Map<String, String> firstPath = new HashMap<>();
    int shared = 0;
    for (ProbeOutcome outcome : outcomes) {
      if (!outcome.succeeded()) {
        continue;
      }
      DeviceIdentity identity = outcome.identity();
      Optional<String> key = identity.unitKey();
      if (key.isEmpty()) {
        continue;
      }
      String earlier = firstPath.putIfAbsent(key.get(), identity.path());
      if (earlier != null) {
        shared++;
        log.warn("{} and {} report the same unit ({} serial {}); it will be graded twice",
            earlier, identity.path(), identity.model(), Logs.maskSerial(identity.serial()));
      }
    }
    return shared;
  }

  /**
   * Scans and probes in one step.
   *
   * @param filter ignore filters
   * @param cancellation token checked before each probe starts
   * @return one outcome per candidate
   * @throws DiscoveryException when the scan fails
   * @throws InterruptedException when interrupted
   */
  public DiscoveryResult discover(DiscoveryFilter filter, CancellationToken cancellation)
      throws DiscoveryException, InterruptedException {
    return probeAll(candidates(filter), cancellation);
  }
}
