package org.circulardrives.cdihealth.application.discovery;

import java.util.List;
import java.util.Objects;
import org.circulardrives.cdihealth.domain.device.ProbeOutcome;

/**
 * Probe outcomes for one discovery run, one per candidate, in discovery order.
 *
 * @param outcomes per-candidate outcomes
 * @since 0.1.0
 */
public record DiscoveryResult(List<ProbeOutcome> outcomes) {
  public DiscoveryResult {
    outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
  }

  /**
   * Outcomes whose probe succeeded.
   *
   * @return successful outcomes in discovery order
   */
  public List<ProbeOutcome> devices() {
    return outcomes.stream().filter(ProbeOutcome::succeeded).toList();
  }

  /**
   * Outcomes whose probe failed.
   *
   * @return failed outcomes in discovery order
   */
  public List<ProbeOutcome> failures() {
    return outcomes.stream().filter(outcome -> !outcome.succeeded()).toList();
  }
}
