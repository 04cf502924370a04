package org.circulardrives.cdihealth.application.discovery;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked before each device probe starts.
 *
 * <p>Cancelling never interrupts a probe already running; it only keeps queued probes from starting.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Requests cancellation. Idempotent. */
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
