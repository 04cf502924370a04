package org.circulardrives.cdihealth.application.discovery;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.circulardrives.cdihealth.application.port.MetricsPort;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.ProbeFailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs per-device probes on a bounded worker pool.
 * <p><strong>Why:</strong> Probes are dominated by external process latency and device locks; running them in
 * parallel shortens a batch, while one slow or broken device must not stall or abort the rest.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return exactly one result per candidate, in candidate order.</li>
 *   <li>Allow at most one in-flight probe per device path.</li>
 *   <li>Time-box each probe from the moment a worker picks it up, waiting for the path lock included; on expiry
 *   interrupt the worker and report {@link ProbeFailureKind#TIMEOUT}. The fallback runs once per candidate, and
 *   a worker that finishes after its time box has its result discarded.</li>
 *   <li>Check the cancellation token before each probe starts; running probes are left to finish.</li>
 *   <li>Route open errors, probe exceptions and unexpected failures to the fallback; no retries.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #runAll} may be called from one thread at a time; the pool is shared
 * by the probes of that call.</p>
 * <p><strong>Observability:</strong> Records {@code discovery.probe.latencyNanos}, increments
 * {@code discovery.probe.timeout}, {@code discovery.probe.failed} and {@code discovery.probe.cancelled}, and tags
 * worker log lines with the MDC key {@code device}.</p>
 *
 * @since 0.1.0
 */
public final class ProbeScheduler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ProbeScheduler.class);
  /** Default per-probe time box. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final ExecutorService pool;
  private final long timeoutNanos;
  private final MetricsPort metrics;
  private final ConcurrentMap<String, ReentrantLock> pathLocks = new ConcurrentHashMap<>();

  /**
   * Creates a scheduler that owns {@code pool}.
   *
   * @param pool bounded executor; shut down by {@link #close()}
   * @param timeout per-probe time box; must be positive
   * @param metrics metrics sink
   */
  public ProbeScheduler(ExecutorService pool, Duration timeout, MetricsPort metrics) {
    this.pool = Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.timeoutNanos = timeout.toNanos();
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Default worker count: the larger of four and the number of available processors.
   *
   * @return pool size
   */
  public static int defaultWorkerCount() {
    return Math.max(4, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Runs {@code task} for every candidate.
   *
   * @param candidates candidates in discovery order
   * @param task per-device work
   * @param fallback builder for failure results
   * @param cancellation cancellation token checked before each probe starts
   * @param <T> per-device result type
   * @return one result per candidate, in candidate order
   * @throws InterruptedException when the calling thread is interrupted while collecting results
   */
  public <T> List<T> runAll(
      List<DeviceCandidate> candidates,
      ProbeTask<T> task,
      ProbeFallback<T> fallback,
      CancellationToken cancellation) throws InterruptedException {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(fallback, "fallback");
    CancellationToken token = Objects.requireNonNullElseGet(cancellation, CancellationToken::new);

    List<Slot<T>> slots = new ArrayList<>(candidates.size());
    for (DeviceCandidate candidate : candidates) {
      if (candidate.openFailed()) {
        log.warn("Device {} could not be opened: {}", candidate.path(), candidate.openError().orElse(""));
        metrics.increment("discovery.probe.failed");
        slots.add(Slot.completed(
            candidate, fallback.onFailure(candidate, ProbeFailureKind.OPEN_ERROR, candidate.openError().orElse(null))));
        continue;
      }
      CompletableFuture<Long> started = new CompletableFuture<>();
      Future<T> future = pool.submit(() -> runGuarded(candidate, task, fallback, token, started));
      slots.add(new Slot<>(candidate, started, future, null));
    }

    List<T> results = new ArrayList<>(slots.size());
    try {
      for (Slot<T> slot : slots) {
        results.add(await(slot, fallback));
      }
    } catch (InterruptedException ex) {
      token.cancel();
      slots.forEach(slot -> {
        if (slot.future() != null) {
          slot.future().cancel(true);
        }
      });
      throw ex;
    }
    return results;
  }

  private <T> T runGuarded(
      DeviceCandidate candidate,
      ProbeTask<T> task,
      ProbeFallback<T> fallback,
      CancellationToken token,
      CompletableFuture<Long> started) {
    long startNanos = System.nanoTime();
    started.complete(startNanos);
    if (token.isCancelled()) {
      metrics.increment("discovery.probe.cancelled");
      return fallback.onFailure(candidate, ProbeFailureKind.CANCELLED, "scan cancelled before probe started");
    }
    ReentrantLock lock = pathLocks.computeIfAbsent(candidate.path(), path -> new ReentrantLock());
    boolean locked = false;
    MDC.put("device", candidate.path());
    try {
      lock.lockInterruptibly();
      locked = true;
      if (token.isCancelled()) {
        metrics.increment("discovery.probe.cancelled");
        return fallback.onFailure(candidate, ProbeFailureKind.CANCELLED, "scan cancelled before probe started");
      }
      T result = task.run(candidate);
      long elapsedNanos = System.nanoTime() - startNanos;
      if (elapsedNanos <= timeoutNanos) {
        metrics.observe("discovery.probe.latencyNanos", elapsedNanos);
      }
      return result;
    } catch (ProbeException ex) {
      log.warn("Probe of {} failed ({}): {}", candidate.path(), ex.kind(), ex.getMessage());
      metrics.increment("discovery.probe.failed");
      return fallback.onFailure(candidate, ex.kind(), ex.getMessage());
    } catch (InterruptedException ex) {
      // Only a cancelled future interrupts a worker, and the collector has already reported that slot.
      Thread.currentThread().interrupt();
      log.debug("Probe of {} interrupted after cancellation", candidate.path());
      return null;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure probing {}", candidate.path(), ex);
      metrics.increment("discovery.probe.failed");
      return fallback.onFailure(candidate, ProbeFailureKind.INTERNAL, ex.toString());
    } finally {
      if (locked) {
        lock.unlock();
      }
      MDC.remove("device");
    }
  }

  private <T> T await(Slot<T> slot, ProbeFallback<T> fallback) throws InterruptedException {
    if (slot.future() == null) {
      return slot.result();
    }
    DeviceCandidate candidate = slot.candidate();
    try {
      long startNanos = slot.started().get();
      long remaining = timeoutNanos - (System.nanoTime() - startNanos);
      return slot.future().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      slot.future().cancel(true);
      metrics.increment("discovery.probe.timeout");
      log.warn("Probe of {} exceeded {} ms; reporting as data read error",
          candidate.path(), TimeUnit.NANOSECONDS.toMillis(timeoutNanos));
      return fallback.onFailure(candidate, ProbeFailureKind.TIMEOUT,
          "probe timed out after " + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms");
    } catch (CancellationException ex) {
      return fallback.onFailure(candidate, ProbeFailureKind.CANCELLED, "probe cancelled");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.error("Probe worker for {} failed", candidate.path(), cause);
      return fallback.onFailure(candidate, ProbeFailureKind.INTERNAL, cause.toString());
    }
  }

  /**
   * Stops the worker pool, interrupting probes still running after a short grace period.
   */
  @Override
  public void close() {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Probe workers still running after shutdown; interrupting");
        pool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private record Slot<T>(DeviceCandidate candidate, CompletableFuture<Long> started, Future<T> future, T result) {
    static <T> Slot<T> completed(DeviceCandidate candidate, T result) {
      return new Slot<>(candidate, null, null, result);
    }
  }
}
