package org.circulardrives.cdihealth.application.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.circulardrives.cdihealth.RecordingMetricsPort;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.ProbeFailureKind;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ProbeSchedulerTest {
  private static final ProbeFallback<String> FALLBACK = (candidate, kind, message) -> kind.name();

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ExecutorService pool = Executors.newFixedThreadPool(4);
  private final CountDownLatch release = new CountDownLatch(1);

  @AfterEach
  void tearDown() {
    release.countDown();
    pool.shutdownNow();
  }

  @Test
  void hangingProbeTimesOutWhileOthersComplete() throws Exception {
    ProbeScheduler scheduler = new ProbeScheduler(pool, Duration.ofMillis(300), metrics);
    List<DeviceCandidate> candidates = List.of(
        ata("/dev/sda"), ata("/dev/sdb"), ata("/dev/hang"), ata("/dev/sdc"), ata("/dev/sdd"), ata("/dev/sde"));

    long start = System.nanoTime();
    List<String> results = scheduler.runAll(candidates, candidate -> {
      if (candidate.path().equals("/dev/hang")) {
        release.await(10, TimeUnit.SECONDS);
      }
      return candidate.path();
    }, FALLBACK, new CancellationToken());
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertEquals(List.of("/dev/sda", "/dev/sdb", "TIMEOUT", "/dev/sdc", "/dev/sdd", "/dev/sde"), results);
    assertEquals(1, metrics.count("discovery.probe.timeout"));
    assertEquals(5, metrics.observed("discovery.probe.latencyNanos").size());
    assertTrue(elapsedMillis < 5_000, "scan should not wait for the hung probe: " + elapsedMillis + " ms");
  }

  @Test
  void fallbackRunsOncePerTimedOutDevice() throws Exception {
    ProbeScheduler scheduler = new ProbeScheduler(pool, Duration.ofMillis(200), metrics);
    AtomicInteger fallbacks = new AtomicInteger();
    CountDownLatch workerExited = new CountDownLatch(1);

    List<String> results = scheduler.runAll(List.of(ata("/dev/hang")), candidate -> {
      try {
        release.await(10, TimeUnit.SECONDS);
        return candidate.path();
      } finally {
        workerExited.countDown();
      }
    }, (candidate, kind, message) -> {
      fallbacks.incrementAndGet();
      return kind.name();
    }, new CancellationToken());

    assertTrue(workerExited.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("TIMEOUT"), results);
    assertEquals(1, fallbacks.get());
  }

  @Test
  void samePathIsNeverProbedConcurrently() throws Exception {
    ProbeScheduler scheduler = new ProbeScheduler(pool, Duration.ofSeconds(5), metrics);
    AtomicInteger active = new AtomicInteger();
    AtomicInteger maxActive = new AtomicInteger();
    List<DeviceCandidate> candidates = List.of(ata("/dev/sda"), ata("/dev/sda"), ata("/dev/sda"), ata("/dev/sdb"));

    List<String> results = scheduler.runAll(candidates, candidate -> {
      if (candidate.path().equals("/dev/sda")) {
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
        Thread.sleep(50);
        active.decrementAndGet();
      }
      return candidate.path();
    }, FALLBACK, null);

    assertEquals(List.of("/dev/sda", "/dev/sda", "/dev/sda", "/dev/sdb"), results);
    assertEquals(1, maxActive.get());
  }

  @Test
  void cancelledScanSkipsRemainingProbes() throws Exception {
    ProbeScheduler scheduler = new ProbeScheduler(pool, Duration.ofSeconds(5), metrics);
    CancellationToken token = new CancellationToken();
    token.cancel();
    AtomicInteger invoked = new AtomicInteger();

    List<String> results = scheduler.runAll(List.of(ata("/dev/sda"), ata("/dev/sdb")), candidate -> {
      invoked.incrementAndGet();
      return candidate.path();
    }, FALLBACK, token);

    assertEquals(List.of("CANCELLED", "CANCELLED"), results);
    assertEquals(0, invoked.get());
    assertEquals(2, metrics.count("discovery.probe.cancelled"));
  }

  @Test
  void openErrorsAreReportedWithoutRunningTheProbe() throws Exception {
    ProbeScheduler scheduler = new ProbeScheduler(pool, Duration.ofSeconds(5), metrics);
    DeviceCandidate locked = new DeviceCandidate(
        "/dev/sdx", "scsi", TransportProtocol.SCSI, Optional.of("Permission denied"));
    AtomicInteger invoked = new AtomicInteger();

    List<String> results = scheduler.runAll(List.of(locked, ata("/dev/sda")), candidate -> {
      invoked.incrementAndGet();
      return candidate.path();
    }, FALLBACK, null);

    assertEquals(List.of("OPEN_ERROR", "/dev/sda"), results);
    assertEquals(1, invoked.get());
    assertEquals(1, metrics.count("discovery.probe.failed"));
  }

  @Test
  void probeFailuresKeepTheirKind() throws Exception {
    ProbeScheduler scheduler = new ProbeScheduler(pool, Duration.ofSeconds(5), metrics);

    List<String> results = scheduler.runAll(List.of(ata("/dev/sda"), ata("/dev/sdb")), candidate -> {
      if (candidate.path().equals("/dev/sda")) {
        throw new ProbeException(ProbeFailureKind.UNPARSEABLE, "garbage");
      }
      throw new IllegalStateException("boom");
    }, FALLBACK, null);

    assertEquals(List.of("UNPARSEABLE", "INTERNAL"), results);
    assertEquals(2, metrics.count("discovery.probe.failed"));
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new ProbeScheduler(pool, Duration.ZERO, metrics));
  }

  @Test
  void closeStopsThePool() {
    ProbeScheduler scheduler = new ProbeScheduler(pool, Duration.ofSeconds(1), metrics);

    scheduler.close();

    assertTrue(pool.isShutdown());
  }

  private static DeviceCandidate ata(String path) {
    return DeviceCandidate.reachable(path, "sat", TransportProtocol.ATA);
  }
}
