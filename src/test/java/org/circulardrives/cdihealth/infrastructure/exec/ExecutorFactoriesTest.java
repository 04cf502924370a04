package org.circulardrives.cdihealth.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void probePoolNamesNonDaemonWorkers() throws Exception {
    ExecutorService pool = ExecutorFactories.newProbePool(2, "probe-test", null);
    try {
      Future<Thread> worker = pool.submit(Thread::currentThread);
      Thread thread = worker.get(5, TimeUnit.SECONDS);

      assertTrue(thread.getName().startsWith("probe-test-"));
      assertFalse(thread.isDaemon());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newProbePool(1, " ", null);
    try {
      assertEquals("cdi-probe-0", pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newProbePool(0, "x", null));
  }
}
