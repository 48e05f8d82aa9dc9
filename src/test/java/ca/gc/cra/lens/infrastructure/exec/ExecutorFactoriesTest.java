package ca.gc.cra.lens.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ExecutorFactoriesTest {

  @Test
  void threadsCarryPrefixAndAreNotDaemons() throws Exception {
    ExecutorService pool = ExecutorFactories.newAnalysisPool(2, "lens-test", null);
    try {
      Thread worker = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

      assertTrue(worker.getName().startsWith("lens-test-"));
      assertFalse(worker.isDaemon());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newAnalysisPool(1, " ", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

      assertEquals("lens-analyze-0", name);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void tasksSeeSubmitterMdcAndWorkersAreResetAfterwards() throws Exception {
    ExecutorService pool = ExecutorFactories.newAnalysisPool(1, "lens-mdc", null);
    MDC.put("pipeline", "analyze");
    try {
      String seen = pool.submit(() -> MDC.get("pipeline")).get(5, TimeUnit.SECONDS);
      MDC.remove("pipeline");
      String leftover = pool.submit(() -> MDC.get("pipeline")).get(5, TimeUnit.SECONDS);

      assertEquals("analyze", seen);
      assertNull(leftover);
    } finally {
      MDC.remove("pipeline");
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newAnalysisPool(0, "x", null));
  }
}
