package ca.gc.cra.lens.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Worker pools for the analyze pipeline.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final String DEFAULT_PREFIX = "lens-analyze";

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for per-message redaction and classification.
   *
   * <p>Tasks queue without bound; the pool size caps parallelism. Workers are non-daemon so shutdown is
   * explicit. Each task runs with the MDC of the thread that submitted it, and the worker's own MDC is put back
   * afterwards.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; blank falls back to {@value #DEFAULT_PREFIX}
   * @param handler uncaught exception handler for each worker; {@code null} logs at ERROR
   * @return configured executor service
   */
  public static ExecutorService newAnalysisPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix.trim();
    UncaughtExceptionHandler onFailure = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught failure on {}", t.getName(), ex));
    return new MdcPropagatingPool(size, namedThreads(threadPrefix, onFailure));
  }

  private static ThreadFactory namedThreads(String prefix, UncaughtExceptionHandler onFailure) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(onFailure);
      return thread;
    };
  }

  private static final class MdcPropagatingPool extends ThreadPoolExecutor {
    MdcPropagatingPool(int size, ThreadFactory threads) {
      super(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), threads);
    }

    @Override
    public void execute(Runnable command) {
      Objects.requireNonNull(command, "command");
      Map<String, String> submitted = MDC.getCopyOfContextMap();
      super.execute(() -> {
        Map<String, String> own = MDC.getCopyOfContextMap();
        apply(submitted);
        try {
          command.run();
        } finally {
          apply(own);
        }
      });
    }

    private static void apply(Map<String, String> context) {
      if (context == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(context);
      }
    }
  }
}
