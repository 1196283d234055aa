package io.storefront.toolkit.core.time;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates and shuts down the shared timer scheduler.
 * <p>
 * Toolkit components never create their own threads; they receive one scheduler owned by the
 * embedding context and use it for every delay, timeout and polling tick.
 */
@UtilityClass
public class Schedulers {
  private static final Logger logger = LoggerFactory.getLogger(Schedulers.class);

  /**
   * @param name    thread name prefix
   * @param threads core pool size (at least 1)
   * @return a scheduler with daemon threads that drops cancelled tasks from its queue
   */
  public static ScheduledExecutorService newScheduler(String name, int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
    }
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(threads, daemonFactory(name));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    logger.debug("Created scheduler '{}' with {} thread(s)", name, threads);
    return executor;
  }

  /**
   * Shuts a scheduler down, waiting up to {@code timeoutMs} before forcing.
   *
   * @param scheduler scheduler to stop
   * @param timeoutMs graceful wait
   */
  public static void shutdown(ScheduledExecutorService scheduler, long timeoutMs) {
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warn("Scheduler did not terminate within {}ms, forcing shutdown", timeoutMs);
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }
  }

  private static ThreadFactory daemonFactory(String name) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
