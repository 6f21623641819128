package io.streampool.internal.pool;

import com.google.common.util.concurrent.Uninterruptibles;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Graceful shutdown of executors that blocks until the executor terminated, reporting shutdowns
 * that are held up by long running tasks.
 */
public final class ShutdownManager {
  private static final Logger log = LoggerFactory.getLogger(ShutdownManager.class);

  private static final int CHECK_PERIOD_MS = 250;
  // measured in attempts count, not in ms
  private static final int BLOCKED_REPORTING_THRESHOLD = 60;
  private static final int BLOCKED_REPORTING_PERIOD = 20;

  private ShutdownManager() {}

  /**
   * executorToShutdown.shutdown() -&gt; unlimited wait for graceful termination. Interrupts of the
   * calling thread don't cut the wait short, the interrupt flag is restored before returning.
   */
  public static void shutdownExecutorUntimed(
      ExecutorService executorToShutdown, String executorName) {
    executorToShutdown.shutdown();
    awaitTerminationUntimed(executorToShutdown, executorName);
  }

  static void awaitTerminationUntimed(ExecutorService executor, String executorName) {
    int attempt = 0;
    boolean reportedSlow = false;
    while (!Uninterruptibles.awaitTerminationUninterruptibly(
        executor, CHECK_PERIOD_MS, TimeUnit.MILLISECONDS)) {
      attempt++;
      // log a problem after BLOCKED_REPORTING_THRESHOLD attempts only
      // and repeat every BLOCKED_REPORTING_PERIOD attempts
      if (attempt >= BLOCKED_REPORTING_THRESHOLD
          && (attempt - BLOCKED_REPORTING_THRESHOLD) % BLOCKED_REPORTING_PERIOD == 0) {
        log.warn(
            "Graceful shutdown of {} is blocked by one of the long currently processing tasks",
            executorName);
        reportedSlow = true;
      }
    }
    if (reportedSlow) {
      log.warn("{} successfully terminated", executorName);
    }
  }
}
