package io.streampool.internal.pool;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;

/**
 * Creates the worker and schedule threads of one task pool. Threads are numbered from 1 in creation
 * order, so a pool that respawns idle workers keeps producing new names.
 */
public final class ExecutorThreadFactory implements ThreadFactory {
  private final String namePrefix;
  private final Thread.UncaughtExceptionHandler failureHandler;
  private final boolean daemon;
  private final AtomicInteger created = new AtomicInteger();

  /**
   * @param namePrefix see {@link PoolThreadsNameHelper}
   * @param failureHandler installed on every thread
   * @param daemon whether the threads are allowed to outlive the last non-daemon thread
   */
  public ExecutorThreadFactory(
      @Nonnull String namePrefix,
      @Nonnull Thread.UncaughtExceptionHandler failureHandler,
      boolean daemon) {
    this.namePrefix = Objects.requireNonNull(namePrefix);
    this.failureHandler = Objects.requireNonNull(failureHandler);
    this.daemon = daemon;
  }

  @Override
  public Thread newThread(@Nonnull Runnable body) {
    Thread thread = new Thread(body, namePrefix + ": " + created.incrementAndGet());
    thread.setDaemon(daemon);
    thread.setUncaughtExceptionHandler(failureHandler);
    return thread;
  }

  /** Number of threads created so far. */
  int getCreatedCount() {
    return created.get();
  }
}
