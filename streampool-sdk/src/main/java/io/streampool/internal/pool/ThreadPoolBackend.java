package io.streampool.internal.pool;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.uber.m3.tally.Scope;
import com.uber.m3.tally.Stopwatch;
import io.streampool.failure.BackendAllocationException;
import io.streampool.internal.logging.LoggerTag;
import io.streampool.pool.MetricsType;
import io.streampool.pool.TaskPoolOptions;
import io.streampool.pool.WorkItem;
import java.util.Objects;
import java.util.concurrent.*;
import javax.annotation.Nonnull;
import org.slf4j.MDC;

/**
 * Worker threads of a prepared {@link io.streampool.pool.DefaultTaskPool}. Work items are
 * independent of each other, so they are dispatched in no particular order.
 */
public final class ThreadPoolBackend {

  private final String poolName;
  private final Scope metricsScope;
  private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler;

  private final ThreadPoolExecutor taskExecutor;
  private final String threadNamePrefix;

  public ThreadPoolBackend(
      @Nonnull TaskPoolOptions options, @Nonnull Scope metricsScope, boolean daemonThreads) {
    this(
        options,
        metricsScope,
        new ExecutorThreadFactory(
            PoolThreadsNameHelper.getWorkerThreadPrefix(options.getName()),
            options.getUncaughtExceptionHandler(),
            daemonThreads));
  }

  @VisibleForTesting
  ThreadPoolBackend(
      @Nonnull TaskPoolOptions options,
      @Nonnull Scope metricsScope,
      @Nonnull ThreadFactory threadFactory) {
    Objects.requireNonNull(options);
    this.poolName = options.getName();
    this.metricsScope = Objects.requireNonNull(metricsScope);
    this.uncaughtExceptionHandler = options.getUncaughtExceptionHandler();
    this.threadNamePrefix = PoolThreadsNameHelper.getWorkerThreadPrefix(poolName);

    long keepAliveMs = options.getKeepAliveTime().toMillis();
    ThreadPoolExecutor executor;
    if (options.isUnlimited()) {
      // no queueing: a work item is handed to an idle thread or a new thread is spawned for it
      executor =
          new ThreadPoolExecutor(
              0, Integer.MAX_VALUE, keepAliveMs, TimeUnit.MILLISECONDS, new SynchronousQueue<>());
    } else {
      // core size has to be maxThreads, otherwise threads beyond the core size are only spawned
      // when the unbounded queue is full, which never happens
      executor =
          new ThreadPoolExecutor(
              options.getMaxThreads(),
              options.getMaxThreads(),
              keepAliveMs,
              TimeUnit.MILLISECONDS,
              new LinkedBlockingQueue<>());
      executor.allowCoreThreadTimeOut(!options.isExclusive());
    }
    executor.setThreadFactory(threadFactory);

    if (options.isExclusive()) {
      int started;
      try {
        started = executor.prestartAllCoreThreads();
      } catch (RuntimeException | OutOfMemoryError e) {
        executor.shutdownNow();
        throw new BackendAllocationException(
            "Failed to start worker threads of task pool \"" + poolName + "\"", e);
      }
      if (started < options.getMaxThreads()) {
        executor.shutdownNow();
        throw new BackendAllocationException(
            "Started only "
                + started
                + " of "
                + options.getMaxThreads()
                + " worker threads of task pool \""
                + poolName
                + "\"");
      }
    }
    this.taskExecutor = executor;
  }

  /**
   * @param workItem to be run on a worker thread
   * @param taskId identifier put into the logging MDC while the item runs
   * @throws RejectedExecutionException if the backend is shut down or no thread could be spawned to
   *     run the item
   */
  public void execute(@Nonnull WorkItem workItem, long taskId) {
    Preconditions.checkNotNull(workItem, "workItem");
    taskExecutor.execute(
        () -> {
          Stopwatch sw = metricsScope.timer(MetricsType.TASK_EXECUTION_LATENCY).start();
          try {
            MDC.put(LoggerTag.TASK_POOL, poolName);
            MDC.put(LoggerTag.TASK_ID, String.valueOf(taskId));
            workItem.run();
          } catch (Throwable e) {
            uncaughtExceptionHandler.uncaughtException(Thread.currentThread(), e);
          } finally {
            sw.stop();
            MDC.remove(LoggerTag.TASK_POOL);
            MDC.remove(LoggerTag.TASK_ID);
          }
        });
  }

  /** Stops accepting work and returns immediately. Accepted work items still run. */
  public void shutdown() {
    taskExecutor.shutdown();
  }

  /** Stops accepting work and blocks until all accepted work items finished. */
  public void shutdownAndAwait() {
    ShutdownManager.shutdownExecutorUntimed(taskExecutor, toString());
  }

  public boolean isShutdown() {
    return taskExecutor.isShutdown();
  }

  public boolean isTerminated() {
    return taskExecutor.isTerminated();
  }

  @VisibleForTesting
  public int getPoolSize() {
    return taskExecutor.getPoolSize();
  }

  @VisibleForTesting
  public int getLargestPoolSize() {
    return taskExecutor.getLargestPoolSize();
  }

  @Override
  public String toString() {
    return String.format("ThreadPoolBackend{name=%s}", threadNamePrefix);
  }
}
