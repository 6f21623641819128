package io.streampool.pool;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.streampool.failure.BackendAllocationException;
import io.streampool.internal.pool.ThreadPoolBackend;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskPool} running work items on worker threads, up to {@link
 * TaskPoolOptions#getMaxThreads()} of them at the same time. Handles returned by {@link
 * #push(WorkItem)} are advisory, {@link #join(TaskHandle)} does nothing as an item handed to a
 * worker can't be joined or cancelled individually.
 *
 * <p>Preparing the pool again retires its backend: the items it accepted still run and the next
 * {@link #cleanup()} waits for them. The process-wide default pool is prepared once, further calls
 * are ignored.
 *
 * <p>Items pushed while the pool isn't prepared, or while a {@link #cleanup()} is draining it, are
 * dropped: they never run, a warning is logged, {@link MetricsType#TASK_DROPPED_COUNTER} is
 * incremented and {@code push} returns an empty handle.
 */
public class DefaultTaskPool extends BaseTaskPool {

  private static final Logger log = LoggerFactory.getLogger(DefaultTaskPool.class);

  private static final class DefaultTaskHandle implements TaskHandle {
    private final long id;

    DefaultTaskHandle(long id) {
      this.id = id;
    }

    @Override
    public long getId() {
      return id;
    }

    @Override
    public String toString() {
      return "DefaultTaskHandle{id=" + id + '}';
    }
  }

  private final Lock lock = new ReentrantLock();
  private final AtomicLong taskIds = new AtomicLong();

  // guarded by lock
  @Nullable private ThreadPoolBackend backend;
  // backends replaced by a repeated prepare(), still running the items they accepted
  private final List<ThreadPoolBackend> replacedBackends = new ArrayList<>();
  // completed when the drain started by the last cleanup() finished, guarded by lock
  @Nullable private CompletableFuture<Void> pendingDrain;

  public DefaultTaskPool(@Nonnull TaskPoolOptions options) {
    super(options);
  }

  DefaultTaskPool(@Nonnull TaskPoolOptions options, boolean processDefault) {
    super(options, processDefault);
  }

  @Override
  public void prepare() {
    if (isProcessDefault() && isPrepared()) {
      log.warn("Ignoring prepare of the already prepared process-wide default task pool {}", this);
      return;
    }
    // worker threads of the process-wide pool must not keep the JVM alive as it's never cleaned up
    ThreadPoolBackend prepared =
        new ThreadPoolBackend(getOptions(), getMetricsScope(), isProcessDefault());
    ThreadPoolBackend replaced;
    lock.lock();
    try {
      replaced = backend;
      backend = prepared;
      if (replaced != null) {
        replacedBackends.removeIf(ThreadPoolBackend::isTerminated);
        replacedBackends.add(replaced);
      }
    } finally {
      lock.unlock();
    }
    if (replaced != null) {
      log.warn("{} prepared again, retiring its previous backend {}", this, replaced);
      // its accepted items still run, the next cleanup() waits for them
      replaced.shutdown();
    }
    log.debug("{} prepared", this);
  }

  @Override
  public void cleanup() {
    if (isProcessDefault()) {
      log.warn("Ignoring cleanup of the process-wide default task pool {}", this);
      return;
    }
    List<ThreadPoolBackend> draining = new ArrayList<>();
    CompletableFuture<Void> drained;
    lock.lock();
    try {
      draining.addAll(replacedBackends);
      replacedBackends.clear();
      if (backend != null) {
        draining.add(backend);
        backend = null;
      }
      if (draining.isEmpty()) {
        drained = pendingDrain;
      } else {
        drained = new CompletableFuture<>();
        pendingDrain = drained;
      }
    } finally {
      lock.unlock();
    }

    if (draining.isEmpty()) {
      // not prepared, or another thread is draining: wait for that drain to finish
      if (drained != null) {
        drained.join();
      }
      return;
    }
    try {
      for (ThreadPoolBackend drainingBackend : draining) {
        drainingBackend.shutdownAndAwait();
      }
    } finally {
      lock.lock();
      try {
        if (pendingDrain == drained) {
          pendingDrain = null;
        }
      } finally {
        lock.unlock();
      }
      drained.complete(null);
    }
    log.debug("{} cleaned up", this);
  }

  /**
   * @throws BackendAllocationException if the backend has no thread available for the item and
   *     can't spawn one
   */
  @Override
  public Optional<TaskHandle> push(@Nonnull WorkItem workItem) {
    Preconditions.checkNotNull(workItem, "workItem");
    lock.lock();
    try {
      if (backend != null) {
        long taskId = taskIds.incrementAndGet();
        try {
          backend.execute(workItem, taskId);
        } catch (RejectedExecutionException e) {
          throw new BackendAllocationException(
              "Failed to dispatch " + workItem + " on " + this, e);
        }
        getMetricsScope().counter(MetricsType.TASK_PUSHED_COUNTER).inc(1);
        return Optional.of(new DefaultTaskHandle(taskId));
      }
    } finally {
      lock.unlock();
    }
    log.warn("{} is not prepared, dropping {}", this, workItem);
    getMetricsScope().counter(MetricsType.TASK_DROPPED_COUNTER).inc(1);
    return Optional.empty();
  }

  @Override
  public void join(@Nullable TaskHandle handle) {
    // work handed to a worker thread can't be joined
  }

  public boolean isPrepared() {
    lock.lock();
    try {
      return backend != null;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  @Nullable
  ThreadPoolBackend getBackend() {
    lock.lock();
    try {
      return backend;
    } finally {
      lock.unlock();
    }
  }
}
