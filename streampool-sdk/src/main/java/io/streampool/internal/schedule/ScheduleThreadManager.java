package io.streampool.internal.schedule;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Uninterruptibles;
import com.uber.m3.tally.Scope;
import io.streampool.failure.BackendAllocationException;
import io.streampool.failure.InvalidUsageException;
import io.streampool.internal.pool.ExecutorThreadFactory;
import io.streampool.internal.pool.PoolThreadsNameHelper;
import io.streampool.pool.MetricsType;
import io.streampool.schedule.ScheduleContext;
import io.streampool.schedule.ScheduleThreadState;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference counted schedule thread of a task pool. The first {@link #acquire()} spawns a thread
 * running a {@link ScheduleLoop}, the {@link #release()} matching the last outstanding acquisition
 * quits the loop and joins the thread. Acquisitions and releases are serialized by one lock, the
 * same lock guards the reference count.
 */
public final class ScheduleThreadManager {

  private static final Logger log = LoggerFactory.getLogger(ScheduleThreadManager.class);

  private final String poolName;
  private final boolean enabled;
  @Nullable private final Duration startTimeout;
  private final Scope metricsScope;
  private final ThreadFactory threadFactory;

  private final Lock lock = new ReentrantLock();
  private final Condition loopStarted = lock.newCondition();

  // all guarded by lock
  private int references;
  private ScheduleLoop loop;
  private Thread thread;
  private boolean loopRunning;
  // a thread is spawning the loop and waiting for it with the lock released
  private boolean starting;

  private final AtomicInteger threadsStarted = new AtomicInteger();
  private final AtomicInteger threadsStopped = new AtomicInteger();

  /**
   * @param poolName name of the owning pool, used to name the schedule thread
   * @param enabled false for pools that must never get a schedule thread, all acquisitions fail
   * @param startTimeout bound on the wait for a new loop to start dispatching, null to wait forever
   * @param uncaughtExceptionHandler handler of the schedule thread
   * @param metricsScope scope of the owning pool
   */
  public ScheduleThreadManager(
      @Nonnull String poolName,
      boolean enabled,
      @Nullable Duration startTimeout,
      Thread.UncaughtExceptionHandler uncaughtExceptionHandler,
      @Nonnull Scope metricsScope) {
    this(
        poolName,
        enabled,
        startTimeout,
        metricsScope,
        new ExecutorThreadFactory(
            PoolThreadsNameHelper.getScheduleThreadPrefix(poolName),
            uncaughtExceptionHandler,
            false));
  }

  @VisibleForTesting
  ScheduleThreadManager(
      @Nonnull String poolName,
      boolean enabled,
      @Nullable Duration startTimeout,
      @Nonnull Scope metricsScope,
      @Nonnull ThreadFactory threadFactory) {
    this.poolName = Objects.requireNonNull(poolName);
    this.enabled = enabled;
    this.startTimeout = startTimeout;
    this.metricsScope = Objects.requireNonNull(metricsScope);
    this.threadFactory = Objects.requireNonNull(threadFactory);
  }

  /**
   * Takes a reference on the schedule thread, spawning it if this is the first reference. Returns
   * only after the loop of a newly spawned thread is dispatching. Callers arriving while another
   * caller is spawning the thread wait for it and share the thread.
   *
   * @return false if schedule threads are disabled for the owning pool
   * @throws BackendAllocationException if the thread couldn't be spawned or didn't start in time.
   *     The reference count is unchanged in this case.
   */
  public boolean acquire() {
    if (!enabled) {
      log.warn("Task pool \"{}\" doesn't provide a schedule thread", poolName);
      return false;
    }
    lock.lock();
    try {
      // later acquirers wait for the start in progress, they retry it if it failed
      while (starting) {
        loopStarted.awaitUninterruptibly();
      }
      if (references == 0) {
        startLocked();
      }
      references++;
      metricsScope.gauge(MetricsType.SCHEDULE_THREAD_REFERENCES).update(references);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops a reference on the schedule thread. Dropping the last one quits the loop, discarding
   * every source still attached, and waits for the thread to exit.
   *
   * @return false if there was no reference to drop
   */
  public boolean release() {
    lock.lock();
    try {
      if (references == 0) {
        log.warn("Unbalanced release of the schedule thread of task pool \"{}\"", poolName);
        return false;
      }
      references--;
      metricsScope.gauge(MetricsType.SCHEDULE_THREAD_REFERENCES).update(references);
      if (references == 0) {
        stopLocked();
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** @return the running loop, empty if no reference is held */
  public Optional<ScheduleContext> getContext() {
    lock.lock();
    try {
      return references > 0 ? Optional.of(loop) : Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  public ScheduleThreadState getState() {
    lock.lock();
    try {
      return references > 0 ? ScheduleThreadState.ACTIVE : ScheduleThreadState.IDLE;
    } finally {
      lock.unlock();
    }
  }

  public int getReferences() {
    lock.lock();
    try {
      return references;
    } finally {
      lock.unlock();
    }
  }

  /** Number of schedule threads spawned over the lifetime of this manager. */
  @VisibleForTesting
  public int getThreadsStarted() {
    return threadsStarted.get();
  }

  /** Number of schedule threads stopped over the lifetime of this manager. */
  @VisibleForTesting
  public int getThreadsStopped() {
    return threadsStopped.get();
  }

  private void startLocked() {
    starting = true;
    try {
      spawnLocked();
    } finally {
      starting = false;
      loopStarted.signalAll();
    }
  }

  private void spawnLocked() {
    ScheduleLoop newLoop = new ScheduleLoop(poolName);
    Thread newThread;
    try {
      newThread = threadFactory.newThread(() -> runLoop(newLoop));
      if (newThread == null) {
        throw new BackendAllocationException(
            "Thread factory refused to create the schedule thread of task pool \""
                + poolName
                + "\"");
      }
      loop = newLoop;
      thread = newThread;
      loopRunning = false;
      newThread.start();
    } catch (RuntimeException | OutOfMemoryError e) {
      loop = null;
      thread = null;
      if (e instanceof BackendAllocationException) {
        throw (BackendAllocationException) e;
      }
      throw new BackendAllocationException(
          "Failed to spawn the schedule thread of task pool \"" + poolName + "\"", e);
    }

    try {
      awaitLoopRunningLocked();
    } catch (BackendAllocationException e) {
      // the thread may still come up later, it finds its loop quit and exits
      newLoop.quit();
      loop = null;
      thread = null;
      throw e;
    }
    threadsStarted.incrementAndGet();
    metricsScope.counter(MetricsType.SCHEDULE_THREAD_STARTED_COUNTER).inc(1);
    log.debug("Schedule thread {} of task pool \"{}\" started", newThread.getName(), poolName);
  }

  private void awaitLoopRunningLocked() {
    if (startTimeout == null) {
      while (!loopRunning) {
        loopStarted.awaitUninterruptibly();
      }
      return;
    }
    long remainingNanos = startTimeout.toNanos();
    try {
      while (!loopRunning) {
        if (remainingNanos <= 0) {
          throw new BackendAllocationException(
              "Schedule thread of task pool \""
                  + poolName
                  + "\" didn't start within "
                  + startTimeout);
        }
        remainingNanos = loopStarted.awaitNanos(remainingNanos);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendAllocationException(
          "Interrupted while waiting for the schedule thread of task pool \"" + poolName + "\"",
          e);
    }
  }

  private void stopLocked() {
    ScheduleLoop stoppingLoop = loop;
    Thread stoppingThread = thread;
    loop = null;
    thread = null;
    loopRunning = false;

    stoppingLoop.quit();
    if (stoppingThread == Thread.currentThread()) {
      // released from a callback, the thread exits as soon as the callback returns
      log.debug("Schedule thread of task pool \"{}\" released from itself", poolName);
    } else {
      Uninterruptibles.joinUninterruptibly(stoppingThread);
    }
    threadsStopped.incrementAndGet();
    metricsScope.counter(MetricsType.SCHEDULE_THREAD_STOPPED_COUNTER).inc(1);
    log.debug("Schedule thread of task pool \"{}\" stopped", poolName);
  }

  private void runLoop(ScheduleLoop scheduleLoop) {
    try {
      // the first dispatch of the loop confirms to the acquiring thread that the loop is running
      scheduleLoop.invoke(this::onLoopRunning);
    } catch (InvalidUsageException e) {
      log.debug("Schedule loop of task pool \"{}\" quit before it started", poolName, e);
      return;
    }
    scheduleLoop.run();
  }

  private void onLoopRunning() {
    lock.lock();
    try {
      if (loop != null && loop.isLoopThread()) {
        loopRunning = true;
        loopStarted.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }
}
