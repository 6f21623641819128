package io.streampool.internal.schedule;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.streampool.failure.InvalidUsageException;
import io.streampool.schedule.ScheduleCallback;
import io.streampool.schedule.ScheduledSource;
import io.streampool.schedule.ScheduleContext;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative single threaded dispatcher of timer and idle sources. The thread calling {@link
 * #run()} dispatches sources one at a time until {@link #quit()} is called. Due timers are
 * dispatched before idle sources, timers in the order of their deadlines and idle sources round
 * robin.
 */
final class ScheduleLoop implements ScheduleContext {

  private static final Logger log = LoggerFactory.getLogger(ScheduleLoop.class);

  private static final long IDLE = -1;

  /**
   * Longest interval accepted by {@link #addTimeout}. Keeps any two deadlines less than 2^63 nanos
   * apart so they can be compared by their difference, as {@link System#nanoTime()} requires.
   */
  static final Duration MAX_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE / 2);

  private final class Source implements ScheduledSource {
    private final long sequence;
    private final ScheduleCallback callback;
    private final long intervalNanos;
    private long deadlineNanos;
    private boolean done;

    Source(long sequence, ScheduleCallback callback, long intervalNanos) {
      this.sequence = sequence;
      this.callback = callback;
      this.intervalNanos = intervalNanos;
    }

    long getSequence() {
      return sequence;
    }

    long getDeadlineNanos() {
      return deadlineNanos;
    }

    boolean isIdle() {
      return intervalNanos == IDLE;
    }

    @Override
    public void cancel() {
      lock.lock();
      try {
        if (done) {
          return;
        }
        done = true;
        if (isIdle()) {
          idleSources.remove(this);
        } else {
          timerSources.remove(this);
        }
      } finally {
        lock.unlock();
      }
    }

    @Override
    public boolean isDone() {
      lock.lock();
      try {
        return done;
      } finally {
        lock.unlock();
      }
    }

    @Override
    public String toString() {
      return "Source{"
          + "sequence="
          + sequence
          + ", callback="
          + callback
          + ", interval="
          + (isIdle() ? "idle" : Duration.ofNanos(intervalNanos))
          + '}';
    }
  }

  private final String name;
  private final LongSupplier nanoClock;
  private final Lock lock = new ReentrantLock();
  private final Condition condition = lock.newCondition();

  private final PriorityQueue<Source> timerSources =
      new PriorityQueue<>(
          (a, b) -> {
            // deadlines come from nanoTime and may wrap, compare them by difference
            long difference = a.getDeadlineNanos() - b.getDeadlineNanos();
            return difference != 0
                ? Long.signum(difference)
                : Long.compare(a.getSequence(), b.getSequence());
          });
  private final ArrayDeque<Source> idleSources = new ArrayDeque<>();
  private long nextSequence;
  private boolean quit;
  private volatile Thread loopThread;

  ScheduleLoop(String name) {
    this(name, System::nanoTime);
  }

  @VisibleForTesting
  ScheduleLoop(String name, LongSupplier nanoClock) {
    this.name = name;
    this.nanoClock = nanoClock;
  }

  /** Dispatches sources on the calling thread until {@link #quit()}. */
  void run() {
    lock.lock();
    try {
      Preconditions.checkState(loopThread == null, "%s is already running", this);
      loopThread = Thread.currentThread();
    } finally {
      lock.unlock();
    }
    log.debug("{} started", this);
    try {
      Source source;
      while ((source = nextSource()) != null) {
        dispatch(source);
      }
    } finally {
      lock.lock();
      try {
        quit = true;
        // sources that are still attached are discarded, their owners had to cancel them
        timerSources.forEach(s -> s.done = true);
        idleSources.forEach(s -> s.done = true);
        timerSources.clear();
        idleSources.clear();
      } finally {
        lock.unlock();
      }
      log.debug("{} stopped", this);
    }
  }

  /** Makes {@link #run()} return after the dispatch in progress, if any. */
  void quit() {
    lock.lock();
    try {
      quit = true;
      condition.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isQuit() {
    lock.lock();
    try {
      return quit;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  int getAttachedSourceCount() {
    lock.lock();
    try {
      return timerSources.size() + idleSources.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ScheduledSource invoke(@Nonnull Runnable runnable) {
    Objects.requireNonNull(runnable, "runnable");
    return attach(
        () -> {
          runnable.run();
          return false;
        },
        IDLE);
  }

  @Override
  public ScheduledSource addIdle(@Nonnull ScheduleCallback callback) {
    Objects.requireNonNull(callback, "callback");
    return attach(callback, IDLE);
  }

  @Override
  public ScheduledSource addTimeout(
      @Nonnull Duration interval, @Nonnull ScheduleCallback callback) {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(callback, "callback");
    Preconditions.checkArgument(!interval.isNegative(), "negative interval: %s", interval);
    Preconditions.checkArgument(
        interval.compareTo(MAX_TIMEOUT) <= 0, "interval longer than %s: %s", MAX_TIMEOUT, interval);
    return attach(callback, interval.toNanos());
  }

  @Override
  public boolean isLoopThread() {
    return Thread.currentThread() == loopThread;
  }

  private Source attach(ScheduleCallback callback, long intervalNanos) {
    lock.lock();
    try {
      if (quit) {
        throw new InvalidUsageException(this + " is not running anymore");
      }
      Source source = new Source(nextSequence++, callback, intervalNanos);
      enqueueLocked(source);
      condition.signal();
      return source;
    } finally {
      lock.unlock();
    }
  }

  private void enqueueLocked(Source source) {
    if (source.isIdle()) {
      idleSources.add(source);
    } else {
      source.deadlineNanos = nanoClock.getAsLong() + source.intervalNanos;
      timerSources.add(source);
    }
  }

  /** @return the next source to dispatch or null once the loop has to stop */
  private Source nextSource() {
    lock.lock();
    try {
      while (!quit) {
        long now = nanoClock.getAsLong();
        Source timer = timerSources.peek();
        if (timer != null && timer.deadlineNanos - now <= 0) {
          return timerSources.poll();
        }
        Source idle = idleSources.poll();
        if (idle != null) {
          return idle;
        }
        if (timer != null) {
          condition.awaitNanos(timer.deadlineNanos - now);
        } else {
          condition.await();
        }
      }
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("{} interrupted, stopping", this);
      quit = true;
      return null;
    } finally {
      lock.unlock();
    }
  }

  private void dispatch(Source source) {
    lock.lock();
    try {
      // cancelled between polling and dispatching
      if (source.done) {
        return;
      }
    } finally {
      lock.unlock();
    }
    boolean keep;
    try {
      keep = source.callback.dispatch();
    } catch (Throwable e) {
      log.error("Unexpected failure in schedule callback {}, removing it", source, e);
      keep = false;
    }
    lock.lock();
    try {
      if (keep && !source.done && !quit) {
        enqueueLocked(source);
      } else {
        source.done = true;
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "ScheduleLoop{name=" + name + '}';
  }
}
