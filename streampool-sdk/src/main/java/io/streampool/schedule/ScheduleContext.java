package io.streampool.schedule;

import java.time.Duration;
import javax.annotation.Nonnull;

/**
 * Handle to the cooperative loop running on the schedule thread of a task pool. All callbacks
 * attached here run one at a time on that single thread, so they never need to synchronize with
 * each other.
 *
 * <p>A context obtained from {@link io.streampool.pool.TaskPool#getScheduleContext()} is only
 * usable until the matching {@link io.streampool.pool.TaskPool#releaseScheduleThread()}. Callers
 * are expected to cancel their own sources before releasing, anything still attached when the loop
 * quits is discarded without being dispatched. Attaching to a loop that already quit throws {@link
 * io.streampool.failure.InvalidUsageException}.
 */
public interface ScheduleContext {

  /** Runs {@code runnable} once on the schedule thread, as soon as no timer is due. */
  ScheduledSource invoke(@Nonnull Runnable runnable);

  /** Dispatches {@code callback} whenever no timer is due, for as long as it returns true. */
  ScheduledSource addIdle(@Nonnull ScheduleCallback callback);

  /**
   * Dispatches {@code callback} after {@code interval}, and then again every {@code interval} for
   * as long as it returns true.
   */
  ScheduledSource addTimeout(@Nonnull Duration interval, @Nonnull ScheduleCallback callback);

  /** @return true if called from the schedule thread running this context */
  boolean isLoopThread();
}
