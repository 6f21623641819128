package io.streampool.pool;

import io.streampool.failure.BackendAllocationException;
import io.streampool.failure.TaskPoolNotSupportedException;
import io.streampool.schedule.ScheduleContext;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Pool of threads the streaming engine hands its work items to. The engine calls {@link
 * #prepare()} when streaming starts, {@link #push(WorkItem)} for every unit of work, and {@link
 * #cleanup()} when streaming stops.
 *
 * <p>{@link DefaultTaskPool} runs work items on a bounded or unbounded set of worker threads.
 * Custom pools implement this interface directly, usually on top of {@link BaseTaskPool} to get the
 * schedule thread management, and may embed a {@link DefaultTaskPool} to delegate to. The default
 * methods describe a pool without any backend: preparing, cleaning up and joining do nothing and
 * pushing is not supported.
 *
 * <p>All methods are safe to call from any thread.
 */
public interface TaskPool {

  /**
   * Prepares the pool to accept {@link #push(WorkItem)} calls. Preparing a pool that is already
   * prepared replaces its backend, work pushed before is not guaranteed to run.
   *
   * @throws BackendAllocationException if the backend couldn't be created. The pool stays in its
   *     previous state and the call may be retried.
   */
  default void prepare() {}

  /**
   * Stops accepting work and waits until all work items pushed before have finished running, then
   * releases the backend. Does nothing on a pool that is not prepared.
   *
   * <p>Must not be called from a work item running on this pool.
   */
  default void cleanup() {}

  /**
   * Submits a work item. Pushing on a pool that is not prepared drops the item without running it.
   *
   * @return handle to pass to {@link #join(TaskHandle)}. Empty if the item was dropped or the pool
   *     can't track individual items.
   * @throws TaskPoolNotSupportedException if the pool doesn't support pushing work at all
   */
  default Optional<TaskHandle> push(@Nonnull WorkItem workItem) {
    throw new TaskPoolNotSupportedException("Pushing work items on " + this + " is not supported");
  }

  /** Shortcut for {@code push(WorkItem.of(function, context))}. */
  default <C> Optional<TaskHandle> push(@Nonnull TaskFunction<C> function, @Nullable C context) {
    return push(WorkItem.of(function, context));
  }

  /**
   * Joins a pushed work item and/or returns its thread to the pool, if the pool supports that for
   * individual items. Best effort, pools that can't do it ignore the call.
   *
   * @param handle obtained from {@link #push(WorkItem)}
   */
  default void join(@Nullable TaskHandle handle) {}

  /**
   * Takes a reference on the schedule thread of the pool, a dedicated thread running a cooperative
   * loop for timer and idle callbacks. The thread is spawned by the first reference and stopped
   * when the last one is released. When this method returns true, the loop is already dispatching.
   *
   * @return false if the pool doesn't provide a schedule thread, like the process-wide default pool
   * @throws BackendAllocationException if the schedule thread couldn't be started
   */
  boolean acquireScheduleThread();

  /**
   * Releases a reference taken by {@link #acquireScheduleThread()}. Callers must cancel the sources
   * they attached to the schedule context before.
   *
   * @return false if no reference was held
   */
  boolean releaseScheduleThread();

  /**
   * @return the loop of the schedule thread, empty if no reference to the schedule thread is held.
   *     Only valid until the matching {@link #releaseScheduleThread()}.
   */
  Optional<ScheduleContext> getScheduleContext();
}
