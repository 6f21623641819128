package io.streampool.schedule;

/** Callback of a source attached to a {@link ScheduleContext}. */
@FunctionalInterface
public interface ScheduleCallback {

  /**
   * Called on the schedule thread.
   *
   * @return true to keep the source attached and be called again, false to remove it
   */
  boolean dispatch();
}
