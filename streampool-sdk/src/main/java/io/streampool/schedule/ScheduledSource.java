package io.streampool.schedule;

/** Source attached to a {@link ScheduleContext}. */
public interface ScheduledSource {

  /**
   * Detaches the source. A dispatch already in progress is not interrupted, but the source is not
   * dispatched again. Calling it more than once has no effect.
   */
  void cancel();

  /** @return true if the source was cancelled or removed itself by returning false */
  boolean isDone();
}
