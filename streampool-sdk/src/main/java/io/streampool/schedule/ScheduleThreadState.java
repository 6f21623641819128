package io.streampool.schedule;

public enum ScheduleThreadState {
  /** No references, there is no schedule thread and no loop */
  IDLE,
  /**
   * At least one reference is held. The schedule thread exists and its loop was confirmed to be
   * dispatching before the first acquisition returned.
   */
  ACTIVE
}
