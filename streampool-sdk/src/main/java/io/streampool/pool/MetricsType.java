package io.streampool.pool;

public final class MetricsType {
  private MetricsType() {}

  public static final String STREAMPOOL_METRICS_PREFIX = "streampool_";

  //
  // Work items
  //
  public static final String TASK_PUSHED_COUNTER = STREAMPOOL_METRICS_PREFIX + "task_pushed";

  /** Work item discarded because the pool was not prepared when it was pushed. */
  public static final String TASK_DROPPED_COUNTER = STREAMPOOL_METRICS_PREFIX + "task_dropped";

  /** Time a work item spent running on a worker thread, regardless of its outcome. */
  public static final String TASK_EXECUTION_LATENCY =
      STREAMPOOL_METRICS_PREFIX + "task_execution_latency";

  //
  // Schedule thread
  //
  public static final String SCHEDULE_THREAD_REFERENCES =
      STREAMPOOL_METRICS_PREFIX + "schedule_thread_references";
  public static final String SCHEDULE_THREAD_STARTED_COUNTER =
      STREAMPOOL_METRICS_PREFIX + "schedule_thread_started";
  public static final String SCHEDULE_THREAD_STOPPED_COUNTER =
      STREAMPOOL_METRICS_PREFIX + "schedule_thread_stopped";
}
