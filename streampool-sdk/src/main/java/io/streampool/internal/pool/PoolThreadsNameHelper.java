package io.streampool.internal.pool;

public final class PoolThreadsNameHelper {
  private static final String WORKER_THREAD_NAME_PREFIX = "Task Worker pool=";
  private static final String SCHEDULE_THREAD_NAME_PREFIX = "Task Scheduler pool=";

  private PoolThreadsNameHelper() {}

  public static String getWorkerThreadPrefix(String poolName) {
    return WORKER_THREAD_NAME_PREFIX + "\"" + poolName + "\"";
  }

  public static String getScheduleThreadPrefix(String poolName) {
    return SCHEDULE_THREAD_NAME_PREFIX + "\"" + poolName + "\"";
  }
}
