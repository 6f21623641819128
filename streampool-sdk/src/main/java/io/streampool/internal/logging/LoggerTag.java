package io.streampool.internal.logging;

public final class LoggerTag {
  private LoggerTag() {}

  public static final String TASK_POOL = "TaskPool";
  public static final String TASK_ID = "TaskId";
}
