package io.streampool.pool;

public final class MetricsTag {
  private MetricsTag() {}

  public static final String TASK_POOL = "task_pool";
}
