package io.streampool.pool;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Factory methods of task pools and access to the process-wide default pool. */
public final class TaskPools {

  private static final Logger log = LoggerFactory.getLogger(TaskPools.class);

  static final String DEFAULT_POOL_NAME = "DefaultTaskPool";

  // not cached if creation throws, the next getDefault() call retries
  private static final Supplier<DefaultTaskPool> DEFAULT_POOL =
      Suppliers.memoize(TaskPools::createDefaultPool);

  private TaskPools() {}

  /**
   * Returns the process-wide task pool, creating and preparing it on the first call. All callers
   * share the same instance, which lives until the process exits: its {@link TaskPool#cleanup()}
   * is ignored and it provides no schedule thread.
   */
  public static TaskPool getDefault() {
    return DEFAULT_POOL.get();
  }

  /** Creates an unprepared pool with an unlimited number of lazily spawned threads. */
  public static TaskPool newTaskPool() {
    return newTaskPool(TaskPoolOptions.getDefaultInstance());
  }

  /**
   * Creates an unprepared pool.
   *
   * @param maxThreads maximum number of worker threads, {@link TaskPoolOptions#UNLIMITED_THREADS}
   *     for no limit
   * @param exclusive start all threads on {@link TaskPool#prepare()} instead of on demand
   */
  public static TaskPool newTaskPool(int maxThreads, boolean exclusive) {
    return newTaskPool(
        TaskPoolOptions.newBuilder()
            .setMaxThreads(maxThreads)
            .setExclusive(exclusive)
            .validateAndBuildWithDefaults());
  }

  /** Creates an unprepared pool. */
  public static TaskPool newTaskPool(@Nonnull TaskPoolOptions options) {
    return new DefaultTaskPool(options);
  }

  private static DefaultTaskPool createDefaultPool() {
    DefaultTaskPool pool =
        new DefaultTaskPool(
            TaskPoolOptions.newBuilder().setName(DEFAULT_POOL_NAME).validateAndBuildWithDefaults(),
            true);
    pool.prepare();
    log.debug("Created the process-wide default task pool {}", pool);
    return pool;
  }
}
