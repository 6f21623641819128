package io.streampool.pool;

/**
 * Opaque token returned by {@link TaskPool#push(WorkItem)} and accepted by {@link
 * TaskPool#join(TaskHandle)}. Whether a handle gives any control over the pushed work depends on
 * the pool implementation; handles of the default pool are purely advisory.
 */
public interface TaskHandle {

  /** Identifier of the pushed work item, unique within the pool that issued the handle. */
  long getId();
}
