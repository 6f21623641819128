package io.streampool.pool;

/**
 * Function run by a {@link WorkItem} on a worker thread.
 *
 * @param <C> type of the opaque context passed back to the function
 */
@FunctionalInterface
public interface TaskFunction<C> {
  void run(C context) throws Exception;
}
