package io.streampool.failure;

/**
 * Thrown when worker threads of a pool backend or the schedule thread of a pool could not be
 * created. The pool is left in the state it had before the failed call, so the call may be retried.
 */
public final class BackendAllocationException extends TaskPoolException {

  public BackendAllocationException(String message, Throwable cause) {
    super(message, cause);
  }

  public BackendAllocationException(String message) {
    this(message, null);
  }
}
