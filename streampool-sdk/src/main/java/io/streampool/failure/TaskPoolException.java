package io.streampool.failure;

/**
 * Base class for all exceptions thrown by task pools.
 *
 * <p>Only errors detected in the calling thread are reported this way. Exceptions thrown by a work
 * item never propagate to the thread that pushed it.
 */
public class TaskPoolException extends RuntimeException {
  protected TaskPoolException(String message, Throwable cause) {
    super(message, cause, false, true);
  }
}
