package io.streampool.failure;

/** The pool implementation doesn't provide the requested operation, usually task submission. */
public final class TaskPoolNotSupportedException extends TaskPoolException {

  public TaskPoolNotSupportedException(String message) {
    super(message, null);
  }
}
