package io.streampool.failure;

/** The caller violated a usage contract of a pool or of its schedule loop. */
public final class InvalidUsageException extends TaskPoolException {

  public InvalidUsageException(String message) {
    super(message, null);
  }
}
