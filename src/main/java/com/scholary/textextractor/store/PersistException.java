package com.scholary.textextractor.store;

/**
 * Exception thrown when extracted texts cannot be written.
 *
 * <p>Fatal to the persist call in progress. Files already renamed into place stay complete; the
 * file being written when the failure happened is never left half-written.
 */
public class PersistException extends RuntimeException {

  public PersistException(String message) {
    super(message);
  }

  public PersistException(String message, Throwable cause) {
    super(message, cause);
  }
}
