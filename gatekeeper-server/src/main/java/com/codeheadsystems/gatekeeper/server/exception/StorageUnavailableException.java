package com.codeheadsystems.gatekeeper.server.exception;

/**
 * Thrown by store implementations when the backing storage cannot be reached.
 * The credential manager never retries; it propagates this unchanged.
 */
public class StorageUnavailableException extends RuntimeException {

  /**
   * Instantiates a new Storage unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StorageUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Instantiates a new Storage unavailable exception.
   *
   * @param message the message
   */
  public StorageUnavailableException(final String message) {
    super(message);
  }
}
