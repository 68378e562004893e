package com.codeheadsystems.gatekeeper.crypto.exception;

/**
 * Thrown when a caller passes empty or otherwise unusable input, such as an empty password.
 * This always indicates a bug in the caller rather than a user mistake.
 */
public class InvalidInputException extends IllegalArgumentException {

  /**
   * Instantiates a new Invalid input exception.
   *
   * @param message the message
   */
  public InvalidInputException(final String message) {
    super(message);
  }
}
