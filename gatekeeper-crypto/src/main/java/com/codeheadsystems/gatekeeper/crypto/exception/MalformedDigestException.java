package com.codeheadsystems.gatekeeper.crypto.exception;

/**
 * Thrown when a stored password digest cannot be parsed.
 * <p>
 * A malformed digest means the stored data is corrupt. It is never reported as a simple
 * password mismatch. Messages never include the digest itself.
 */
public class MalformedDigestException extends RuntimeException {

  /**
   * Instantiates a new Malformed digest exception.
   *
   * @param message the message
   */
  public MalformedDigestException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Malformed digest exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedDigestException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
