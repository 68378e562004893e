package com.codeheadsystems.gatekeeper.server.exception;

/**
 * Thrown when registering a username that already exists, whether detected by the lookup
 * before insert or by the store's own uniqueness constraint.
 */
public class DuplicateUsernameException extends RuntimeException {

  private final String username;

  /**
   * Instantiates a new Duplicate username exception.
   *
   * @param username the username
   */
  public DuplicateUsernameException(final String username) {
    super("Username already registered: " + username);
    this.username = username;
  }

  public String getUsername() {
    return username;
  }
}
