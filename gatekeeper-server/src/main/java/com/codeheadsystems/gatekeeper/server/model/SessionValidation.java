package com.codeheadsystems.gatekeeper.server.model;

import java.util.Optional;

/**
 * Outcome of validating a session token: either the session's username or an invalid reason.
 *
 * @param username      the authenticated user, when valid
 * @param invalidReason why the token was not accepted, otherwise
 */
public record SessionValidation(String username, SessionInvalidReason invalidReason) {

  /**
   * Enforces that exactly one component is present.
   */
  public SessionValidation {
    if ((username == null) == (invalidReason == null)) {
      throw new IllegalArgumentException("Exactly one of username or invalidReason is required");
    }
  }

  public static SessionValidation valid(String username) {
    return new SessionValidation(username, null);
  }

  public static SessionValidation invalid(SessionInvalidReason reason) {
    return new SessionValidation(null, reason);
  }

  public boolean isValid() {
    return username != null;
  }

  public Optional<String> user() {
    return Optional.ofNullable(username);
  }
}
