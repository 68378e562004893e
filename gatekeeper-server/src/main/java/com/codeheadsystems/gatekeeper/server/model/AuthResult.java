package com.codeheadsystems.gatekeeper.server.model;

import java.util.Optional;

/**
 * Outcome of an authentication attempt: either a session token or a failure reason.
 * Exactly one of the two components is non-null.
 *
 * @param sessionToken  the issued session, when authenticated
 * @param failureReason why the attempt was rejected, otherwise
 */
public record AuthResult(SessionToken sessionToken, AuthFailureReason failureReason) {

  /**
   * Enforces that exactly one component is present.
   */
  public AuthResult {
    if ((sessionToken == null) == (failureReason == null)) {
      throw new IllegalArgumentException("Exactly one of sessionToken or failureReason is required");
    }
  }

  /**
   * Successful authentication.
   *
   * @param sessionToken the issued session
   * @return the auth result
   */
  public static AuthResult authenticated(SessionToken sessionToken) {
    return new AuthResult(sessionToken, null);
  }

  /**
   * Rejected authentication.
   *
   * @param reason the reason
   * @return the auth result
   */
  public static AuthResult rejected(AuthFailureReason reason) {
    return new AuthResult(null, reason);
  }

  /**
   * Is authenticated boolean.
   *
   * @return the boolean
   */
  public boolean isAuthenticated() {
    return sessionToken != null;
  }

  /**
   * The session, if authenticated.
   *
   * @return the optional
   */
  public Optional<SessionToken> session() {
    return Optional.ofNullable(sessionToken);
  }
}
