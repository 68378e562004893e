package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;

/**
 * An authenticated session.
 *
 * @param tokenId   unguessable opaque identifier handed to the caller
 * @param username  the authenticated user
 * @param issuedAt  when the session was created
 * @param expiresAt when the session stops being valid
 */
public record SessionToken(
    String tokenId,
    String username,
    Instant issuedAt,
    Instant expiresAt) {

  /**
   * True once {@code now} has reached the expiry instant.
   *
   * @param now the current instant
   * @return the boolean
   */
  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  @Override
  public String toString() {
    return "SessionToken[username=" + username + ", issuedAt=" + issuedAt
        + ", expiresAt=" + expiresAt + "]";
  }
}
