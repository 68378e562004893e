package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;

/**
 * A registered user's stored credential.
 *
 * @param username       unique, immutable user name
 * @param passwordDigest self-describing password digest; never the plaintext
 * @param createdAt      when the credential was registered
 */
public record Credential(
    String username,
    String passwordDigest,
    Instant createdAt) {

  /**
   * Returns a copy of this credential carrying a new digest.
   *
   * @param newDigest the new password digest
   * @return the credential
   */
  public Credential withPasswordDigest(String newDigest) {
    return new Credential(username, newDigest, createdAt);
  }

  @Override
  public String toString() {
    return "Credential[username=" + username + ", createdAt=" + createdAt + "]";
  }
}
