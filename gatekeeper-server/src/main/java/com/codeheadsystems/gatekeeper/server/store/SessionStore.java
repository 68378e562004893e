package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.exception.StorageUnavailableException;
import com.codeheadsystems.gatekeeper.server.model.SessionToken;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for authenticated sessions.
 * <p>
 * Implementations must be thread-safe. Expiry is decided by the caller against its own clock,
 * so {@link #get(String)} returns expired tokens as stored. I/O failures are reported as
 * {@link StorageUnavailableException}.
 * <p>
 * <strong>Password change contract:</strong> when a user's password changes, <em>all</em>
 * of that user's sessions are revoked through {@link #deleteByUsername(String)}.
 * Implementations must maintain whatever index is needed to do that without a full scan.
 */
public interface SessionStore {

  /**
   * Stores a session keyed by its token id.
   *
   * @param sessionToken the session
   */
  void put(SessionToken sessionToken);

  /**
   * Loads a session by token id.
   *
   * @param tokenId the token id
   * @return the session, or empty if not found
   */
  Optional<SessionToken> get(String tokenId);

  /**
   * Removes a session. Removing an unknown token id is not an error.
   *
   * @param tokenId the token id
   */
  void delete(String tokenId);

  /**
   * Removes every session belonging to the given user. Not an error if there are none.
   *
   * @param username the username
   */
  void deleteByUsername(String username);

  /**
   * Removes every session that has expired at {@code now}. Stores with native expiry (a TTL
   * index, a cache eviction policy) can leave the default, which removes nothing.
   *
   * @param now the current instant
   * @return the number of sessions removed
   */
  default int purgeExpired(Instant now) {
    return 0;
  }
}
