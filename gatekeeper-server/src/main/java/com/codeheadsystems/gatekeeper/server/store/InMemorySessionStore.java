package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.SessionToken;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on restart. Suitable for development and testing only. Expired
 * sessions that are never validated again stay until {@link #purgeExpired(Instant)} runs.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionToken> store = new ConcurrentHashMap<>();
  // Reverse index: username → token ids. Updated only inside per-username compute calls,
  // and a username's entry is removed once its set is empty.
  private final ConcurrentHashMap<String, Set<String>> usernameToTokenIds = new ConcurrentHashMap<>();

  @Override
  public void put(SessionToken sessionToken) {
    usernameToTokenIds.compute(sessionToken.username(), (username, tokenIds) -> {
      Set<String> ids = tokenIds == null ? ConcurrentHashMap.newKeySet() : tokenIds;
      ids.add(sessionToken.tokenId());
      store.put(sessionToken.tokenId(), sessionToken);
      return ids;
    });
    log.debug("Stored session for username={}", sessionToken.username());
  }

  @Override
  public Optional<SessionToken> get(String tokenId) {
    return Optional.ofNullable(store.get(tokenId));
  }

  @Override
  public void delete(String tokenId) {
    SessionToken removed = store.remove(tokenId);
    if (removed != null) {
      usernameToTokenIds.computeIfPresent(removed.username(), (username, tokenIds) -> {
        tokenIds.remove(tokenId);
        return tokenIds.isEmpty() ? null : tokenIds;
      });
      log.debug("Deleted session for username={}", removed.username());
    }
  }

  @Override
  public void deleteByUsername(String username) {
    Set<String> tokenIds = usernameToTokenIds.remove(username);
    if (tokenIds != null) {
      tokenIds.forEach(store::remove);
      log.debug("Deleted {} session(s) for username={}", tokenIds.size(), username);
    }
  }

  @Override
  public int purgeExpired(Instant now) {
    List<String> expired = store.values().stream()
        .filter(session -> session.isExpiredAt(now))
        .map(SessionToken::tokenId)
        .toList();
    expired.forEach(this::delete);
    if (!expired.isEmpty()) {
      log.debug("Purged {} expired session(s)", expired.size());
    }
    return expired.size();
  }

  /**
   * Number of stored sessions, expired ones included.
   *
   * @return the int
   */
  public int size() {
    return store.size();
  }

  /**
   * Number of usernames with at least one indexed session.
   *
   * @return the int
   */
  int indexedUsernames() {
    return usernameToTokenIds.size();
  }
}
