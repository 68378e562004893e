package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.exception.DuplicateUsernameException;
import com.codeheadsystems.gatekeeper.server.model.Credential;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All registrations are lost on restart. Suitable for development and testing only.
 * Replace with a database-backed implementation for production.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<String, Credential> store = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    log.warn("Using InMemoryUserStore: registrations will NOT survive restarts. "
        + "Replace with a persistent UserStore for production.");
  }

  @Override
  public Optional<Credential> findByUsername(String username) {
    return Optional.ofNullable(store.get(username));
  }

  @Override
  public void insert(Credential credential) {
    if (store.putIfAbsent(credential.username(), credential) != null) {
      throw new DuplicateUsernameException(credential.username());
    }
    log.debug("Stored credential for username={}", credential.username());
  }

  @Override
  public boolean updateDigest(String username, String passwordDigest) {
    Credential updated = store.computeIfPresent(username,
        (k, existing) -> existing.withPasswordDigest(passwordDigest));
    return updated != null;
  }
}
