package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.common.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.exception.InvalidInputException;
import com.codeheadsystems.gatekeeper.crypto.exception.MalformedDigestException;
import com.codeheadsystems.gatekeeper.server.config.SessionConfig;
import com.codeheadsystems.gatekeeper.server.exception.DuplicateUsernameException;
import com.codeheadsystems.gatekeeper.server.exception.StorageUnavailableException;
import com.codeheadsystems.gatekeeper.server.model.AuthFailureReason;
import com.codeheadsystems.gatekeeper.server.model.AuthResult;
import com.codeheadsystems.gatekeeper.server.model.Credential;
import com.codeheadsystems.gatekeeper.server.model.SessionInvalidReason;
import com.codeheadsystems.gatekeeper.server.model.SessionToken;
import com.codeheadsystems.gatekeeper.server.model.SessionValidation;
import com.codeheadsystems.gatekeeper.server.store.SessionStore;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service for password registration, login and session validation.
 * <p>
 * Holds no mutable state; every operation reads and writes through the {@link UserStore} and
 * {@link SessionStore}, so a single instance is shared by all request threads. Transport of
 * the token (cookie, header) is up to the caller.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link InvalidInputException}: blank username or empty password (caller bug)</li>
 *   <li>{@link DuplicateUsernameException}: registration of a taken username</li>
 *   <li>{@link MalformedDigestException}: corrupted stored digest; logged and rethrown</li>
 *   <li>{@link StorageUnavailableException}: store I/O failure, propagated unchanged</li>
 * </ul>
 * Failed logins and invalid sessions are results, not exceptions. Callers must not reveal
 * which {@link AuthFailureReason} applied.
 */
public class CredentialManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

  private final PasswordHasher hasher;
  private final UserStore userStore;
  private final SessionStore sessionStore;
  private final Clock clock;
  private final SessionConfig sessionConfig;
  private final RandomProvider randomProvider;

  // Verified against on the unknown-user path so that branch costs the same as a wrong password.
  private final String dummyDigest;

  /**
   * Instantiates a new Credential manager.
   *
   * @param hasher         password hasher
   * @param userStore      credential storage
   * @param sessionStore   session storage
   * @param clock          time source for issuance and expiry
   * @param sessionConfig  session TTL and token size
   * @param randomProvider token id source
   */
  public CredentialManager(PasswordHasher hasher,
                           UserStore userStore,
                           SessionStore sessionStore,
                           Clock clock,
                           SessionConfig sessionConfig,
                           RandomProvider randomProvider) {
    this.hasher = hasher;
    this.userStore = userStore;
    this.sessionStore = sessionStore;
    this.clock = clock;
    this.sessionConfig = sessionConfig;
    this.randomProvider = randomProvider;
    this.dummyDigest = hasher.hash(randomProvider.randomToken(sessionConfig.tokenBytes()));
  }

  /**
   * Instantiates a new Credential manager with default session settings and a fresh random source.
   */
  public CredentialManager(PasswordHasher hasher, UserStore userStore, SessionStore sessionStore,
                           Clock clock) {
    this(hasher, userStore, sessionStore, clock, SessionConfig.DEFAULT, new RandomProvider());
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Registers a new user.
   *
   * @param username  the username
   * @param plaintext the password
   * @return the stored credential (digest only)
   * @throws InvalidInputException      if the username is blank or the password empty
   * @throws DuplicateUsernameException if the username is already registered
   */
  public Credential register(String username, String plaintext) {
    requireUsername(username);
    requirePassword(plaintext);
    log.debug("register(username={})", username);
    if (userStore.findByUsername(username).isPresent()) {
      throw new DuplicateUsernameException(username);
    }
    Credential credential = new Credential(username, hasher.hash(plaintext), clock.instant());
    // The store's uniqueness constraint closes the race with a concurrent register.
    userStore.insert(credential);
    return credential;
  }

  // ── Authentication ───────────────────────────────────────────────────────

  /**
   * Verifies a username and password and, on success, issues a session.
   * <p>
   * An unknown username still costs one full password verification against a dummy digest,
   * so response time does not reveal whether the username exists.
   *
   * @param username  the username
   * @param plaintext the password
   * @return the session, or the failure reason
   * @throws InvalidInputException    if the username is blank or the password empty
   * @throws MalformedDigestException if the stored digest is corrupt
   */
  public AuthResult authenticate(String username, String plaintext) {
    requireUsername(username);
    requirePassword(plaintext);
    log.debug("authenticate(username={})", username);

    Optional<Credential> credential = userStore.findByUsername(username);
    if (credential.isEmpty()) {
      hasher.verify(plaintext, dummyDigest);
      log.debug("authenticate rejected: {}", AuthFailureReason.USER_NOT_FOUND);
      return AuthResult.rejected(AuthFailureReason.USER_NOT_FOUND);
    }

    String storedDigest = credential.get().passwordDigest();
    if (!verifyStored(username, plaintext, storedDigest)) {
      log.debug("authenticate rejected: {}", AuthFailureReason.BAD_PASSWORD);
      return AuthResult.rejected(AuthFailureReason.BAD_PASSWORD);
    }

    rehashIfNeeded(username, plaintext, storedDigest);
    return AuthResult.authenticated(issueSession(username));
  }

  /**
   * Checks a session token.
   * <p>
   * An expired token is deleted as a side effect, so a second check reports
   * {@link SessionInvalidReason#NOT_FOUND}.
   *
   * @param tokenId the token id; null or blank is treated as not found
   * @return the session's username, or the invalid reason
   */
  public SessionValidation validateSession(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      return SessionValidation.invalid(SessionInvalidReason.NOT_FOUND);
    }
    Optional<SessionToken> session = sessionStore.get(tokenId);
    if (session.isEmpty()) {
      return SessionValidation.invalid(SessionInvalidReason.NOT_FOUND);
    }
    if (session.get().isExpiredAt(clock.instant())) {
      sessionStore.delete(tokenId);
      log.debug("Session for username={} expired", session.get().username());
      return SessionValidation.invalid(SessionInvalidReason.EXPIRED);
    }
    return SessionValidation.valid(session.get().username());
  }

  /**
   * Ends a session. Idempotent: unknown, null or already-deleted tokens are ignored.
   *
   * @param tokenId the token id
   */
  public void logout(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      return;
    }
    sessionStore.delete(tokenId);
  }

  /**
   * Ends every session of a user.
   *
   * @param username the username
   */
  public void logoutAll(String username) {
    requireUsername(username);
    log.debug("logoutAll(username={})", username);
    sessionStore.deleteByUsername(username);
  }

  /**
   * Removes sessions that have expired but were never validated again.
   *
   * @return the number of sessions removed
   */
  public int purgeExpiredSessions() {
    return sessionStore.purgeExpired(clock.instant());
  }

  // ── Password change ──────────────────────────────────────────────────────

  /**
   * Replaces a user's password after verifying the current one, then revokes all of the
   * user's sessions. Rejections follow the same timing-safe path as {@link #authenticate}.
   *
   * @param username         the username
   * @param currentPlaintext the current password
   * @param newPlaintext     the new password
   * @return the updated credential, or empty if the username or current password was wrong
   * @throws InvalidInputException if any argument is blank or empty
   */
  public Optional<Credential> changePassword(String username, String currentPlaintext,
                                             String newPlaintext) {
    requireUsername(username);
    requirePassword(currentPlaintext);
    requirePassword(newPlaintext);
    log.debug("changePassword(username={})", username);

    Optional<Credential> credential = userStore.findByUsername(username);
    if (credential.isEmpty()) {
      hasher.verify(currentPlaintext, dummyDigest);
      return Optional.empty();
    }
    if (!verifyStored(username, currentPlaintext, credential.get().passwordDigest())) {
      return Optional.empty();
    }
    String newDigest = hasher.hash(newPlaintext);
    if (!userStore.updateDigest(username, newDigest)) {
      // Deleted between lookup and update.
      return Optional.empty();
    }
    sessionStore.deleteByUsername(username);
    return Optional.of(credential.get().withPasswordDigest(newDigest));
  }

  // ── Internals ────────────────────────────────────────────────────────────

  private boolean verifyStored(String username, String plaintext, String storedDigest) {
    try {
      return hasher.verify(plaintext, storedDigest);
    } catch (MalformedDigestException e) {
      log.error("Stored password digest for username={} is malformed", username, e);
      throw e;
    }
  }

  private void rehashIfNeeded(String username, String plaintext, String storedDigest) {
    if (!hasher.needsRehash(storedDigest)) {
      return;
    }
    try {
      userStore.updateDigest(username, hasher.hash(plaintext));
      log.debug("Rehashed password digest for username={}", username);
    } catch (StorageUnavailableException e) {
      // The login itself succeeded; the upgrade is retried on the next login.
      log.warn("Could not store upgraded digest for username={}", username, e);
    }
  }

  private SessionToken issueSession(String username) {
    Instant now = clock.instant();
    SessionToken token = new SessionToken(
        randomProvider.randomToken(sessionConfig.tokenBytes()),
        username,
        now,
        now.plus(sessionConfig.sessionTtl()));
    sessionStore.put(token);
    log.debug("Issued session for username={} expiring at {}", username, token.expiresAt());
    return token;
  }

  private static void requireUsername(String username) {
    if (username == null || username.isBlank()) {
      throw new InvalidInputException("Username must not be blank");
    }
  }

  private static void requirePassword(String plaintext) {
    if (plaintext == null || plaintext.isEmpty()) {
      throw new InvalidInputException("Password must not be empty");
    }
  }
}
