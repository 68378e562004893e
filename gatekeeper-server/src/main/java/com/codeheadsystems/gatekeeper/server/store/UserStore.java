package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.exception.DuplicateUsernameException;
import com.codeheadsystems.gatekeeper.server.exception.StorageUnavailableException;
import com.codeheadsystems.gatekeeper.server.model.Credential;
import java.util.Optional;

/**
 * Storage abstraction for user credentials.
 * <p>
 * Implementations must be thread-safe and must enforce username uniqueness themselves
 * (for example with a unique constraint), since two registrations for the same name can race
 * past the lookup in {@code CredentialManager.register}. I/O failures are reported as
 * {@link StorageUnavailableException}.
 */
public interface UserStore {

  /**
   * Retrieves the credential for the given username.
   *
   * @param username the username
   * @return the stored credential, or empty if the username is not registered
   */
  Optional<Credential> findByUsername(String username);

  /**
   * Stores a new credential.
   *
   * @param credential the credential
   * @throws DuplicateUsernameException if the username is already registered
   */
  void insert(Credential credential);

  /**
   * Replaces the password digest of an existing credential.
   *
   * @param username       the username
   * @param passwordDigest the new digest
   * @return true if a credential was updated, false if the username is not registered
   */
  boolean updateDigest(String username, String passwordDigest);
}
