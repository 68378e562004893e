package com.codeheadsystems.gatekeeper.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.gatekeeper.server.manager.CredentialManager;
import com.codeheadsystems.gatekeeper.server.model.SessionToken;
import com.codeheadsystems.gatekeeper.server.model.SessionValidation;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps session tokens in signed JWT bearer tokens for transport.
 * <p>
 * Tokens are signed with HMAC-SHA256. The JWT ID is the session's token id and the subject is
 * its username. The session store stays authoritative: a JWT with a valid signature is only
 * accepted while {@link CredentialManager#validateSession(String)} still accepts its token id,
 * so logout revokes it immediately.
 */
public class BearerTokenManager {

  private static final Logger log = LoggerFactory.getLogger(BearerTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final CredentialManager credentialManager;
  private final String issuer;

  /**
   * Creates a new BearerTokenManager.
   *
   * @param secret            HMAC-SHA256 signing secret
   * @param issuer            JWT issuer claim
   * @param credentialManager session authority
   * @param clock             time source for expiry checks
   */
  public BearerTokenManager(byte[] secret, String issuer, CredentialManager credentialManager,
                            Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = buildVerifier(algorithm, issuer, clock);
    this.credentialManager = credentialManager;
    this.issuer = issuer;
  }

  /**
   * Builds a verifier that checks {@code exp}, {@code iat} and {@code nbf} against the given
   * clock instead of the system clock, so expiry agrees with the {@link CredentialManager}.
   * <p>
   * {@code JWT.require} always returns a {@link JWTVerifier.BaseVerification}; its
   * {@code build(Clock)} overload is the only clock-aware entry point java-jwt exposes.
   */
  static JWTVerifier buildVerifier(Algorithm algorithm, String issuer, Clock clock) {
    JWTVerifier.BaseVerification verification =
        (JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer);
    return verification.build(clock);
  }

  /**
   * Issues a signed bearer token for a session.
   *
   * @param sessionToken the session returned by {@link CredentialManager#authenticate}
   * @return signed JWT string
   */
  public String issue(SessionToken sessionToken) {
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(sessionToken.tokenId())
        .withSubject(sessionToken.username())
        .withIssuedAt(sessionToken.issuedAt())
        .withExpiresAt(sessionToken.expiresAt())
        .sign(algorithm);
    log.debug("Issued bearer token for username={}", sessionToken.username());
    return token;
  }

  /**
   * Verifies a bearer token and returns the username if its signature is valid and its session
   * is still active.
   *
   * @param token JWT string
   * @return the username, or empty if invalid, expired or revoked
   */
  public Optional<String> verify(String token) {
    return decode(token).flatMap(decoded -> {
      SessionValidation validation = credentialManager.validateSession(decoded.getId());
      if (!validation.isValid()) {
        log.debug("Bearer token session rejected: {}", validation.invalidReason());
        return Optional.empty();
      }
      if (!validation.username().equals(decoded.getSubject())) {
        log.warn("Bearer token subject does not match its session");
        return Optional.empty();
      }
      return Optional.of(validation.username());
    });
  }

  /**
   * Logs out the session behind a bearer token. Tokens with an invalid signature or a foreign
   * issuer are ignored. Expiry is not checked, so a token whose whole-second {@code exp} has
   * passed still revokes a session that outlives it by a fraction of a second.
   *
   * @param token JWT string
   */
  public void revoke(String token) {
    decodeSignedIgnoringExpiry(token)
        .ifPresent(decoded -> credentialManager.logout(decoded.getId()));
  }

  private Optional<DecodedJWT> decodeSignedIgnoringExpiry(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = JWT.decode(token);
      algorithm.verify(decoded);
      if (!issuer.equals(decoded.getIssuer())) {
        log.debug("Bearer token issuer mismatch on revoke");
        return Optional.empty();
      }
      return Optional.of(decoded);
    } catch (JWTVerificationException e) {
      log.debug("Bearer token revoke ignored: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<DecodedJWT> decode(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(verifier.verify(token));
    } catch (JWTVerificationException e) {
      log.debug("Bearer token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
