package com.codeheadsystems.gatekeeper.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the gatekeeper password authentication kernel.
 * <p>
 * Cost parameters only affect newly written digests. Existing digests keep verifying with the
 * parameters they were written with and are upgraded on the user's next successful login.
 * <p>
 * For production supply {@code jwtSecretHex} (generate with {@code openssl rand -hex 32}) so
 * bearer tokens survive restarts.
 */
public class GatekeeperConfiguration extends Configuration {

  /**
   * Algorithm for new digests. Valid values: {@code ARGON2ID} (default), {@code BCRYPT}.
   * Digests from either algorithm always verify.
   */
  @NotEmpty
  private String hashAlgorithm = "ARGON2ID";

  /**
   * Argon2id memory cost in kibibytes, at most 1 GiB.
   */
  @Min(8)
  @Max(1048576)
  private int argon2MemoryKib = 65536;

  @Min(1)
  private int argon2Iterations = 3;

  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * BCrypt log2 cost.
   */
  @Min(4)
  @Max(31)
  private int bcryptCost = 12;

  @Min(1)
  private long sessionTtlSeconds = 3600;

  /**
   * How often expired sessions are purged from the session store.
   */
  @Min(1)
  private long sessionPurgeIntervalSeconds = 60;

  /**
   * Random bytes behind each session token id.
   */
  @Min(16)
  private int sessionTokenBytes = 32;

  /**
   * Hex-encoded HMAC-SHA256 signing secret for bearer tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  @NotEmpty
  private String jwtIssuer = "gatekeeper";

  /**
   * Gets hash algorithm.
   *
   * @return the hash algorithm
   */
  @JsonProperty
  public String getHashAlgorithm() {
    return hashAlgorithm;
  }

  /**
   * Sets hash algorithm.
   *
   * @param hashAlgorithm the hash algorithm
   */
  @JsonProperty
  public void setHashAlgorithm(String hashAlgorithm) {
    this.hashAlgorithm = hashAlgorithm;
  }

  /**
   * Gets argon 2 memory kib.
   *
   * @return the argon 2 memory kib
   */
  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  /**
   * Sets argon 2 memory kib.
   *
   * @param argon2MemoryKib the argon 2 memory kib
   */
  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  @JsonProperty
  public int getBcryptCost() {
    return bcryptCost;
  }

  @JsonProperty
  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }

  /**
   * Gets session ttl seconds.
   *
   * @return the session ttl seconds
   */
  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  /**
   * Sets session ttl seconds.
   *
   * @param sessionTtlSeconds the session ttl seconds
   */
  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public long getSessionPurgeIntervalSeconds() {
    return sessionPurgeIntervalSeconds;
  }

  @JsonProperty
  public void setSessionPurgeIntervalSeconds(long sessionPurgeIntervalSeconds) {
    this.sessionPurgeIntervalSeconds = sessionPurgeIntervalSeconds;
  }

  @JsonProperty
  public int getSessionTokenBytes() {
    return sessionTokenBytes;
  }

  @JsonProperty
  public void setSessionTokenBytes(int sessionTokenBytes) {
    this.sessionTokenBytes = sessionTokenBytes;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }
}
