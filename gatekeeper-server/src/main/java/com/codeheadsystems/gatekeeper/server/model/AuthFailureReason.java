package com.codeheadsystems.gatekeeper.server.model;

/**
 * Why an authentication attempt was rejected.
 * <p>
 * For logs and tests only. Callers must present both reasons to users the same way.
 */
public enum AuthFailureReason {
  USER_NOT_FOUND,
  BAD_PASSWORD
}
