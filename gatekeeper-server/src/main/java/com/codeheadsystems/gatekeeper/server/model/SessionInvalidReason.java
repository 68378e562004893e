package com.codeheadsystems.gatekeeper.server.model;

/**
 * Why a session token was not accepted. Both reasons mean "logged out" to the caller.
 */
public enum SessionInvalidReason {
  NOT_FOUND,
  EXPIRED
}
