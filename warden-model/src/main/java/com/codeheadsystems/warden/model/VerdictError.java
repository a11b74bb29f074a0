package com.codeheadsystems.warden.model;

/**
 * Why a token was rejected.
 */
public enum VerdictError {
  /** Past its expiry, beyond the clock skew tolerance. */
  EXPIRED,
  /** Unparseable, bad signature or unknown signing key. */
  MALFORMED_OR_TAMPERED,
  ISSUER_MISMATCH,
  PURPOSE_MISMATCH,
  AUDIENCE_MISMATCH,
  NOT_YET_VALID,
  /** Present on the revocation list. */
  REVOKED,
  /** The owning session has ended. */
  SESSION_TERMINATED,
  /** A required store could not answer and strict mode is on. */
  STORE_UNAVAILABLE,
  /** An unexpected failure while validating. */
  VALIDATION_ERROR
}
