package com.codeheadsystems.warden.server.token;

import com.codeheadsystems.warden.model.ClaimSet;
import com.codeheadsystems.warden.server.secret.KeyId;

/**
 * Outcome of {@link TokenCodec#decode}. Exactly one of {@code claims} and {@code failure} is set.
 *
 * @param claims     verified claims
 * @param keyId      key that verified the signature
 * @param currentKey whether that key is still the purpose's current one
 * @param failure    why decoding failed
 */
public record DecodeResult(ClaimSet claims, KeyId keyId, boolean currentKey, Failure failure) {

  /**
   * Decoding failure categories.
   */
  public enum Kind {
    EXPIRED,
    MALFORMED_OR_TAMPERED,
    ISSUER_MISMATCH,
    PURPOSE_MISMATCH,
    AUDIENCE_MISMATCH,
    NOT_YET_VALID
  }

  /**
   * @param kind    category
   * @param message detail, safe to return to clients
   */
  public record Failure(Kind kind, String message) {
  }

  public static DecodeResult success(final ClaimSet claims, final KeyId keyId, final boolean currentKey) {
    return new DecodeResult(claims, keyId, currentKey, null);
  }

  public static DecodeResult failure(final Kind kind, final String message) {
    return new DecodeResult(null, null, false, new Failure(kind, message));
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
