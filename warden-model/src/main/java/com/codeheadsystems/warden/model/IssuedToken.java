package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A signed token together with the facts a caller needs without decoding it.
 *
 * @param token     compact serialized token
 * @param tokenId   its {@code jti}
 * @param purpose   what it may be used for
 * @param expiresAt when it stops verifying
 */
public record IssuedToken(
    @JsonProperty("token") String token,
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("purpose") TokenPurpose purpose,
    @JsonProperty("expiresAt") Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedToken[tokenId=" + tokenId + ", purpose=" + purpose + ", expiresAt=" + expiresAt + "]";
  }
}
