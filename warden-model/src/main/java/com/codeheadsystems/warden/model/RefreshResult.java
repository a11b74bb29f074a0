package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of presenting a refresh token.
 *
 * @param success   whether a new pair was issued
 * @param tokenPair the new pair, only on success
 * @param error     why the refresh was refused, only on failure
 * @param message   detail for the failure
 */
public record RefreshResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("tokenPair") TokenPair tokenPair,
    @JsonProperty("error") VerdictError error,
    @JsonProperty("message") String message) {

  public static RefreshResult success(final TokenPair pair) {
    return new RefreshResult(true, pair, null, null);
  }

  public static RefreshResult failure(final VerdictError error, final String message) {
    return new RefreshResult(false, null, error, message);
  }
}
