package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Access and refresh token issued together for one session.
 *
 * @param access    short lived access token
 * @param refresh   long lived refresh token
 * @param sessionId session both tokens belong to
 */
public record TokenPair(
    @JsonProperty("access") IssuedToken access,
    @JsonProperty("refresh") IssuedToken refresh,
    @JsonProperty("sessionId") String sessionId) {

  @JsonIgnore
  public String accessToken() {
    return access.token();
  }

  @JsonIgnore
  public String refreshToken() {
    return refresh.token();
  }

  @JsonIgnore
  public Instant accessExpiry() {
    return access.expiresAt();
  }

  @JsonIgnore
  public Instant refreshExpiry() {
    return refresh.expiresAt();
  }
}
