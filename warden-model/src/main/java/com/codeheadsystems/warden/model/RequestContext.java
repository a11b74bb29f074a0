package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the caller observed about the request presenting or asking for a token. Every field is
 * optional; a missing value disables the checks that need it.
 *
 * @param ipAddress client address
 * @param userAgent client user agent string
 * @param deviceId  client supplied device identifier
 * @param audience  client surface, when null issuance uses {@link Audience#WEB} and validation
 *                  skips the audience check
 */
public record RequestContext(
    @JsonProperty("ipAddress") String ipAddress,
    @JsonProperty("userAgent") String userAgent,
    @JsonProperty("deviceId") String deviceId,
    @JsonProperty("audience") Audience audience) {

  private static final RequestContext EMPTY = new RequestContext(null, null, null, null);

  public static RequestContext empty() {
    return EMPTY;
  }

  public static RequestContext of(final String ipAddress, final String userAgent, final String deviceId) {
    return new RequestContext(ipAddress, userAgent, deviceId, null);
  }

  public RequestContext withAudience(final Audience value) {
    return new RequestContext(ipAddress, userAgent, deviceId, value);
  }

  public Audience audienceOrDefault() {
    return audience == null ? Audience.WEB : audience;
  }
}
