package com.codeheadsystems.warden.model;

/**
 * Client surfaces a token can be scoped to. The string carried in the {@code aud} claim for each
 * value is configurable.
 */
public enum Audience {
  WEB,
  MOBILE,
  ADMIN
}
