package com.codeheadsystems.warden.model;

/**
 * Authorization roles an identity may carry in its access tokens.
 */
public enum Role {
  CUSTOMER,
  VENDOR,
  MODERATOR,
  ADMIN,
  SUPER_ADMIN
}
