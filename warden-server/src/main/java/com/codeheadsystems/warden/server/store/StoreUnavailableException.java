package com.codeheadsystems.warden.server.store;

/**
 * A session or revocation store could not answer in time. The manager turns this into a warning or,
 * in strict mode, a {@code STORE_UNAVAILABLE} verdict; it never reaches token validation callers.
 */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
