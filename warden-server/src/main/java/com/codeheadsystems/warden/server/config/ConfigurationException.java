package com.codeheadsystems.warden.server.config;

/**
 * Thrown at startup when the configuration cannot produce a safe manager. Never thrown per request.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
