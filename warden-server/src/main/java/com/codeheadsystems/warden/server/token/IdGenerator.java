package com.codeheadsystems.warden.server.token;

/**
 * Produces unguessable identifiers for tokens and sessions.
 */
@FunctionalInterface
public interface IdGenerator {

  String newId();
}
