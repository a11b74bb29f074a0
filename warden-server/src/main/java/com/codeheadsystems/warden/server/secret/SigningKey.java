package com.codeheadsystems.warden.server.secret;

import com.auth0.jwt.algorithms.Algorithm;

/**
 * A signing key version ready for use by the codec.
 *
 * @param id        purpose and version
 * @param algorithm signer and verifier built from the key material
 */
public record SigningKey(KeyId id, Algorithm algorithm) {

  @Override
  public String toString() {
    return "SigningKey[" + id.value() + ", " + algorithm.getName() + "]";
  }
}
