package com.codeheadsystems.warden.server.secret;

import com.codeheadsystems.warden.model.TokenPurpose;
import java.util.Optional;

/**
 * Source of signing keys, one independent set per token purpose.
 */
public interface SecretStore {

  /**
   * The key new tokens of this purpose are signed with.
   */
  SigningKey current(TokenPurpose purpose);

  /**
   * A retained key version, current or previous.
   *
   * @param id purpose and version from the token header
   * @return the key, empty when unknown or no longer retained
   */
  Optional<SigningKey> find(KeyId id);

  default boolean isCurrent(final KeyId id) {
    return current(id.purpose()).id().equals(id);
  }
}
