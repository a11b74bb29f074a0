package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import java.util.Set;

/**
 * The authenticated principal a token pair is issued for.
 *
 * @param id          stable identity identifier, becomes the {@code sub} claim
 * @param email       contact address, optional
 * @param role        authorization role
 * @param permissions fine-grained permission names, never null
 */
public record Identity(
    @JsonProperty("id") String id,
    @JsonProperty("email") String email,
    @JsonProperty("role") Role role,
    @JsonProperty("permissions") Set<String> permissions) {

  public Identity {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
    if (id.isBlank()) {
      throw new IllegalArgumentException("identity id must not be blank");
    }
    permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
  }
}
