package com.codeheadsystems.warden.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ModelJsonTest {

  private final ObjectMapper mapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  @Test
  void tokenPair_writesOnlyItsComponents() throws Exception {
    final Instant expiry = Instant.parse("2026-03-01T12:15:00Z");
    final TokenPair pair = new TokenPair(
        new IssuedToken("a.b.c", "jti-1", TokenPurpose.ACCESS, expiry),
        new IssuedToken("d.e.f", "jti-2", TokenPurpose.REFRESH, expiry.plusSeconds(3600)),
        "session-1");

    final JsonNode json = mapper.readTree(mapper.writeValueAsString(pair));

    assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder("access", "refresh", "sessionId");
    assertThat(json.get("access").get("purpose").asText()).isEqualTo("access");
    assertThat(json.get("access").get("expiresAt").asText()).isEqualTo("2026-03-01T12:15:00Z");
    assertThat(mapper.readValue(mapper.writeValueAsString(pair), TokenPair.class)).isEqualTo(pair);
  }

  @Test
  void issuedToken_toStringHidesToken() {
    final IssuedToken token = new IssuedToken("secret.token.value", "jti-1", TokenPurpose.PASSWORD_RESET, Instant.EPOCH);

    assertThat(token.toString()).doesNotContain("secret.token.value").contains("jti-1");
  }

  @Test
  void validationVerdict_invalidCarriesNoClaimsOrScore() throws Exception {
    final ValidationVerdict verdict = ValidationVerdict.invalid(VerdictError.EXPIRED, "Token expired", true);

    final JsonNode json = mapper.readTree(mapper.writeValueAsString(verdict));

    assertThat(json.get("valid").asBoolean()).isFalse();
    assertThat(json.get("error").asText()).isEqualTo("EXPIRED");
    assertThat(json.get("shouldRefresh").asBoolean()).isTrue();
    assertThat(json.get("claims").isNull()).isTrue();
    assertThat(json.get("trustScore").isNull()).isTrue();
    assertThat(verdict.warnings()).isEmpty();
  }

  @Test
  void tokenPurpose_parsesClaimValues() {
    assertThat(TokenPurpose.fromClaimValue("email-verification")).contains(TokenPurpose.EMAIL_VERIFICATION);
    assertThat(TokenPurpose.fromClaimValue("EMAIL_VERIFICATION")).isEmpty();
    assertThat(TokenPurpose.fromClaimValue(null)).isEmpty();
  }

  @Test
  void identity_copiesPermissionsAndRejectsBlankId() {
    final Identity identity = new Identity("user-1", null, Role.VENDOR, null);

    assertThat(identity.permissions()).isEmpty();
    assertThatThrownBy(() -> new Identity(" ", null, Role.VENDOR, Set.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Identity("user-1", null, null, Set.of()))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void securityEvent_roundTrips() throws Exception {
    final SecurityEvent event = new SecurityEvent(SecurityEventType.SESSION_EVICTED, Severity.MEDIUM, "user-1",
        "s1", "203.0.113.7", Instant.parse("2026-03-01T12:00:00Z"), Map.of("replacedBy", "s4"));

    final SecurityEvent restored = mapper.readValue(mapper.writeValueAsString(event), SecurityEvent.class);

    assertThat(restored).isEqualTo(event);
    assertThat(restored.details()).containsExactly(Map.entry("replacedBy", "s4"));
  }
}
