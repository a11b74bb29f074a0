package com.codeheadsystems.warden.server.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.IncorrectClaimException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.warden.model.Audience;
import com.codeheadsystems.warden.model.ClaimSet;
import com.codeheadsystems.warden.model.IssuedToken;
import com.codeheadsystems.warden.model.Role;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.config.TokenSettings;
import com.codeheadsystems.warden.server.secret.KeyId;
import com.codeheadsystems.warden.server.secret.SecretStore;
import com.codeheadsystems.warden.server.secret.SigningKey;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signs claim sets into compact JWTs and verifies them back.
 * <p>
 * Each purpose has its own key, named by the {@code kid} header. Decoding reads the header without
 * trusting it to pick the key, then checks in order: signature, expiry and issue time (with the
 * configured clock skew), issuer, audience and finally purpose. A refresh token presented as an
 * access token therefore verifies cleanly against the refresh key and fails only on purpose.
 */
@Singleton
public class TokenCodec {

  private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

  static final String CLAIM_PURPOSE = "purpose";
  static final String CLAIM_SESSION = "sid";
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_PERMISSIONS = "permissions";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_DEVICE = "did";
  static final String CLAIM_IP = "ip";
  static final String CLAIM_USER_AGENT = "ua";

  private final SecretStore secretStore;
  private final TokenSettings settings;
  private final Clock clock;

  @Inject
  public TokenCodec(final SecretStore secretStore, final TokenSettings settings, final Clock clock) {
    this.secretStore = secretStore;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Signs the claims with the current key for their purpose.
   *
   * @param claims fully populated claims; timestamps are encoded at second precision
   * @return the signed token
   */
  public IssuedToken issue(final ClaimSet claims) {
    final SigningKey key = secretStore.current(claims.purpose());
    final JWTCreator.Builder builder = JWT.create()
        .withKeyId(key.id().value())
        .withIssuer(claims.issuer())
        .withSubject(claims.identityId())
        .withAudience(settings.audienceName(claims.audience()))
        .withJWTId(claims.tokenId())
        .withIssuedAt(claims.issuedAt())
        .withExpiresAt(claims.expiresAt())
        .withClaim(CLAIM_PURPOSE, claims.purpose().claimValue());
    putIfPresent(builder, CLAIM_SESSION, claims.sessionId());
    putIfPresent(builder, CLAIM_EMAIL, claims.email());
    putIfPresent(builder, CLAIM_DEVICE, claims.deviceId());
    putIfPresent(builder, CLAIM_IP, claims.ipAddress());
    putIfPresent(builder, CLAIM_USER_AGENT, claims.userAgent());
    if (claims.role() != null) {
      builder.withClaim(CLAIM_ROLE, claims.role().name());
    }
    if (!claims.permissions().isEmpty()) {
      builder.withClaim(CLAIM_PERMISSIONS, claims.permissions().stream().sorted().toList());
    }
    final String token = builder.sign(key.algorithm());
    log.debug("Issued {} token jti={} kid={}", claims.purpose().claimValue(), claims.tokenId(), key.id().value());
    return new IssuedToken(token, claims.tokenId(), claims.purpose(), claims.expiresAt());
  }

  /**
   * Verifies a token and returns its claims.
   *
   * @param token            compact JWT
   * @param expectedPurpose  purpose the caller is about to use the token for
   * @param expectedAudience required audience, or null to accept any configured audience
   * @return claims on success, otherwise a categorized failure; never throws for a bad token
   */
  public DecodeResult decode(final String token, final TokenPurpose expectedPurpose, final Audience expectedAudience) {
    final DecodedJWT unverified;
    try {
      unverified = JWT.decode(token);
    } catch (JWTDecodeException e) {
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Malformed token");
    }
    final Optional<KeyId> keyId = KeyId.parse(unverified.getKeyId());
    if (keyId.isEmpty()) {
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Missing or unknown key id");
    }
    final Optional<SigningKey> key = secretStore.find(keyId.get());
    if (key.isEmpty()) {
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Signing key is no longer recognised");
    }

    final DecodedJWT verified;
    try {
      final JWTVerifier verifier = ((JWTVerifier.BaseVerification) JWT.require(key.get().algorithm())
          .acceptLeeway(settings.clockSkew().toSeconds()))
          .build(clock);
      verified = verifier.verify(unverified);
    } catch (TokenExpiredException e) {
      return DecodeResult.failure(DecodeResult.Kind.EXPIRED, "Token expired");
    } catch (IncorrectClaimException e) {
      if ("iat".equals(e.getClaimName()) || "nbf".equals(e.getClaimName())) {
        return DecodeResult.failure(DecodeResult.Kind.NOT_YET_VALID, "Token is not valid yet");
      }
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Invalid claim " + e.getClaimName());
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Invalid signature");
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Invalid token");
    }

    if (!settings.issuer().equals(verified.getIssuer())) {
      return DecodeResult.failure(DecodeResult.Kind.ISSUER_MISMATCH, "Unexpected issuer");
    }
    final Optional<Audience> audience = audienceOf(verified);
    if (audience.isEmpty()) {
      return DecodeResult.failure(DecodeResult.Kind.AUDIENCE_MISMATCH, "Unknown audience");
    }
    if (expectedAudience != null && audience.get() != expectedAudience) {
      return DecodeResult.failure(DecodeResult.Kind.AUDIENCE_MISMATCH, "Token is not intended for this audience");
    }
    final Optional<TokenPurpose> purpose = TokenPurpose.fromClaimValue(verified.getClaim(CLAIM_PURPOSE).asString());
    if (purpose.isEmpty() || purpose.get() != keyId.get().purpose()) {
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Purpose does not match signing key");
    }
    if (purpose.get() != expectedPurpose) {
      return DecodeResult.failure(DecodeResult.Kind.PURPOSE_MISMATCH,
          "Expected a " + expectedPurpose.claimValue() + " token");
    }

    final Optional<ClaimSet> claims = toClaimSet(verified, purpose.get(), audience.get());
    if (claims.isEmpty()) {
      return DecodeResult.failure(DecodeResult.Kind.MALFORMED_OR_TAMPERED, "Token is missing required claims");
    }
    return DecodeResult.success(claims.get(), keyId.get(), secretStore.isCurrent(keyId.get()));
  }

  /**
   * Reads the claims of a token without verifying anything. Only for bookkeeping such as picking a
   * revocation lifetime; never trust the result.
   *
   * @param token compact JWT
   * @return the claims, empty when the token cannot be parsed
   */
  public Optional<ClaimSet> peek(final String token) {
    try {
      final DecodedJWT decoded = JWT.decode(token);
      final Optional<TokenPurpose> purpose = TokenPurpose.fromClaimValue(decoded.getClaim(CLAIM_PURPOSE).asString());
      final Optional<Audience> audience = audienceOf(decoded);
      if (purpose.isEmpty() || audience.isEmpty()) {
        return Optional.empty();
      }
      return toClaimSet(decoded, purpose.get(), audience.get());
    } catch (JWTDecodeException e) {
      return Optional.empty();
    }
  }

  private Optional<Audience> audienceOf(final DecodedJWT jwt) {
    final List<String> audiences = jwt.getAudience();
    if (audiences == null || audiences.size() != 1) {
      return Optional.empty();
    }
    return settings.audienceFor(audiences.get(0));
  }

  private Optional<ClaimSet> toClaimSet(final DecodedJWT jwt, final TokenPurpose purpose, final Audience audience) {
    final Instant issuedAt = jwt.getIssuedAtAsInstant();
    final Instant expiresAt = jwt.getExpiresAtAsInstant();
    if (jwt.getId() == null || jwt.getSubject() == null || jwt.getIssuer() == null
        || issuedAt == null || expiresAt == null) {
      return Optional.empty();
    }
    final Role role;
    final Set<String> permissions;
    try {
      final String roleName = stringClaim(jwt, CLAIM_ROLE);
      role = roleName == null ? null : Role.valueOf(roleName);
      permissions = permissions(jwt);
    } catch (IllegalArgumentException | JWTDecodeException e) {
      return Optional.empty();
    }
    return Optional.of(ClaimSet.builder()
        .tokenId(jwt.getId())
        .identityId(jwt.getSubject())
        .email(stringClaim(jwt, CLAIM_EMAIL))
        .role(role)
        .permissions(permissions)
        .sessionId(stringClaim(jwt, CLAIM_SESSION))
        .purpose(purpose)
        .audience(audience)
        .deviceId(stringClaim(jwt, CLAIM_DEVICE))
        .ipAddress(stringClaim(jwt, CLAIM_IP))
        .userAgent(stringClaim(jwt, CLAIM_USER_AGENT))
        .issuer(jwt.getIssuer())
        .issuedAt(issuedAt)
        .expiresAt(expiresAt)
        .build());
  }

  private static Set<String> permissions(final DecodedJWT jwt) {
    final Claim claim = jwt.getClaim(CLAIM_PERMISSIONS);
    if (claim.isMissing() || claim.isNull()) {
      return Set.of();
    }
    final List<String> values = claim.asList(String.class);
    return values == null ? Set.of() : new LinkedHashSet<>(new ArrayList<>(values));
  }

  private static String stringClaim(final DecodedJWT jwt, final String name) {
    final Claim claim = jwt.getClaim(name);
    return claim.isMissing() || claim.isNull() ? null : claim.asString();
  }

  private static void putIfPresent(final JWTCreator.Builder builder, final String name, final String value) {
    if (value != null) {
      builder.withClaim(name, value);
    }
  }
}
