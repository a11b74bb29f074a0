package com.codeheadsystems.warden.server.manager;

import com.codahale.metrics.Timer;
import com.codeheadsystems.warden.model.Audience;
import com.codeheadsystems.warden.model.ClaimSet;
import com.codeheadsystems.warden.model.Identity;
import com.codeheadsystems.warden.model.IssuedToken;
import com.codeheadsystems.warden.model.RefreshResult;
import com.codeheadsystems.warden.model.RequestContext;
import com.codeheadsystems.warden.model.SecurityEvent;
import com.codeheadsystems.warden.model.SecurityEventType;
import com.codeheadsystems.warden.model.SecurityReport;
import com.codeheadsystems.warden.model.Session;
import com.codeheadsystems.warden.model.SessionEndReason;
import com.codeheadsystems.warden.model.Severity;
import com.codeheadsystems.warden.model.TokenPair;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.model.ValidationVerdict;
import com.codeheadsystems.warden.model.VerdictError;
import com.codeheadsystems.warden.server.config.WardenSettings;
import com.codeheadsystems.warden.server.evaluator.SecurityEvaluator;
import com.codeheadsystems.warden.server.evaluator.TrustEvaluation;
import com.codeheadsystems.warden.server.event.RecentSecurityEvents;
import com.codeheadsystems.warden.server.event.SecurityEventPublisher;
import com.codeheadsystems.warden.server.metrics.SecurityMetrics;
import com.codeheadsystems.warden.server.store.RevocationKeys;
import com.codeheadsystems.warden.server.store.RevocationRegistry;
import com.codeheadsystems.warden.server.store.SessionRegistry;
import com.codeheadsystems.warden.server.store.StoreUnavailableException;
import com.codeheadsystems.warden.server.token.DecodeResult;
import com.codeheadsystems.warden.server.token.IdGenerator;
import com.codeheadsystems.warden.server.token.TokenCodec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, validates, refreshes and revokes session tokens.
 * <p>
 * Validation never throws for a bad token; every outcome is a {@link ValidationVerdict}. Validation
 * runs in a fixed order: revocation list by token hash, signature and claims, revocation list by token
 * id, session liveness (access tokens only), then trust scoring.
 * <p>
 * When a store cannot answer, validation fails open with a warning so an outage does not log
 * everyone out. With strict mode on, an unreachable session store instead yields
 * {@code STORE_UNAVAILABLE} and issuance is refused by throwing {@link StoreUnavailableException},
 * the one case where it leaves this class. Revocation and reporting calls report an outage through
 * their return value and a {@code STORE_UNAVAILABLE} event.
 */
@Singleton
public class SessionSecurityManager {

  private static final Logger log = LoggerFactory.getLogger(SessionSecurityManager.class);

  static final String SESSION_STORE_UNAVAILABLE = "Session store unavailable";
  static final String REVOCATION_STORE_UNAVAILABLE = "Revocation store unavailable";
  static final String PREVIOUS_KEY_VERSION = "Token signed with a previous secret version";
  static final int REPORT_EVENT_LIMIT = 50;

  private final TokenCodec codec;
  private final SessionRegistry sessions;
  private final RevocationRegistry revocations;
  private final SecurityEvaluator evaluator;
  private final SecurityEventPublisher events;
  private final RecentSecurityEvents recentEvents;
  private final SecurityMetrics metrics;
  private final IdGenerator ids;
  private final Clock clock;
  private final WardenSettings settings;

  @Inject
  public SessionSecurityManager(final TokenCodec codec,
                                final SessionRegistry sessions,
                                final RevocationRegistry revocations,
                                final SecurityEvaluator evaluator,
                                final SecurityEventPublisher events,
                                final RecentSecurityEvents recentEvents,
                                final SecurityMetrics metrics,
                                final IdGenerator ids,
                                final Clock clock,
                                final WardenSettings settings) {
    this.codec = codec;
    this.sessions = sessions;
    this.revocations = revocations;
    this.evaluator = evaluator;
    this.events = events;
    this.recentEvents = recentEvents;
    this.metrics = metrics;
    this.ids = ids;
    this.clock = clock;
    this.settings = settings;
  }

  // ── Issuance ─────────────────────────────────────────────────────────────

  /**
   * Starts a new session and issues its access and refresh tokens. When the identity already holds
   * the maximum number of live sessions, the oldest ones are ended.
   *
   * @param identity authenticated identity
   * @param context  request the login came from, may be null
   * @return the new token pair
   * @throws StoreUnavailableException only in strict mode, when the session cannot be recorded
   */
  public TokenPair issueTokenPair(final Identity identity, final RequestContext context) {
    Objects.requireNonNull(identity, "identity");
    final RequestContext ctx = context == null ? RequestContext.empty() : context;
    final Instant now = now();
    final String sessionId = ids.newId();
    final Audience audience = ctx.audienceOrDefault();

    final IssuedToken access = codec.issue(ClaimSet.builder()
        .tokenId(ids.newId())
        .identityId(identity.id())
        .email(identity.email())
        .role(identity.role())
        .permissions(identity.permissions())
        .sessionId(sessionId)
        .purpose(TokenPurpose.ACCESS)
        .audience(audience)
        .deviceId(ctx.deviceId())
        .ipAddress(ctx.ipAddress())
        .userAgent(ctx.userAgent())
        .issuer(settings.tokens().issuer())
        .issuedAt(now)
        .expiresAt(now.plus(settings.tokens().lifetime(TokenPurpose.ACCESS)))
        .build());
    final IssuedToken refresh = codec.issue(ClaimSet.builder()
        .tokenId(ids.newId())
        .identityId(identity.id())
        .sessionId(sessionId)
        .purpose(TokenPurpose.REFRESH)
        .audience(audience)
        .deviceId(ctx.deviceId())
        .issuer(settings.tokens().issuer())
        .issuedAt(now)
        .expiresAt(now.plus(settings.tokens().lifetime(TokenPurpose.REFRESH)))
        .build());

    // Token timestamps are whole seconds; the session keeps the full instant so logins within one
    // second still order correctly for eviction.
    final Instant createdAt = clock.instant();
    final Session session = new Session(sessionId, identity, audience, ctx.deviceId(), ctx.ipAddress(),
        ctx.userAgent(), createdAt, createdAt, refresh.expiresAt(), true, null);
    recordSession(session);

    metrics.tokenIssued(TokenPurpose.ACCESS);
    metrics.tokenIssued(TokenPurpose.REFRESH);
    log.info("Issued token pair for identity {} session {}", identity.id(), sessionId);
    return new TokenPair(access, refresh, sessionId);
  }

  /**
   * Issues a single-purpose token, such as an email verification or password reset link. These
   * tokens carry no session and are validated with their own purpose.
   *
   * @param identity identity the token is for
   * @param purpose  {@link TokenPurpose#EMAIL_VERIFICATION} or {@link TokenPurpose#PASSWORD_RESET}
   * @param audience client surface, null for web
   * @return the signed token
   */
  public IssuedToken issuePurposeToken(final Identity identity, final TokenPurpose purpose, final Audience audience) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(purpose, "purpose");
    if (purpose == TokenPurpose.ACCESS || purpose == TokenPurpose.REFRESH) {
      throw new IllegalArgumentException("Access and refresh tokens are issued as a pair");
    }
    final Instant now = now();
    final IssuedToken token = codec.issue(ClaimSet.builder()
        .tokenId(ids.newId())
        .identityId(identity.id())
        .email(identity.email())
        .purpose(purpose)
        .audience(audience == null ? Audience.WEB : audience)
        .issuer(settings.tokens().issuer())
        .issuedAt(now)
        .expiresAt(now.plus(settings.tokens().lifetime(purpose)))
        .build());
    metrics.tokenIssued(purpose);
    events.event(SecurityEventType.PURPOSE_TOKEN_ISSUED, Severity.LOW)
        .identity(identity.id())
        .detail("purpose", purpose.claimValue())
        .publish();
    return token;
  }

  private void recordSession(final Session session) {
    final List<Session> evicted;
    try {
      evicted = sessions.createWithinLimit(session, settings.sessions().maxConcurrentSessions());
    } catch (StoreUnavailableException e) {
      storeUnavailable("session", session.identityId(), e);
      if (settings.stores().strictMode()) {
        throw e;
      }
      log.warn("Session {} for identity {} was not recorded: {}", session.sessionId(), session.identityId(),
          e.getMessage());
      return;
    }
    metrics.sessionCreated();
    events.event(SecurityEventType.SESSION_CREATED, Severity.LOW)
        .identity(session.identityId())
        .session(session.sessionId())
        .ip(session.ipAddress())
        .detail("audience", session.audience())
        .detail("deviceId", session.deviceId())
        .publish();
    if (!evicted.isEmpty()) {
      metrics.sessionsEvicted(evicted.size());
      for (Session old : evicted) {
        log.info("Evicted session {} of identity {} over the concurrent session limit",
            old.sessionId(), old.identityId());
        events.event(SecurityEventType.SESSION_EVICTED, Severity.MEDIUM)
            .identity(old.identityId())
            .session(old.sessionId())
            .ip(old.ipAddress())
            .detail("replacedBy", session.sessionId())
            .publish();
      }
    }
  }

  // ── Validation ───────────────────────────────────────────────────────────

  /**
   * Validates a token for a purpose.
   *
   * @param token   compact token, may be null
   * @param purpose what the caller is about to use the token for
   * @param context the current request, may be null
   * @return the verdict; never throws for a bad token or an unavailable store
   */
  public ValidationVerdict validate(final String token, final TokenPurpose purpose, final RequestContext context) {
    Objects.requireNonNull(purpose, "purpose");
    final RequestContext ctx = context == null ? RequestContext.empty() : context;
    try (Timer.Context ignored = metrics.timeValidation()) {
      final ValidationVerdict verdict = evaluate(token, purpose, ctx);
      if (verdict.valid()) {
        metrics.validationPassed();
      } else {
        metrics.validationFailed(verdict.error());
      }
      return verdict;
    } catch (RuntimeException e) {
      log.error("Unexpected failure validating {} token", purpose.claimValue(), e);
      metrics.validationFailed(VerdictError.VALIDATION_ERROR);
      return ValidationVerdict.invalid(VerdictError.VALIDATION_ERROR, "Token validation failed", false);
    }
  }

  private ValidationVerdict evaluate(final String token, final TokenPurpose purpose, final RequestContext ctx) {
    if (token == null || token.isBlank()) {
      return ValidationVerdict.invalid(VerdictError.MALFORMED_OR_TAMPERED, "Missing token", false);
    }
    final List<String> warnings = new ArrayList<>();

    if (isRevoked(RevocationKeys.forToken(token), warnings)) {
      return revokedTokenPresented(codec.peek(token), purpose, ctx, warnings);
    }

    final DecodeResult decoded = codec.decode(token, purpose, ctx.audience());
    if (!decoded.isSuccess()) {
      return rejected(decoded.failure(), purpose, ctx, warnings);
    }
    final ClaimSet claims = decoded.claims();

    if (isRevoked(RevocationKeys.forTokenId(claims.tokenId()), warnings)) {
      return revokedTokenPresented(Optional.of(claims), purpose, ctx, warnings);
    }
    if (!decoded.currentKey()) {
      warnings.add(PREVIOUS_KEY_VERSION);
    }

    if (purpose == TokenPurpose.ACCESS && claims.sessionId() != null) {
      final Optional<ValidationVerdict> ended = checkSession(claims, ctx, warnings);
      if (ended.isPresent()) {
        return ended.get();
      }
    }

    final TrustEvaluation evaluation = evaluator.evaluate(claims, ctx, countActive(claims.identityId(), warnings));
    if (!evaluation.findings().isEmpty()) {
      metrics.suspiciousActivity(evaluation.findings().size());
      for (TrustEvaluation.Finding finding : evaluation.findings()) {
        events.event(SecurityEventType.SUSPICIOUS_ACTIVITY, finding.severity())
            .identity(claims.identityId())
            .session(claims.sessionId())
            .ip(ctx.ipAddress())
            .detail("warning", finding.message())
            .publish();
      }
      warnings.addAll(evaluation.warnings());
    }

    final boolean shouldRefresh = purpose == TokenPurpose.ACCESS
        && Duration.between(now(), claims.expiresAt()).compareTo(settings.tokens().refreshLowWaterMark()) < 0;
    final boolean reauthenticate = evaluation.findings().size() >= settings.evaluator().warningThreshold();
    return ValidationVerdict.valid(claims, warnings, shouldRefresh, evaluation.trustScore(), reauthenticate);
  }

  private ValidationVerdict rejected(final DecodeResult.Failure failure,
                                     final TokenPurpose purpose,
                                     final RequestContext ctx,
                                     final List<String> warnings) {
    final VerdictError error = switch (failure.kind()) {
      case EXPIRED -> VerdictError.EXPIRED;
      case MALFORMED_OR_TAMPERED -> VerdictError.MALFORMED_OR_TAMPERED;
      case ISSUER_MISMATCH -> VerdictError.ISSUER_MISMATCH;
      case PURPOSE_MISMATCH -> VerdictError.PURPOSE_MISMATCH;
      case AUDIENCE_MISMATCH -> VerdictError.AUDIENCE_MISMATCH;
      case NOT_YET_VALID -> VerdictError.NOT_YET_VALID;
    };
    log.debug("Rejected {} token: {}", purpose.claimValue(), failure.message());
    if (error != VerdictError.EXPIRED) {
      events.event(SecurityEventType.INVALID_TOKEN,
              error == VerdictError.MALFORMED_OR_TAMPERED ? Severity.MEDIUM : Severity.LOW)
          .ip(ctx.ipAddress())
          .detail("purpose", purpose.claimValue())
          .detail("reason", error)
          .publish();
    }
    return ValidationVerdict.invalid(error, failure.message(),
        error == VerdictError.EXPIRED && purpose == TokenPurpose.ACCESS, warnings);
  }

  private ValidationVerdict revokedTokenPresented(final Optional<ClaimSet> claims,
                                                  final TokenPurpose purpose,
                                                  final RequestContext ctx,
                                                  final List<String> warnings) {
    // A revoked refresh token coming back usually means it was copied.
    events.event(SecurityEventType.REVOKED_TOKEN_PRESENTED,
            purpose == TokenPurpose.REFRESH ? Severity.HIGH : Severity.MEDIUM)
        .identity(claims.map(ClaimSet::identityId).orElse(null))
        .session(claims.map(ClaimSet::sessionId).orElse(null))
        .ip(ctx.ipAddress())
        .detail("purpose", purpose.claimValue())
        .publish();
    return ValidationVerdict.invalid(VerdictError.REVOKED, "Token has been revoked", false, warnings);
  }

  private Optional<ValidationVerdict> checkSession(final ClaimSet claims,
                                                   final RequestContext ctx,
                                                   final List<String> warnings) {
    final String sessionId = claims.sessionId();
    try {
      if (sessions.isActive(sessionId)) {
        touch(sessionId);
        return Optional.empty();
      }
      final Optional<Session> session = sessions.find(sessionId);
      final boolean refreshable = session.isPresent() && session.get().endReason() != SessionEndReason.REVOKED;
      return Optional.of(ValidationVerdict.invalid(VerdictError.SESSION_TERMINATED,
          "Session is no longer active", refreshable, warnings));
    } catch (StoreUnavailableException e) {
      if (settings.stores().strictMode()) {
        storeUnavailable("session", claims.identityId(), e);
        return Optional.of(ValidationVerdict.invalid(VerdictError.STORE_UNAVAILABLE,
            SESSION_STORE_UNAVAILABLE, false, warnings));
      }
      addOnce(warnings, SESSION_STORE_UNAVAILABLE);
      return Optional.empty();
    }
  }

  private void touch(final String sessionId) {
    try {
      sessions.touch(sessionId);
    } catch (StoreUnavailableException e) {
      log.debug("Activity for session {} not recorded: {}", sessionId, e.getMessage());
    }
  }

  private boolean isRevoked(final String key, final List<String> warnings) {
    try {
      return revocations.isRevoked(key);
    } catch (StoreUnavailableException e) {
      addOnce(warnings, REVOCATION_STORE_UNAVAILABLE);
      return false;
    }
  }

  private int countActive(final String identityId, final List<String> warnings) {
    try {
      return sessions.countActive(identityId);
    } catch (StoreUnavailableException e) {
      addOnce(warnings, SESSION_STORE_UNAVAILABLE);
      return -1;
    }
  }

  // ── Refresh ──────────────────────────────────────────────────────────────

  /**
   * Trades a refresh token for a new pair. The presented refresh token is revoked and its session
   * ended, so each refresh token works once. Sessions that were explicitly revoked cannot be
   * refreshed; evicted or idle ones can.
   *
   * @param refreshToken the refresh token
   * @param context      the current request, may be null
   * @return the new pair or the reason it was refused; never throws for a bad token
   */
  public RefreshResult refresh(final String refreshToken, final RequestContext context) {
    final RequestContext ctx = context == null ? RequestContext.empty() : context;
    final ValidationVerdict verdict = validate(refreshToken, TokenPurpose.REFRESH, ctx);
    if (!verdict.valid()) {
      metrics.refreshRejected();
      return RefreshResult.failure(verdict.error(), verdict.message());
    }
    try {
      return rotate(refreshToken, verdict.claims(), ctx);
    } catch (StoreUnavailableException e) {
      metrics.refreshRejected();
      storeUnavailable("session", verdict.claims().identityId(), e);
      return RefreshResult.failure(VerdictError.STORE_UNAVAILABLE, "Refresh is unavailable, try again later");
    }
  }

  private RefreshResult rotate(final String refreshToken, final ClaimSet claims, final RequestContext ctx) {
    final Optional<Session> found = claims.sessionId() == null
        ? Optional.empty()
        : sessions.find(claims.sessionId());
    if (found.isEmpty() || !found.get().identityId().equals(claims.identityId())) {
      metrics.refreshRejected();
      return RefreshResult.failure(VerdictError.SESSION_TERMINATED, "Session is no longer known");
    }
    final Session previous = found.get();
    if (previous.endReason() == SessionEndReason.REVOKED) {
      metrics.refreshRejected();
      return RefreshResult.failure(VerdictError.SESSION_TERMINATED, "Session was revoked");
    }

    // Claiming the revocation entry is what makes a refresh token single use under concurrency.
    final Duration ttl = revocationTtl(claims.expiresAt(), TokenPurpose.REFRESH);
    final String claim = RevocationKeys.forToken(refreshToken);
    if (!revocations.revoke(claim, ttl, "rotated")) {
      metrics.refreshRejected();
      events.event(SecurityEventType.REVOKED_TOKEN_PRESENTED, Severity.HIGH)
          .identity(claims.identityId())
          .session(claims.sessionId())
          .ip(ctx.ipAddress())
          .detail("purpose", TokenPurpose.REFRESH.claimValue())
          .publish();
      return RefreshResult.failure(VerdictError.REVOKED, "Refresh token has already been used");
    }
    final RequestContext next = new RequestContext(
        firstNonNull(ctx.ipAddress(), previous.ipAddress()),
        firstNonNull(ctx.userAgent(), previous.userAgent()),
        firstNonNull(claims.deviceId(), ctx.deviceId()),
        previous.audience());
    final TokenPair pair;
    try {
      sessions.deactivate(previous.sessionId(), SessionEndReason.ROTATED);
      pair = issueTokenPair(previous.identity(), next);
    } catch (StoreUnavailableException e) {
      releaseClaim(claim, e);
      throw e;
    }
    metrics.tokenRefreshed();
    events.event(SecurityEventType.TOKEN_REFRESHED, Severity.LOW)
        .identity(claims.identityId())
        .session(pair.sessionId())
        .ip(next.ipAddress())
        .detail("previousSession", previous.sessionId())
        .publish();
    return RefreshResult.success(pair);
  }

  /**
   * Hands back a refresh token claim after the new pair could not be issued, so the caller can retry
   * with the same token. A rotated session can still be refreshed, so ending it first is harmless.
   */
  private void releaseClaim(final String claim, final StoreUnavailableException cause) {
    try {
      revocations.release(claim);
      log.info("Refresh did not complete, released claim {}", claim);
    } catch (StoreUnavailableException e) {
      cause.addSuppressed(e);
      log.error("Refresh did not complete and claim {} could not be released; the refresh token stays used",
          claim, e);
    }
  }

  /**
   * Validates a single-use token, such as a password reset link, and revokes it in the same step. Only
   * the first redemption of a token succeeds.
   *
   * @return the verdict; {@code REVOKED} for a second redemption
   */
  public ValidationVerdict redeem(final String token, final TokenPurpose purpose, final RequestContext context) {
    final ValidationVerdict verdict = validate(token, purpose, context);
    if (!verdict.valid()) {
      return verdict;
    }
    final Duration ttl = revocationTtl(verdict.claims().expiresAt(), purpose);
    try {
      if (!revocations.revoke(RevocationKeys.forToken(token), ttl, "redeemed")) {
        return ValidationVerdict.invalid(VerdictError.REVOKED, "Token has already been used", false);
      }
    } catch (StoreUnavailableException e) {
      storeUnavailable("revocation", verdict.claims().identityId(), e);
      return ValidationVerdict.invalid(VerdictError.STORE_UNAVAILABLE, REVOCATION_STORE_UNAVAILABLE, false);
    }
    return verdict;
  }

  // ── Revocation ───────────────────────────────────────────────────────────

  /**
   * Revokes a token until it would have expired anyway. Revoking a refresh token also ends its
   * session. Token ids and session ids are only trusted from tokens whose signature verifies.
   *
   * @param token  the token
   * @param reason why, for audit
   * @return false when the token was already expired, or when the revocation store could not be
   *     written; the latter also publishes a {@code STORE_UNAVAILABLE} event
   */
  public boolean revoke(final String token, final String reason) {
    if (token == null || token.isBlank()) {
      return false;
    }
    final Optional<ClaimSet> unverified = codec.peek(token);
    Optional<ClaimSet> verified = Optional.empty();
    if (unverified.isPresent()) {
      final DecodeResult decoded = codec.decode(token, unverified.get().purpose(), null);
      if (!decoded.isSuccess() && decoded.failure().kind() == DecodeResult.Kind.EXPIRED) {
        log.debug("Token already expired, nothing to revoke");
        return false;
      }
      verified = decoded.isSuccess() ? Optional.of(decoded.claims()) : Optional.empty();
    }
    final Duration ttl = unverified
        .map(c -> revocationTtl(c.expiresAt(), c.purpose()))
        .orElseGet(() -> settings.tokens().longestLifetime().plus(settings.tokens().clockSkew()));
    if (ttl.isZero()) {
      log.debug("Token already expired, nothing to revoke");
      return false;
    }

    try {
      revocations.revoke(RevocationKeys.forToken(token), ttl, reason);
      if (verified.isPresent()) {
        revocations.revoke(RevocationKeys.forTokenId(verified.get().tokenId()), ttl, reason);
      }
    } catch (StoreUnavailableException e) {
      storeUnavailable("revocation", verified.map(ClaimSet::identityId).orElse(null), e);
      log.warn("Token not revoked ({}): {}", reason, e.getMessage());
      return false;
    }
    metrics.tokenRevoked();
    events.event(SecurityEventType.TOKEN_REVOKED, Severity.MEDIUM)
        .identity(verified.map(ClaimSet::identityId).orElse(null))
        .session(verified.map(ClaimSet::sessionId).orElse(null))
        .detail("purpose", verified.map(c -> c.purpose().claimValue()).orElse(null))
        .detail("reason", reason)
        .publish();

    if (verified.isPresent() && verified.get().purpose() == TokenPurpose.REFRESH && verified.get().sessionId() != null) {
      revokeSession(verified.get().sessionId(), reason);
    }
    return true;
  }

  /**
   * Revokes a token by id, for callers that only kept the id and expiry.
   *
   * @return false when the token has already expired or the revocation store could not be written
   */
  public boolean revokeTokenId(final String tokenId, final Instant expiresAt, final String reason) {
    Objects.requireNonNull(tokenId, "tokenId");
    Objects.requireNonNull(expiresAt, "expiresAt");
    final Duration ttl = clamp(expiresAt, settings.tokens().longestLifetime());
    if (ttl.isZero()) {
      return false;
    }
    try {
      revocations.revoke(RevocationKeys.forTokenId(tokenId), ttl, reason);
    } catch (StoreUnavailableException e) {
      storeUnavailable("revocation", null, e);
      log.warn("Token id {} not revoked ({}): {}", tokenId, reason, e.getMessage());
      return false;
    }
    metrics.tokenRevoked();
    events.event(SecurityEventType.TOKEN_REVOKED, Severity.MEDIUM)
        .detail("tokenId", tokenId)
        .detail("reason", reason)
        .publish();
    return true;
  }

  /**
   * Ends one session. Its access tokens stop validating and its refresh token is refused.
   *
   * @return true when the session was active and is now ended, false otherwise or when the session
   *     store could not be written
   */
  public boolean revokeSession(final String sessionId, final String reason) {
    Objects.requireNonNull(sessionId, "sessionId");
    final boolean ended;
    final String identityId;
    try {
      ended = sessions.deactivate(sessionId, SessionEndReason.REVOKED);
      identityId = ended ? sessions.find(sessionId).map(Session::identityId).orElse(null) : null;
    } catch (StoreUnavailableException e) {
      storeUnavailable("session", null, e);
      log.warn("Session {} not revoked ({}): {}", sessionId, reason, e.getMessage());
      return false;
    }
    if (ended) {
      metrics.sessionsRevoked(1);
      log.info("Revoked session {} of identity {}", sessionId, identityId);
      events.event(SecurityEventType.SESSION_REVOKED, Severity.MEDIUM)
          .identity(identityId)
          .session(sessionId)
          .detail("reason", reason)
          .publish();
    }
    return ended;
  }

  /**
   * Ends every session of an identity, for logout-everywhere or a suspected compromise. Sessions
   * being created at the same moment may survive.
   *
   * @return number of sessions ended, or -1 when the session store could not be written
   */
  public int revokeAllSessions(final String identityId, final String reason) {
    Objects.requireNonNull(identityId, "identityId");
    final int ended;
    try {
      ended = sessions.deactivateAll(identityId, SessionEndReason.REVOKED);
    } catch (StoreUnavailableException e) {
      storeUnavailable("session", identityId, e);
      log.warn("Sessions of identity {} not revoked ({}): {}", identityId, reason, e.getMessage());
      return -1;
    }
    metrics.sessionsRevoked(ended);
    log.info("Revoked {} session(s) of identity {}", ended, identityId);
    events.event(SecurityEventType.ALL_SESSIONS_REVOKED, Severity.HIGH)
        .identity(identityId)
        .detail("count", ended)
        .detail("reason", reason)
        .publish();
    return ended;
  }

  // ── Reporting ────────────────────────────────────────────────────────────

  /**
   * Live sessions of an identity, oldest first. Empty when the session store cannot be read, in which
   * case a {@code STORE_UNAVAILABLE} event is published.
   */
  public List<Session> listActiveSessions(final String identityId) {
    Objects.requireNonNull(identityId, "identityId");
    try {
      return sessions.listActive(identityId);
    } catch (StoreUnavailableException e) {
      storeUnavailable("session", identityId, e);
      log.warn("Sessions of identity {} could not be listed: {}", identityId, e.getMessage());
      return List.of();
    }
  }

  /**
   * Summarises an identity's sessions and recent events with a 0 to 100 risk score: +30 for more
   * live sessions than allowed, +20 for sessions on more than one device, +50 for any recent high or
   * critical event. When the session store cannot be read the report lists no sessions, and the
   * {@code STORE_UNAVAILABLE} event raised for it counts as a high severity event.
   */
  public SecurityReport securityReport(final String identityId) {
    final List<Session> active = listActiveSessions(identityId);
    final List<SecurityEvent> recent = recentEvents.recentFor(identityId, REPORT_EVENT_LIMIT);
    int risk = 0;
    if (active.size() > settings.sessions().maxConcurrentSessions()) {
      risk += 30;
    }
    if (active.stream().map(Session::deviceId).filter(Objects::nonNull).distinct().count() > 1) {
      risk += 20;
    }
    if (recent.stream().anyMatch(e -> e.severity().atLeast(Severity.HIGH))) {
      risk += 50;
    }
    return new SecurityReport(identityId, active, recent, Math.min(100, risk));
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  /**
   * Revocation entries outlive the token by the clock skew, since the codec still accepts a token
   * that long after its expiry.
   */
  private Duration revocationTtl(final Instant expiresAt, final TokenPurpose purpose) {
    return clamp(expiresAt, settings.tokens().lifetime(purpose));
  }

  private Duration clamp(final Instant expiresAt, final Duration lifetime) {
    final Duration skew = settings.tokens().clockSkew();
    final Duration remaining = Duration.between(now(), expiresAt).plus(skew);
    if (remaining.isNegative() || remaining.isZero()) {
      return Duration.ZERO;
    }
    final Duration cap = lifetime.plus(skew);
    return remaining.compareTo(cap) > 0 ? cap : remaining;
  }

  private void storeUnavailable(final String store, final String identityId, final StoreUnavailableException e) {
    events.event(SecurityEventType.STORE_UNAVAILABLE, Severity.HIGH)
        .identity(identityId)
        .detail("store", store)
        .detail("error", e.getMessage())
        .publish();
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.SECONDS);
  }

  private static void addOnce(final List<String> warnings, final String warning) {
    if (!warnings.contains(warning)) {
      warnings.add(warning);
    }
  }

  private static String firstNonNull(final String first, final String second) {
    return first != null ? first : second;
  }
}
