package com.codeheadsystems.warden.server.evaluator;

import com.codeheadsystems.warden.model.ClaimSet;
import com.codeheadsystems.warden.model.RequestContext;
import com.codeheadsystems.warden.model.Severity;
import com.codeheadsystems.warden.server.config.EvaluatorSettings;
import com.codeheadsystems.warden.server.config.SessionSettings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Scores how much a verified token can be trusted for the current request. Starts at 100 and
 * subtracts a penalty per anomaly. Only warns; rejecting is the caller's call.
 * <p>
 * A binding is compared only when both the token and the request carry it.
 */
@Singleton
public class SecurityEvaluator {

  static final int FULL_TRUST = 100;

  private final EvaluatorSettings settings;
  private final int maxConcurrentSessions;
  private final Clock clock;

  @Inject
  public SecurityEvaluator(final EvaluatorSettings settings, final SessionSettings sessions, final Clock clock) {
    this.settings = settings;
    this.maxConcurrentSessions = sessions.maxConcurrentSessions();
    this.clock = clock;
  }

  /**
   * @param claims             verified claims
   * @param observed           what the current request looks like
   * @param activeSessionCount live sessions of the identity, or a negative number when unknown
   * @return warnings and score
   */
  public TrustEvaluation evaluate(final ClaimSet claims, final RequestContext observed, final int activeSessionCount) {
    final List<TrustEvaluation.Finding> findings = new ArrayList<>();
    int score = FULL_TRUST;

    if (settings.ipValidation() && differs(claims.ipAddress(), observed.ipAddress())) {
      findings.add(new TrustEvaluation.Finding("IP address mismatch", Severity.MEDIUM));
      score -= settings.ipMismatchPenalty();
    }
    if (settings.userAgentValidation() && differs(claims.userAgent(), observed.userAgent())) {
      findings.add(new TrustEvaluation.Finding("User agent mismatch", Severity.MEDIUM));
      score -= settings.userAgentMismatchPenalty();
    }
    if (settings.deviceValidation() && differs(claims.deviceId(), observed.deviceId())) {
      findings.add(new TrustEvaluation.Finding("Device mismatch", Severity.MEDIUM));
      score -= settings.deviceMismatchPenalty();
    }
    if (settings.sessionCountValidation() && activeSessionCount > maxConcurrentSessions) {
      findings.add(new TrustEvaluation.Finding(
          "Too many active sessions (" + activeSessionCount + " > " + maxConcurrentSessions + ")", Severity.HIGH));
      score -= settings.excessSessionsPenalty();
    }
    if (settings.tokenAgeValidation() && isStale(claims)) {
      findings.add(new TrustEvaluation.Finding("Token is unusually old", Severity.LOW));
      score -= settings.staleTokenPenalty();
    }
    return new TrustEvaluation(findings, Math.max(0, score));
  }

  private boolean isStale(final ClaimSet claims) {
    final Duration lifetime = Duration.between(claims.issuedAt(), claims.expiresAt());
    if (lifetime.isNegative() || lifetime.isZero()) {
      return false;
    }
    final Duration age = Duration.between(claims.issuedAt(), clock.instant());
    return age.toMillis() > lifetime.toMillis() * settings.staleTokenFraction();
  }

  private static boolean differs(final String bound, final String observed) {
    return bound != null && observed != null && !Objects.equals(bound, observed);
  }
}
