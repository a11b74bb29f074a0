package com.codeheadsystems.warden.server.evaluator;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.model.ClaimSet;
import com.codeheadsystems.warden.model.RequestContext;
import com.codeheadsystems.warden.model.Severity;
import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.MutableClock;
import com.codeheadsystems.warden.server.config.EvaluatorSettings;
import com.codeheadsystems.warden.server.config.SessionSettings;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SecurityEvaluatorTest {

  private static final Instant ISSUED = Instant.parse("2026-03-01T12:00:00Z");

  private MutableClock clock;
  private SecurityEvaluator evaluator;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(ISSUED.plusSeconds(60));
    evaluator = new SecurityEvaluator(EvaluatorSettings.defaults(), SessionSettings.defaults(), clock);
  }

  @Test
  void evaluate_matchingRequest_hasFullTrust() {
    final TrustEvaluation evaluation =
        evaluator.evaluate(claims(), RequestContext.of("203.0.113.7", "Mozilla/5.0", "device-1"), 1);

    assertThat(evaluation.findings()).isEmpty();
    assertThat(evaluation.trustScore()).isEqualTo(100);
  }

  @Test
  void evaluate_ipMismatch_ignoredUnlessEnabled() {
    final RequestContext moved = RequestContext.of("198.51.100.1", "Mozilla/5.0", "device-1");

    assertThat(evaluator.evaluate(claims(), moved, 1).findings()).isEmpty();

    evaluator = new SecurityEvaluator(EvaluatorSettings.defaults().withIpValidation(true),
        SessionSettings.defaults(), clock);
    final TrustEvaluation evaluation = evaluator.evaluate(claims(), moved, 1);
    assertThat(evaluation.warnings()).containsExactly("IP address mismatch");
    assertThat(evaluation.trustScore()).isEqualTo(70);
  }

  @Test
  void evaluate_userAgentAndDeviceMismatch() {
    final TrustEvaluation evaluation =
        evaluator.evaluate(claims(), RequestContext.of("203.0.113.7", "curl/8.0", "device-2"), 1);

    assertThat(evaluation.warnings()).containsExactly("User agent mismatch", "Device mismatch");
    assertThat(evaluation.findings()).extracting(TrustEvaluation.Finding::severity)
        .containsOnly(Severity.MEDIUM);
    assertThat(evaluation.trustScore()).isEqualTo(60);
  }

  @Test
  void evaluate_missingObservedValues_areNotMismatches() {
    assertThat(evaluator.evaluate(claims(), RequestContext.empty(), 1).findings()).isEmpty();
  }

  @Test
  void evaluate_tooManySessions_isHighSeverity() {
    final TrustEvaluation evaluation = evaluator.evaluate(claims(), RequestContext.empty(), 6);

    assertThat(evaluation.findings()).containsExactly(
        new TrustEvaluation.Finding("Too many active sessions (6 > 5)", Severity.HIGH));
    assertThat(evaluation.trustScore()).isEqualTo(60);
  }

  @Test
  void evaluate_unknownSessionCount_isSkipped() {
    assertThat(evaluator.evaluate(claims(), RequestContext.empty(), -1).findings()).isEmpty();
  }

  @Test
  void evaluate_tokenNearEndOfLife_isStale() {
    clock.set(ISSUED.plus(Duration.ofMinutes(14)));

    final TrustEvaluation evaluation = evaluator.evaluate(claims(), RequestContext.empty(), 1);

    assertThat(evaluation.findings()).containsExactly(new TrustEvaluation.Finding("Token is unusually old", Severity.LOW));
    assertThat(evaluation.trustScore()).isEqualTo(90);
  }

  @Test
  void evaluate_everythingWrong_scoreFloorsAtZero() {
    evaluator = new SecurityEvaluator(EvaluatorSettings.defaults().withIpValidation(true),
        SessionSettings.defaults(), clock);
    clock.set(ISSUED.plus(Duration.ofMinutes(14)));

    final TrustEvaluation evaluation =
        evaluator.evaluate(claims(), RequestContext.of("198.51.100.1", "curl/8.0", "device-2"), 9);

    assertThat(evaluation.findings()).hasSize(5);
    assertThat(evaluation.trustScore()).isZero();
  }

  private static ClaimSet claims() {
    return ClaimSet.builder()
        .tokenId("jti-1")
        .identityId("user-alice")
        .sessionId("session-1")
        .purpose(TokenPurpose.ACCESS)
        .deviceId("device-1")
        .ipAddress("203.0.113.7")
        .userAgent("Mozilla/5.0")
        .issuer("warden")
        .issuedAt(ISSUED)
        .expiresAt(ISSUED.plus(Duration.ofMinutes(15)))
        .build();
  }
}
