package com.codeheadsystems.warden.server.evaluator;

import com.codeheadsystems.warden.model.Severity;
import java.util.List;

/**
 * Result of scoring a verified token against the request presenting it.
 *
 * @param findings   anomalies that lowered the score
 * @param trustScore 0 to 100
 */
public record TrustEvaluation(List<Finding> findings, int trustScore) {

  /**
   * @param message  warning text returned to the caller
   * @param severity how strongly it suggests compromise
   */
  public record Finding(String message, Severity severity) {
  }

  public TrustEvaluation {
    findings = List.copyOf(findings);
  }

  public List<String> warnings() {
    return findings.stream().map(Finding::message).toList();
  }
}
