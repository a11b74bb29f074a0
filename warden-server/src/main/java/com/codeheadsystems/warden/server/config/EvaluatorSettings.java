package com.codeheadsystems.warden.server.config;

/**
 * Resolved trust evaluation settings. Each check has a switch and the amount it subtracts from the
 * trust score when it fires.
 */
public record EvaluatorSettings(
    boolean ipValidation,
    int ipMismatchPenalty,
    boolean userAgentValidation,
    int userAgentMismatchPenalty,
    boolean deviceValidation,
    int deviceMismatchPenalty,
    boolean sessionCountValidation,
    int excessSessionsPenalty,
    boolean tokenAgeValidation,
    int staleTokenPenalty,
    double staleTokenFraction,
    int warningThreshold) {

  public EvaluatorSettings {
    if (staleTokenFraction <= 0.0 || staleTokenFraction > 1.0) {
      throw new ConfigurationException("staleTokenFraction must be in (0, 1]");
    }
    if (warningThreshold < 1) {
      throw new ConfigurationException("warningThreshold must be at least 1");
    }
    for (int penalty : new int[]{ipMismatchPenalty, userAgentMismatchPenalty, deviceMismatchPenalty,
        excessSessionsPenalty, staleTokenPenalty}) {
      if (penalty < 0 || penalty > 100) {
        throw new ConfigurationException("Trust penalties must be between 0 and 100");
      }
    }
  }

  /**
   * IP checks off (mobile clients roam), everything else on.
   */
  public static EvaluatorSettings defaults() {
    return new EvaluatorSettings(false, 30, true, 20, true, 20, true, 40, true, 10, 0.9, 3);
  }

  public EvaluatorSettings withIpValidation(final boolean enabled) {
    return new EvaluatorSettings(enabled, ipMismatchPenalty, userAgentValidation, userAgentMismatchPenalty,
        deviceValidation, deviceMismatchPenalty, sessionCountValidation, excessSessionsPenalty,
        tokenAgeValidation, staleTokenPenalty, staleTokenFraction, warningThreshold);
  }
}
