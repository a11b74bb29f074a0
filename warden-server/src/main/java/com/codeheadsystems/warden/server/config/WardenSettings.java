package com.codeheadsystems.warden.server.config;

import java.util.Objects;

/**
 * Every resolved setting the manager needs, derived once from a {@link WardenConfiguration}.
 */
public record WardenSettings(
    TokenSettings tokens,
    SessionSettings sessions,
    StoreSettings stores,
    EvaluatorSettings evaluator,
    int recentEventCapacity) {

  public WardenSettings {
    Objects.requireNonNull(tokens, "tokens");
    Objects.requireNonNull(sessions, "sessions");
    Objects.requireNonNull(stores, "stores");
    Objects.requireNonNull(evaluator, "evaluator");
    if (recentEventCapacity < 1) {
      throw new ConfigurationException("recentEventCapacity must be at least 1");
    }
  }

  /**
   * @throws ConfigurationException when any duration or limit is invalid
   */
  public static WardenSettings from(final WardenConfiguration configuration) {
    return new WardenSettings(
        configuration.getTokens().toSettings(),
        configuration.getSessions().toSettings(),
        configuration.getStores().toSettings(),
        configuration.getEvaluator().toSettings(),
        configuration.getRecentEventCapacity());
  }

  public static WardenSettings defaults() {
    return new WardenSettings(TokenSettings.defaults(), SessionSettings.defaults(), StoreSettings.defaults(),
        EvaluatorSettings.defaults(), 1000);
  }

  public WardenSettings withTokens(final TokenSettings value) {
    return new WardenSettings(value, sessions, stores, evaluator, recentEventCapacity);
  }

  public WardenSettings withSessions(final SessionSettings value) {
    return new WardenSettings(tokens, value, stores, evaluator, recentEventCapacity);
  }

  public WardenSettings withStores(final StoreSettings value) {
    return new WardenSettings(tokens, sessions, value, evaluator, recentEventCapacity);
  }

  public WardenSettings withEvaluator(final EvaluatorSettings value) {
    return new WardenSettings(tokens, sessions, stores, value, recentEventCapacity);
  }
}
