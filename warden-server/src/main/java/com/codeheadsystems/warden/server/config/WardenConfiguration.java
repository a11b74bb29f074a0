package com.codeheadsystems.warden.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Root configuration for the session security manager, usually read from YAML by
 * {@link ConfigurationLoader}.
 * <p>
 * Every signing secret must be supplied; unlike a development server there is no random fallback,
 * since a random secret would silently log every user out on restart and differ between replicas.
 * Generate secrets with: {@code openssl rand -base64 48}
 */
public class WardenConfiguration {

  @Valid
  @NotNull
  private TokenConfiguration tokens = new TokenConfiguration();

  @Valid
  @NotNull
  private SecretsConfiguration secrets = new SecretsConfiguration();

  @Valid
  @NotNull
  private SessionConfiguration sessions = new SessionConfiguration();

  @Valid
  @NotNull
  private EvaluatorConfiguration evaluator = new EvaluatorConfiguration();

  @Valid
  @NotNull
  private StoreConfiguration stores = new StoreConfiguration();

  /**
   * Security events kept in memory for reports.
   */
  @Min(1)
  private int recentEventCapacity = 1000;

  @JsonProperty
  public TokenConfiguration getTokens() {
    return tokens;
  }

  @JsonProperty
  public void setTokens(TokenConfiguration tokens) {
    this.tokens = tokens;
  }

  @JsonProperty
  public SecretsConfiguration getSecrets() {
    return secrets;
  }

  @JsonProperty
  public void setSecrets(SecretsConfiguration secrets) {
    this.secrets = secrets;
  }

  @JsonProperty
  public SessionConfiguration getSessions() {
    return sessions;
  }

  @JsonProperty
  public void setSessions(SessionConfiguration sessions) {
    this.sessions = sessions;
  }

  @JsonProperty
  public EvaluatorConfiguration getEvaluator() {
    return evaluator;
  }

  @JsonProperty
  public void setEvaluator(EvaluatorConfiguration evaluator) {
    this.evaluator = evaluator;
  }

  @JsonProperty
  public StoreConfiguration getStores() {
    return stores;
  }

  @JsonProperty
  public void setStores(StoreConfiguration stores) {
    this.stores = stores;
  }

  @JsonProperty
  public int getRecentEventCapacity() {
    return recentEventCapacity;
  }

  @JsonProperty
  public void setRecentEventCapacity(int recentEventCapacity) {
    this.recentEventCapacity = recentEventCapacity;
  }
}
