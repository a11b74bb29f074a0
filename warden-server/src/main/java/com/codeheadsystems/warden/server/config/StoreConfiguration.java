package com.codeheadsystems.warden.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * How the manager treats its session and revocation stores.
 */
public class StoreConfiguration {

  @NotEmpty
  private String callTimeout = "2s";

  /**
   * When true an unreachable session store rejects tokens with {@code STORE_UNAVAILABLE} and refuses
   * issuance, instead of failing open with a warning.
   */
  private boolean strictMode = false;

  @NotEmpty
  private String revocationSweepInterval = "1m";

  @Min(1)
  private int sustainedFailureThreshold = 5;

  public StoreSettings toSettings() {
    return new StoreSettings(
        TtlParser.parsePositive("stores.callTimeout", callTimeout),
        strictMode,
        TtlParser.parsePositive("stores.revocationSweepInterval", revocationSweepInterval),
        sustainedFailureThreshold);
  }

  @JsonProperty
  public String getCallTimeout() {
    return callTimeout;
  }

  @JsonProperty
  public void setCallTimeout(String callTimeout) {
    this.callTimeout = callTimeout;
  }

  @JsonProperty
  public boolean isStrictMode() {
    return strictMode;
  }

  @JsonProperty
  public void setStrictMode(boolean strictMode) {
    this.strictMode = strictMode;
  }

  @JsonProperty
  public String getRevocationSweepInterval() {
    return revocationSweepInterval;
  }

  @JsonProperty
  public void setRevocationSweepInterval(String revocationSweepInterval) {
    this.revocationSweepInterval = revocationSweepInterval;
  }

  @JsonProperty
  public int getSustainedFailureThreshold() {
    return sustainedFailureThreshold;
  }

  @JsonProperty
  public void setSustainedFailureThreshold(int sustainedFailureThreshold) {
    this.sustainedFailureThreshold = sustainedFailureThreshold;
  }
}
