package com.codeheadsystems.warden.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Trust evaluation switches and penalties. A token older than {@code staleTokenFraction} of its
 * lifetime counts as stale.
 */
public class EvaluatorConfiguration {

  private boolean ipValidation = false;

  @Min(0)
  @Max(100)
  private int ipMismatchPenalty = 30;

  private boolean userAgentValidation = true;

  @Min(0)
  @Max(100)
  private int userAgentMismatchPenalty = 20;

  private boolean deviceValidation = true;

  @Min(0)
  @Max(100)
  private int deviceMismatchPenalty = 20;

  private boolean sessionCountValidation = true;

  @Min(0)
  @Max(100)
  private int excessSessionsPenalty = 40;

  private boolean tokenAgeValidation = true;

  @Min(0)
  @Max(100)
  private int staleTokenPenalty = 10;

  @DecimalMin(value = "0.0", inclusive = false)
  @DecimalMax("1.0")
  private double staleTokenFraction = 0.9;

  @Min(1)
  private int warningThreshold = 3;

  public EvaluatorSettings toSettings() {
    return new EvaluatorSettings(ipValidation, ipMismatchPenalty, userAgentValidation, userAgentMismatchPenalty,
        deviceValidation, deviceMismatchPenalty, sessionCountValidation, excessSessionsPenalty,
        tokenAgeValidation, staleTokenPenalty, staleTokenFraction, warningThreshold);
  }

  @JsonProperty
  public boolean isIpValidation() {
    return ipValidation;
  }

  @JsonProperty
  public void setIpValidation(boolean ipValidation) {
    this.ipValidation = ipValidation;
  }

  @JsonProperty
  public int getIpMismatchPenalty() {
    return ipMismatchPenalty;
  }

  @JsonProperty
  public void setIpMismatchPenalty(int ipMismatchPenalty) {
    this.ipMismatchPenalty = ipMismatchPenalty;
  }

  @JsonProperty
  public boolean isUserAgentValidation() {
    return userAgentValidation;
  }

  @JsonProperty
  public void setUserAgentValidation(boolean userAgentValidation) {
    this.userAgentValidation = userAgentValidation;
  }

  @JsonProperty
  public int getUserAgentMismatchPenalty() {
    return userAgentMismatchPenalty;
  }

  @JsonProperty
  public void setUserAgentMismatchPenalty(int userAgentMismatchPenalty) {
    this.userAgentMismatchPenalty = userAgentMismatchPenalty;
  }

  @JsonProperty
  public boolean isDeviceValidation() {
    return deviceValidation;
  }

  @JsonProperty
  public void setDeviceValidation(boolean deviceValidation) {
    this.deviceValidation = deviceValidation;
  }

  @JsonProperty
  public int getDeviceMismatchPenalty() {
    return deviceMismatchPenalty;
  }

  @JsonProperty
  public void setDeviceMismatchPenalty(int deviceMismatchPenalty) {
    this.deviceMismatchPenalty = deviceMismatchPenalty;
  }

  @JsonProperty
  public boolean isSessionCountValidation() {
    return sessionCountValidation;
  }

  @JsonProperty
  public void setSessionCountValidation(boolean sessionCountValidation) {
    this.sessionCountValidation = sessionCountValidation;
  }

  @JsonProperty
  public int getExcessSessionsPenalty() {
    return excessSessionsPenalty;
  }

  @JsonProperty
  public void setExcessSessionsPenalty(int excessSessionsPenalty) {
    this.excessSessionsPenalty = excessSessionsPenalty;
  }

  @JsonProperty
  public boolean isTokenAgeValidation() {
    return tokenAgeValidation;
  }

  @JsonProperty
  public void setTokenAgeValidation(boolean tokenAgeValidation) {
    this.tokenAgeValidation = tokenAgeValidation;
  }

  @JsonProperty
  public int getStaleTokenPenalty() {
    return staleTokenPenalty;
  }

  @JsonProperty
  public void setStaleTokenPenalty(int staleTokenPenalty) {
    this.staleTokenPenalty = staleTokenPenalty;
  }

  @JsonProperty
  public double getStaleTokenFraction() {
    return staleTokenFraction;
  }

  @JsonProperty
  public void setStaleTokenFraction(double staleTokenFraction) {
    this.staleTokenFraction = staleTokenFraction;
  }

  @JsonProperty
  public int getWarningThreshold() {
    return warningThreshold;
  }

  @JsonProperty
  public void setWarningThreshold(int warningThreshold) {
    this.warningThreshold = warningThreshold;
  }
}
