package com.codeheadsystems.warden.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * Key material for one token purpose. HMAC deployments set {@code secret}; RSA and EC deployments
 * point at PEM files.
 * <p>
 * {@code previousSecrets} lists retired HMAC secrets, oldest first. They are numbered from version 1
 * and the current secret gets the next version, so tokens signed before a restart-time rotation
 * still verify.
 */
public class KeyConfiguration {

  private String secret;

  private List<String> previousSecrets = new ArrayList<>();

  private String privateKeyPemPath;

  private String publicKeyPemPath;

  @JsonProperty
  public String getSecret() {
    return secret;
  }

  @JsonProperty
  public void setSecret(String secret) {
    this.secret = secret;
  }

  @JsonProperty
  public List<String> getPreviousSecrets() {
    return previousSecrets;
  }

  @JsonProperty
  public void setPreviousSecrets(List<String> previousSecrets) {
    this.previousSecrets = previousSecrets == null ? new ArrayList<>() : previousSecrets;
  }

  @JsonProperty
  public String getPrivateKeyPemPath() {
    return privateKeyPemPath;
  }

  @JsonProperty
  public void setPrivateKeyPemPath(String privateKeyPemPath) {
    this.privateKeyPemPath = privateKeyPemPath;
  }

  @JsonProperty
  public String getPublicKeyPemPath() {
    return publicKeyPemPath;
  }

  @JsonProperty
  public void setPublicKeyPemPath(String publicKeyPemPath) {
    this.publicKeyPemPath = publicKeyPemPath;
  }

  @Override
  public String toString() {
    return "KeyConfiguration[secret=" + (secret == null ? "unset" : "****")
        + ", previousSecrets=" + previousSecrets.size()
        + ", privateKeyPemPath=" + privateKeyPemPath
        + ", publicKeyPemPath=" + publicKeyPemPath + "]";
  }
}
