package com.codeheadsystems.warden.model;

public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  public boolean atLeast(final Severity other) {
    return compareTo(other) >= 0;
  }
}
