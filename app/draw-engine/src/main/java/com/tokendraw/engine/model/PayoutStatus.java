package com.tokendraw.engine.model;

public enum PayoutStatus {
  PENDING,
  COMPLETED,
  FAILED,
  SIMULATED;

  /** COMPLETED and SIMULATED both settle the round. */
  public boolean isSuccessful() {
    return this == COMPLETED || this == SIMULATED;
  }

  public boolean isTerminal() {
    return this != PENDING;
  }
}
