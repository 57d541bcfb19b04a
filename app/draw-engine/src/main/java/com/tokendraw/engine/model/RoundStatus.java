package com.tokendraw.engine.model;

public enum RoundStatus {
  SPINNING,
  WINNER_SELECTED,
  PROCESSING_PAYOUT,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
