package com.tokendraw.engine.service;

public class PayoutNotFoundException extends RuntimeException {

  public PayoutNotFoundException(String payoutId) {
    super("failed payout not found: " + payoutId);
  }
}
