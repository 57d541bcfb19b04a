package com.tokendraw.engine.ledger;

/** A submitted transaction that failed on the ledger or was not confirmed in time. */
public class ConfirmationException extends RuntimeException {

  private final String signature;

  public ConfirmationException(String signature, String message) {
    super(message);
    this.signature = signature;
  }

  public String signature() {
    return signature;
  }
}
