package com.tokendraw.engine.service;

public class InsufficientFundsException extends RuntimeException {

  private final long available;
  private final long required;

  public InsufficientFundsException(long available, long required) {
    super("insufficient disbursing balance: have " + available + ", need " + required);
    this.available = available;
    this.required = required;
  }

  public long available() {
    return available;
  }

  public long required() {
    return required;
  }
}
