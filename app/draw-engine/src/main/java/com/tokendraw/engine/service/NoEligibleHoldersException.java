package com.tokendraw.engine.service;

public class NoEligibleHoldersException extends RuntimeException {

  public NoEligibleHoldersException() {
    super("no eligible holders");
  }
}
