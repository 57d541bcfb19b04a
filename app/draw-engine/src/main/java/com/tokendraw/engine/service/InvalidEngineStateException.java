package com.tokendraw.engine.service;

import com.tokendraw.engine.model.EngineState;

public class InvalidEngineStateException extends RuntimeException {

  private final EngineState state;

  public InvalidEngineStateException(String operation, EngineState state) {
    super(operation + " is not allowed in state " + state);
    this.state = state;
  }

  public EngineState state() {
    return state;
  }
}
