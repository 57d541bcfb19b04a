package com.tokendraw.engine.service;

public class DrawConfigurationException extends RuntimeException {

  public DrawConfigurationException(String message) {
    super(message);
  }
}
