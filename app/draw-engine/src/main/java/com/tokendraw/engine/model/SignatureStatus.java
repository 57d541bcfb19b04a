package com.tokendraw.engine.model;

public record SignatureStatus(String signature, String confirmationStatus, String error) {

  public boolean failed() {
    return error != null && !error.isBlank();
  }

  public boolean confirmed() {
    return !failed()
        && ("confirmed".equalsIgnoreCase(confirmationStatus)
            || "finalized".equalsIgnoreCase(confirmationStatus));
  }
}
