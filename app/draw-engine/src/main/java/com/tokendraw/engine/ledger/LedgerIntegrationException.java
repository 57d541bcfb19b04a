/*
 * Where: draw engine ledger boundary
 * What: a failed ledger RPC call with a coarse reason
 * Why: the gateway retries any reason, callers branch only on success or failure
 */
package com.tokendraw.engine.ledger;

public class LedgerIntegrationException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    CONNECTION,
    HTTP_ERROR,
    RPC_ERROR,
    INVALID_RESPONSE,
    NO_BACKUP
  }

  private final Reason reason;

  public LedgerIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public LedgerIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
