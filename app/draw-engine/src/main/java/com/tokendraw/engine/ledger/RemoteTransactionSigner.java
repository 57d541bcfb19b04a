/*
 * Where: draw engine ledger boundary
 * What: asks an external signing service to sign a disbursement plan
 * Why: the disbursing key never lives in this process
 */
package com.tokendraw.engine.ledger;

import com.tokendraw.engine.ledger.dto.SignTransactionRequest;
import com.tokendraw.engine.ledger.dto.SignTransactionResponse;
import com.tokendraw.engine.model.DisbursementPlan;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class RemoteTransactionSigner implements TransactionSigner {

  private static final Logger logger = LoggerFactory.getLogger(RemoteTransactionSigner.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  private final RestClient signerRestClient;

  private final String signPath;
  private final String signerAddress;

  public RemoteTransactionSigner(
      RestClient signerRestClient, String signPath, String signerAddress) {
    if (signerAddress == null || signerAddress.isBlank()) {
      throw new IllegalArgumentException("disbursing wallet is required for signing");
    }
    this.signerRestClient = signerRestClient;
    this.signPath = signPath;
    this.signerAddress = signerAddress;
  }

  @Override
  public String signerAddress() {
    return signerAddress;
  }

  @Override
  public String sign(DisbursementPlan plan, String recentBlockhash) {
    final SignTransactionRequest request =
        new SignTransactionRequest(
            plan.payoutId(),
            plan.payer(),
            plan.mint(),
            recentBlockhash,
            plan.transfers().stream()
                .map(
                    transfer ->
                        new SignTransactionRequest.Transfer(
                            transfer.recipient(),
                            transfer.amount(),
                            transfer.createRecipientAccount()))
                .toList());
    final SignTransactionResponse response;
    try {
      response =
          signerRestClient
              .post()
              .uri(signPath)
              .body(request)
              .retrieve()
              .body(SignTransactionResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "signer rejected payoutId={} status={}", plan.payoutId(), ex.getStatusCode().value());
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.HTTP_ERROR, "signer request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new LedgerIntegrationException(
            LedgerIntegrationException.Reason.TIMEOUT, "signer request timeout", ex);
      }
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.CONNECTION, "signer connection failed", ex);
    }
    if (response == null
        || response.encodedTransaction() == null
        || response.encodedTransaction().isBlank()) {
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.INVALID_RESPONSE, "signer returned no transaction");
    }
    return response.encodedTransaction();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
