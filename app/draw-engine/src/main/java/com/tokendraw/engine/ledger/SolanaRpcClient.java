/*
 * Where: draw engine ledger boundary
 * What: JSON-RPC 2.0 client for one Solana RPC endpoint
 * Why: transport, timeout and RPC errors are mapped once into LedgerIntegrationException
 */
package com.tokendraw.engine.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokendraw.engine.ledger.dto.JsonRpcRequest;
import com.tokendraw.engine.model.SignatureStatus;
import com.tokendraw.engine.model.TokenAccount;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class SolanaRpcClient implements LedgerClient {

  private static final Logger logger = LoggerFactory.getLogger(SolanaRpcClient.class);

  static final String TOKEN_PROGRAM_ID = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";
  private static final int TOKEN_ACCOUNT_DATA_SIZE = 165;

  private final String endpoint;
  private final URI endpointUri;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  private final RestClient restClient;

  private final String commitment;
  private final AtomicLong requestIds = new AtomicLong();

  public SolanaRpcClient(String endpoint, RestClient restClient, String commitment) {
    this.endpoint = endpoint;
    this.endpointUri = URI.create(endpoint);
    this.restClient = restClient;
    this.commitment = commitment;
  }

  @Override
  public String endpoint() {
    return endpoint;
  }

  @Override
  public boolean isHealthy() {
    final JsonNode result = call("getHealth", List.of());
    return "ok".equals(result.asText());
  }

  @Override
  public long getTokenSupply(String mint) {
    requireText(mint, "mint");
    final JsonNode result = call("getTokenSupply", List.of(mint));
    return parseAmount(result.path("value").path("amount"), "getTokenSupply");
  }

  @Override
  public List<TokenAccount> getTokenAccounts(String mint) {
    requireText(mint, "mint");
    final Map<String, Object> config =
        Map.of(
            "encoding",
            "jsonParsed",
            "commitment",
            commitment,
            "filters",
            List.of(
                Map.of("dataSize", TOKEN_ACCOUNT_DATA_SIZE),
                Map.of("memcmp", Map.of("offset", 0, "bytes", mint))));
    final JsonNode result = call("getProgramAccounts", List.of(TOKEN_PROGRAM_ID, config));
    return parseTokenAccounts(result, "getProgramAccounts");
  }

  @Override
  public String getLatestBlockhash() {
    final JsonNode result = call("getLatestBlockhash", List.of(Map.of("commitment", commitment)));
    final String blockhash = result.path("value").path("blockhash").asText("");
    if (blockhash.isBlank()) {
      throw invalidResponse("getLatestBlockhash");
    }
    return blockhash;
  }

  @Override
  public List<TokenAccount> getTokenAccountsByOwner(String owner, String mint) {
    requireText(owner, "owner");
    requireText(mint, "mint");
    final JsonNode result =
        call(
            "getTokenAccountsByOwner",
            List.of(
                owner,
                Map.of("mint", mint),
                Map.of("encoding", "jsonParsed", "commitment", commitment)));
    return parseTokenAccounts(result.path("value"), "getTokenAccountsByOwner");
  }

  @Override
  public String sendTransaction(String encodedTransaction) {
    requireText(encodedTransaction, "encodedTransaction");
    final JsonNode result =
        call(
            "sendTransaction",
            List.of(
                encodedTransaction,
                Map.of(
                    "encoding",
                    "base64",
                    "skipPreflight",
                    false,
                    "preflightCommitment",
                    commitment)));
    final String signature = result.asText("");
    if (signature.isBlank()) {
      throw invalidResponse("sendTransaction");
    }
    return signature;
  }

  @Override
  public Optional<SignatureStatus> getSignatureStatus(String signature) {
    requireText(signature, "signature");
    final JsonNode result =
        call(
            "getSignatureStatuses",
            List.of(List.of(signature), Map.of("searchTransactionHistory", false)));
    final JsonNode status = result.path("value").path(0);
    if (status.isMissingNode() || status.isNull()) {
      return Optional.empty();
    }
    final JsonNode err = status.path("err");
    final String error = err.isMissingNode() || err.isNull() ? null : err.toString();
    return Optional.of(
        new SignatureStatus(signature, status.path("confirmationStatus").asText(null), error));
  }

  private JsonNode call(String method, List<Object> params) {
    final JsonRpcRequest request = JsonRpcRequest.of(requestIds.incrementAndGet(), method, params);
    final JsonNode response;
    try {
      response =
          restClient
              .post()
              .uri(endpointUri)
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "ledger {} failed with http status={} endpoint={}",
          method,
          ex.getStatusCode().value(),
          endpoint);
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.HTTP_ERROR, "ledger " + method + " http error", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("ledger {} timed out endpoint={}", method, endpoint);
        throw new LedgerIntegrationException(
            LedgerIntegrationException.Reason.TIMEOUT, "ledger " + method + " timeout", ex);
      }
      logger.warn("ledger {} connection failed endpoint={}", method, endpoint);
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.CONNECTION,
          "ledger " + method + " connection failed",
          ex);
    } catch (RuntimeException ex) {
      logger.warn("ledger {} response parse failed endpoint={}", method, endpoint, ex);
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.INVALID_RESPONSE,
          "ledger " + method + " response parse failed",
          ex);
    }
    if (response == null) {
      throw invalidResponse(method);
    }
    final JsonNode error = response.get("error");
    if (error != null && !error.isNull()) {
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.RPC_ERROR,
          "ledger "
              + method
              + " rpc error code="
              + error.path("code").asText()
              + " message="
              + error.path("message").asText());
    }
    final JsonNode result = response.get("result");
    if (result == null) {
      throw invalidResponse(method);
    }
    return result;
  }

  private List<TokenAccount> parseTokenAccounts(JsonNode accounts, String method) {
    if (!accounts.isArray()) {
      throw invalidResponse(method);
    }
    final List<TokenAccount> parsed = new ArrayList<>(accounts.size());
    for (JsonNode account : accounts) {
      final JsonNode info = account.path("account").path("data").path("parsed").path("info");
      final String owner = info.path("owner").asText("");
      if (owner.isBlank()) {
        // Not a parsed token account; skip rather than fail the whole scan.
        continue;
      }
      parsed.add(
          new TokenAccount(
              account.path("pubkey").asText(),
              owner,
              info.path("mint").asText(null),
              parseAmount(info.path("tokenAmount").path("amount"), method)));
    }
    return parsed;
  }

  private long parseAmount(JsonNode amount, String method) {
    if (amount.isMissingNode() || amount.isNull()) {
      throw invalidResponse(method);
    }
    try {
      return Long.parseLong(amount.asText());
    } catch (NumberFormatException ex) {
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.INVALID_RESPONSE,
          "ledger " + method + " returned a non-numeric amount",
          ex);
    }
  }

  private LedgerIntegrationException invalidResponse(String method) {
    return new LedgerIntegrationException(
        LedgerIntegrationException.Reason.INVALID_RESPONSE,
        "ledger " + method + " response is invalid");
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
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
