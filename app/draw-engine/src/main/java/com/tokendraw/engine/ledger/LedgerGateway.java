/*
 * Where: draw engine ledger boundary
 * What: retries every ledger call with exponential backoff and fails over across endpoints
 * Why: holder scans and payouts must survive a single RPC node going away
 */
package com.tokendraw.engine.ledger;

import com.google.common.annotations.VisibleForTesting;
import com.tokendraw.engine.config.LedgerProperties;
import com.tokendraw.engine.model.SignatureStatus;
import com.tokendraw.engine.model.TokenAccount;
import com.tokendraw.engine.service.DrawMetrics;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LedgerGateway {

  private static final Logger logger = LoggerFactory.getLogger(LedgerGateway.class);

  private final List<LedgerClient> endpoints;
  private final LedgerProperties properties;
  private final DrawMetrics metrics;
  private final AtomicInteger activeIndex = new AtomicInteger();

  public LedgerGateway(List<LedgerClient> endpoints, LedgerProperties properties, DrawMetrics metrics) {
    if (endpoints == null || endpoints.isEmpty()) {
      throw new IllegalArgumentException("at least one ledger endpoint is required");
    }
    this.endpoints = List.copyOf(endpoints);
    this.properties = properties;
    this.metrics = metrics;
  }

  public <T> T executeWithRetry(String operation, Function<LedgerClient, T> call) {
    return executeWithRetry(operation, call, properties.maxRetries());
  }

  /**
   * Runs {@code call} against the active endpoint up to {@code maxRetries} times.
   *
   * <p>After a failure the gateway moves to the next endpoint while some endpoint has not been
   * tried yet, then waits {@code backoffBase * 2^(attempt-1)}. The last failure is rethrown as a
   * {@link LedgerIntegrationException}.
   */
  public <T> T executeWithRetry(String operation, Function<LedgerClient, T> call, int maxRetries) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be positive");
    }
    final Set<Integer> tried = new HashSet<>();
    RuntimeException lastError = null;
    for (int attempt = 1; attempt <= maxRetries; attempt++) {
      final int index = activeIndex.get();
      tried.add(index);
      final LedgerClient client = endpoints.get(index);
      try {
        return call.apply(client);
      } catch (RuntimeException ex) {
        lastError = ex;
        metrics.recordLedgerRetry(operation);
        logger.warn(
            "ledger operation failed operation={} attempt={}/{} endpoint={} message={}",
            operation,
            attempt,
            maxRetries,
            client.endpoint(),
            ex.getMessage());
        if (attempt == maxRetries) {
          break;
        }
        if (endpoints.size() > 1 && tried.size() < endpoints.size()) {
          switchQuietly();
        }
        pause(computeBackoffDuration(attempt));
      }
    }
    logger.error("ledger operation exhausted retries operation={} maxRetries={}", operation, maxRetries);
    if (lastError instanceof LedgerIntegrationException integrationException) {
      throw integrationException;
    }
    throw new LedgerIntegrationException(
        LedgerIntegrationException.Reason.INVALID_RESPONSE,
        "ledger " + operation + " failed after " + maxRetries + " attempts",
        lastError);
  }

  /**
   * Advances the active endpoint round-robin and probes it.
   *
   * @return whether the new endpoint answered its health check
   */
  public boolean switchToBackup() {
    if (endpoints.size() < 2) {
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.NO_BACKUP, "no backup ledger endpoint configured");
    }
    final int next = activeIndex.updateAndGet(current -> (current + 1) % endpoints.size());
    final LedgerClient client = endpoints.get(next);
    metrics.recordLedgerFailover();
    logger.warn("switched ledger endpoint index={} endpoint={}", next, client.endpoint());
    try {
      return client.isHealthy();
    } catch (RuntimeException ex) {
      logger.warn("ledger endpoint unhealthy after switch endpoint={}", client.endpoint(), ex);
      return false;
    }
  }

  public long tokenSupply(String mint) {
    return executeWithRetry("getTokenSupply", client -> client.getTokenSupply(mint));
  }

  public List<TokenAccount> tokenHolders(String mint) {
    return executeWithRetry("getTokenAccounts", client -> client.getTokenAccounts(mint));
  }

  public String latestBlockhash() {
    return executeWithRetry("getLatestBlockhash", LedgerClient::getLatestBlockhash);
  }

  /** Sum of every token account the owner holds for the mint. */
  public long tokenBalance(String owner, String mint) {
    final List<TokenAccount> accounts =
        executeWithRetry(
            "getTokenAccountsByOwner", client -> client.getTokenAccountsByOwner(owner, mint));
    return accounts.stream().mapToLong(TokenAccount::amount).sum();
  }

  public boolean hasTokenAccount(String owner, String mint) {
    return !executeWithRetry(
            "getTokenAccountsByOwner", client -> client.getTokenAccountsByOwner(owner, mint))
        .isEmpty();
  }

  public String submitTransaction(String encodedTransaction) {
    return executeWithRetry("sendTransaction", client -> client.sendTransaction(encodedTransaction));
  }

  /**
   * Polls the signature status until it is confirmed.
   *
   * @throws ConfirmationException when the ledger reports an error or {@code timeout} elapses
   */
  public SignatureStatus confirmTransaction(String signature, Duration timeout) {
    final long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      final Optional<SignatureStatus> status =
          executeWithRetry("getSignatureStatuses", client -> client.getSignatureStatus(signature));
      if (status.isPresent() && status.get().failed()) {
        throw new ConfirmationException(
            signature, "transaction failed on ledger: " + status.get().error());
      }
      if (status.isPresent() && status.get().confirmed()) {
        return status.get();
      }
      if (System.nanoTime() >= deadline) {
        throw new ConfirmationException(
            signature, "transaction not confirmed within " + timeout.toMillis() + "ms");
      }
      pause(properties.confirmPollInterval());
    }
  }

  /** Health of the active endpoint; never throws. */
  public boolean checkConnection() {
    final LedgerClient client = activeClient();
    try {
      return client.isHealthy();
    } catch (RuntimeException ex) {
      logger.warn("ledger health check failed endpoint={}", client.endpoint(), ex);
      return false;
    }
  }

  public String activeEndpoint() {
    return activeClient().endpoint();
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    return properties.backoffBase().multipliedBy(1L << Math.min(attempt - 1, 20));
  }

  private LedgerClient activeClient() {
    return endpoints.get(activeIndex.get());
  }

  private void switchQuietly() {
    if (!switchToBackup()) {
      logger.warn("backup ledger endpoint did not report healthy; retrying anyway");
    }
  }

  private void pause(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new LedgerIntegrationException(
          LedgerIntegrationException.Reason.CONNECTION, "ledger retry interrupted", ex);
    }
  }
}
