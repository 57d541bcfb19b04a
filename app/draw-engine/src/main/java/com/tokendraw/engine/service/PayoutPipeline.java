/*
 * Where: draw engine service layer
 * What: turns a round result into a confirmed disbursement with bounded retries
 * Why: every payout ends in exactly one terminal state that a manual retry can pick up
 */
package com.tokendraw.engine.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import com.tokendraw.common.TraceIds;
import com.tokendraw.engine.config.PayoutProperties;
import com.tokendraw.engine.ledger.LedgerGateway;
import com.tokendraw.engine.ledger.TransactionSigner;
import com.tokendraw.engine.model.DisbursementPlan;
import com.tokendraw.engine.model.DisbursingBalanceReport;
import com.tokendraw.engine.model.Payout;
import com.tokendraw.engine.model.PayoutStats;
import com.tokendraw.engine.model.PayoutStatus;
import com.tokendraw.engine.model.TransferInstruction;
import com.tokendraw.engine.repository.PayoutRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class PayoutPipeline {

  private static final Logger logger = LoggerFactory.getLogger(PayoutPipeline.class);

  private static final int LOCK_STRIPES = 16;

  private final LedgerGateway ledgerGateway;
  private final Optional<TransactionSigner> signer;
  private final PayoutProperties properties;
  private final PayoutRepository payoutRepository;
  private final DrawMetrics metrics;
  private final Clock clock;

  private final ConcurrentMap<String, Payout> pending = new ConcurrentHashMap<>();
  private final Deque<Payout> history = new ArrayDeque<>();
  private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

  public PayoutPipeline(
      LedgerGateway ledgerGateway,
      Optional<TransactionSigner> signer,
      PayoutProperties properties,
      PayoutRepository payoutRepository,
      DrawMetrics metrics,
      Clock clock) {
    this.ledgerGateway = ledgerGateway;
    this.signer = signer;
    this.properties = properties;
    this.payoutRepository = payoutRepository;
    this.metrics = metrics;
    this.clock = clock;
    if (signer.isEmpty()) {
      logger.warn("no transaction signer configured; payouts run in simulated mode");
    }
  }

  /** Disburses both shares of a round and returns the terminal payout. */
  public Payout disburse(
      String roundId, String winnerAddress, long winnerAmount, long creatorAmount) {
    if (winnerAddress == null || winnerAddress.isBlank()) {
      throw new IllegalArgumentException("winnerAddress is required");
    }
    if (winnerAmount < 0 || creatorAmount < 0) {
      throw new IllegalArgumentException("payout amounts must not be negative");
    }
    final Payout payout =
        Payout.pending(
            TraceIds.newPrefixedId("payout", clock),
            roundId,
            winnerAddress,
            winnerAmount,
            creatorAmount,
            Instant.now(clock));
    logger.info(
        "payout requested payoutId={} roundId={} winner={} winnerAmount={} creatorAmount={}",
        payout.payoutId(),
        roundId,
        winnerAddress,
        winnerAmount,
        creatorAmount);
    return execute(payout);
  }

  /** Reloads the bounded terminal history so failed payouts stay retryable across restarts. */
  public void restoreHistory() {
    try {
      final List<Payout> stored = payoutRepository.findRecentPayouts(properties.historySize());
      int restored = 0;
      synchronized (history) {
        history.clear();
        for (Payout payout : stored) {
          if (payout.status().isTerminal()) {
            history.addLast(payout);
            restored++;
          }
        }
      }
      logger.info("payout history restored payouts={}", restored);
    } catch (RuntimeException ex) {
      logger.warn("payout history restore failed; starting with an empty history", ex);
    }
  }

  /**
   * Re-runs a FAILED payout from scratch.
   *
   * @throws PayoutNotFoundException when no FAILED payout with this id is in history
   */
  public Payout retryFailedPayout(String payoutId) {
    final Payout failed;
    synchronized (history) {
      failed =
          history.stream()
              .filter(p -> p.payoutId().equals(payoutId) && p.status() == PayoutStatus.FAILED)
              .findFirst()
              .orElseThrow(() -> new PayoutNotFoundException(payoutId));
      history.remove(failed);
    }
    logger.info("retrying failed payout payoutId={} roundId={}", payoutId, failed.roundId());
    return execute(failed.resetForRetry());
  }

  public List<Payout> history(int limit) {
    synchronized (history) {
      return history.stream().limit(Math.max(0, limit)).toList();
    }
  }

  public List<Payout> pending() {
    return List.copyOf(pending.values());
  }

  public Optional<Payout> find(String payoutId) {
    final Payout inFlight = pending.get(payoutId);
    if (inFlight != null) {
      return Optional.of(inFlight);
    }
    synchronized (history) {
      return history.stream().filter(p -> p.payoutId().equals(payoutId)).findFirst();
    }
  }

  public PayoutStats stats() {
    final List<Payout> terminal;
    synchronized (history) {
      terminal = new ArrayList<>(history);
    }
    int completed = 0;
    int failed = 0;
    int simulated = 0;
    long totalPaid = 0;
    long winnerTotal = 0;
    long creatorTotal = 0;
    for (Payout payout : terminal) {
      switch (payout.status()) {
        case COMPLETED -> completed++;
        case FAILED -> failed++;
        case SIMULATED -> simulated++;
        default -> {
          // pending payouts never enter history
        }
      }
      if (payout.status().isSuccessful()) {
        totalPaid += payout.totalAmount();
        winnerTotal += payout.winnerAmount();
        creatorTotal += payout.creatorAmount();
      }
    }
    final int successful = completed + simulated;
    return new PayoutStats(
        terminal.size(),
        completed,
        failed,
        simulated,
        pending.size(),
        totalPaid,
        winnerTotal,
        creatorTotal,
        successful > 0 ? totalPaid / successful : 0L,
        terminal.isEmpty() ? 0.0d : (successful * 100.0d) / terminal.size());
  }

  public DisbursingBalanceReport validateDisbursingBalance() {
    final String address = disbursingAddress();
    final long minimum = properties.minimumDisbursingBalance();
    if (address == null || address.isBlank()) {
      return new DisbursingBalanceReport(
          false, null, 0L, minimum, "disbursing wallet is not configured");
    }
    try {
      final long balance = ledgerGateway.tokenBalance(address, properties.payoutMint());
      final boolean valid = balance >= minimum;
      if (!valid) {
        logger.warn(
            "disbursing balance below minimum address={} balance={} minimum={}",
            address,
            balance,
            minimum);
      }
      return new DisbursingBalanceReport(
          valid, address, balance, minimum, valid ? null : "balance below minimum");
    } catch (RuntimeException ex) {
      logger.warn("disbursing balance check failed address={}", address, ex);
      return new DisbursingBalanceReport(false, address, 0L, minimum, ex.getMessage());
    }
  }

  public boolean isSimulated() {
    return signer.isEmpty();
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    return properties.retryBaseDelay().multipliedBy(1L << Math.min(attempt - 1, 20));
  }

  private Payout execute(Payout payout) {
    final Lock lock = locks.get(payout.payoutId());
    lock.lock();
    MDC.put("payout_id", payout.payoutId());
    try {
      pending.put(payout.payoutId(), payout);
      Payout terminal;
      if (signer.isEmpty()) {
        terminal = payout.simulated(Instant.now(clock));
        logger.info(
            "payout simulated payoutId={} reference={}",
            terminal.payoutId(),
            terminal.settlementReference());
      } else {
        terminal = submit(payout, signer.get());
      }
      moveToHistory(terminal);
      return terminal;
    } finally {
      MDC.remove("payout_id");
      lock.unlock();
    }
  }

  private Payout submit(Payout payout, TransactionSigner transactionSigner) {
    final DisbursementPlan plan;
    try {
      plan = preparePlan(payout, transactionSigner.signerAddress());
    } catch (InsufficientFundsException ex) {
      logger.error(
          "payout rejected for insufficient funds payoutId={} available={} required={}",
          payout.payoutId(),
          ex.available(),
          ex.required());
      return payout.failed(truncateError(ex.getMessage()), Instant.now(clock));
    } catch (RuntimeException ex) {
      logger.error("payout preparation failed payoutId={}", payout.payoutId(), ex);
      return payout.failed(truncateError(ex.getMessage()), Instant.now(clock));
    }

    final int maxAttempts = properties.maxRetryAttempts();
    Payout current = payout;
    RuntimeException lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      current = current.withAttempts(attempt);
      pending.put(current.payoutId(), current);
      metrics.recordPayoutAttempt();
      try {
        final String blockhash = ledgerGateway.latestBlockhash();
        final String encoded = transactionSigner.sign(plan, blockhash);
        final String signature = ledgerGateway.submitTransaction(encoded);
        ledgerGateway.confirmTransaction(signature, properties.confirmTimeout());
        logger.info(
            "payout confirmed payoutId={} attempt={} signature={}",
            current.payoutId(),
            attempt,
            signature);
        return current.completed(signature, Instant.now(clock));
      } catch (RuntimeException ex) {
        lastError = ex;
        logger.warn(
            "payout attempt failed payoutId={} attempt={}/{} message={}",
            current.payoutId(),
            attempt,
            maxAttempts,
            ex.getMessage());
        if (attempt < maxAttempts && !pauseBeforeRetry(computeBackoffDuration(attempt))) {
          break;
        }
      }
    }
    logger.error(
        "payout failed payoutId={} attempts={}", current.payoutId(), current.attempts(), lastError);
    return current.failed(
        truncateError(lastError == null ? null : lastError.getMessage()), Instant.now(clock));
  }

  private DisbursementPlan preparePlan(Payout payout, String payer) {
    if (payout.creatorAmount() > 0 && !properties.hasCreatorWallet()) {
      throw new DrawConfigurationException("creator wallet is not configured");
    }
    final String mint = properties.payoutMint();
    final long balance = ledgerGateway.tokenBalance(payer, mint);
    if (balance < payout.totalAmount()) {
      throw new InsufficientFundsException(balance, payout.totalAmount());
    }
    final List<TransferInstruction> transfers = new ArrayList<>(2);
    if (payout.winnerAmount() > 0) {
      transfers.add(transfer(payout.winnerAddress(), payout.winnerAmount(), mint));
    }
    if (payout.creatorAmount() > 0) {
      transfers.add(transfer(properties.creatorWallet(), payout.creatorAmount(), mint));
    }
    return new DisbursementPlan(payout.payoutId(), payer, mint, transfers);
  }

  private TransferInstruction transfer(String recipient, long amount, String mint) {
    return new TransferInstruction(
        recipient, amount, !ledgerGateway.hasTokenAccount(recipient, mint));
  }

  private void moveToHistory(Payout terminal) {
    pending.remove(terminal.payoutId());
    synchronized (history) {
      history.addFirst(terminal);
      while (history.size() > properties.historySize()) {
        history.removeLast();
      }
    }
    metrics.recordPayoutResult(terminal.status().name().toLowerCase(Locale.ROOT));
    try {
      payoutRepository.save(terminal);
    } catch (RuntimeException ex) {
      logger.warn("payout persist failed payoutId={}", terminal.payoutId(), ex);
    }
  }

  private String disbursingAddress() {
    return signer.map(TransactionSigner::signerAddress).orElse(properties.disbursingWallet());
  }

  /** Returns false when interrupted. */
  private boolean pauseBeforeRetry(Duration backoff) {
    if (backoff.isZero() || backoff.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(backoff.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("payout retry interrupted", ex);
      return false;
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
