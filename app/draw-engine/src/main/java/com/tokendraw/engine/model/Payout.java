/*
 * Where: draw engine domain model
 * What: one disbursement of a round's winner and creator shares
 * Why: attempts and the settlement reference are tracked per payout for manual retries
 */
package com.tokendraw.engine.model;

import java.time.Instant;

public record Payout(
    String payoutId,
    String roundId,
    String winnerAddress,
    long winnerAmount,
    long creatorAmount,
    PayoutStatus status,
    int attempts,
    String settlementReference,
    String errorMessage,
    Instant createdAt,
    Instant completedAt,
    Instant failedAt) {

  public static Payout pending(
      String payoutId,
      String roundId,
      String winnerAddress,
      long winnerAmount,
      long creatorAmount,
      Instant createdAt) {
    return new Payout(
        payoutId,
        roundId,
        winnerAddress,
        winnerAmount,
        creatorAmount,
        PayoutStatus.PENDING,
        0,
        null,
        null,
        createdAt,
        null,
        null);
  }

  public long totalAmount() {
    return winnerAmount + creatorAmount;
  }

  public Payout withAttempts(int attemptCount) {
    return new Payout(
        payoutId,
        roundId,
        winnerAddress,
        winnerAmount,
        creatorAmount,
        status,
        attemptCount,
        settlementReference,
        errorMessage,
        createdAt,
        completedAt,
        failedAt);
  }

  public Payout completed(String reference, Instant at) {
    return new Payout(
        payoutId,
        roundId,
        winnerAddress,
        winnerAmount,
        creatorAmount,
        PayoutStatus.COMPLETED,
        attempts,
        reference,
        null,
        createdAt,
        at,
        null);
  }

  public Payout simulated(Instant at) {
    return new Payout(
        payoutId,
        roundId,
        winnerAddress,
        winnerAmount,
        creatorAmount,
        PayoutStatus.SIMULATED,
        attempts,
        "simulated_" + payoutId,
        null,
        createdAt,
        at,
        null);
  }

  public Payout failed(String error, Instant at) {
    return new Payout(
        payoutId,
        roundId,
        winnerAddress,
        winnerAmount,
        creatorAmount,
        PayoutStatus.FAILED,
        attempts,
        null,
        error,
        createdAt,
        null,
        at);
  }

  public Payout resetForRetry() {
    return new Payout(
        payoutId,
        roundId,
        winnerAddress,
        winnerAmount,
        creatorAmount,
        PayoutStatus.PENDING,
        0,
        null,
        null,
        createdAt,
        null,
        null);
  }
}
