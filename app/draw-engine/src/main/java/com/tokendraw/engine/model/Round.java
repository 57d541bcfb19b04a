/*
 * Where: draw engine domain model
 * What: one draw round from spin start to payout result
 * Why: each transition returns a new value so history entries never change under readers
 */
package com.tokendraw.engine.model;

import java.time.Instant;

public record Round(
    String roundId,
    String traceId,
    Instant startTime,
    long potAmountAtStart,
    int eligibleHolderCountAtStart,
    Holder winner,
    long winnerPayout,
    long creatorPayout,
    String payoutId,
    String settlementReference,
    RoundStatus status,
    String errorMessage,
    Instant endTime) {

  public static Round start(
      String roundId, String traceId, Instant startTime, long potAmount, int eligibleHolders) {
    return new Round(
        roundId,
        traceId,
        startTime,
        potAmount,
        eligibleHolders,
        null,
        0L,
        0L,
        null,
        null,
        RoundStatus.SPINNING,
        null,
        null);
  }

  public Round winnerSelected(Holder selected) {
    return new Round(
        roundId,
        traceId,
        startTime,
        potAmountAtStart,
        eligibleHolderCountAtStart,
        selected,
        winnerPayout,
        creatorPayout,
        payoutId,
        settlementReference,
        RoundStatus.WINNER_SELECTED,
        errorMessage,
        endTime);
  }

  public Round processingPayout(long winnerAmount, long creatorAmount) {
    return new Round(
        roundId,
        traceId,
        startTime,
        potAmountAtStart,
        eligibleHolderCountAtStart,
        winner,
        winnerAmount,
        creatorAmount,
        payoutId,
        settlementReference,
        RoundStatus.PROCESSING_PAYOUT,
        errorMessage,
        endTime);
  }

  public Round completed(Payout payout, Instant completedAt) {
    return new Round(
        roundId,
        traceId,
        startTime,
        potAmountAtStart,
        eligibleHolderCountAtStart,
        winner,
        winnerPayout,
        creatorPayout,
        payout.payoutId(),
        payout.settlementReference(),
        RoundStatus.COMPLETED,
        null,
        completedAt);
  }

  public Round payoutFailed(Payout payout, Instant failedAt) {
    return new Round(
        roundId,
        traceId,
        startTime,
        potAmountAtStart,
        eligibleHolderCountAtStart,
        winner,
        winnerPayout,
        creatorPayout,
        payout.payoutId(),
        null,
        RoundStatus.FAILED,
        payout.errorMessage(),
        failedAt);
  }

  public Round failed(String error, Instant failedAt) {
    return new Round(
        roundId,
        traceId,
        startTime,
        potAmountAtStart,
        eligibleHolderCountAtStart,
        winner,
        winnerPayout,
        creatorPayout,
        payoutId,
        settlementReference,
        RoundStatus.FAILED,
        error,
        failedAt);
  }

  /** A failed round whose payout later succeeded through a manual retry. */
  public Round settledByRetry(Payout payout, Instant settledAt) {
    return completed(payout, settledAt);
  }
}
