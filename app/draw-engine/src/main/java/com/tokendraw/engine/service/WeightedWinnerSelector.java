/*
 * Where: draw engine service layer
 * What: balance-weighted winner selection driven by ledger entropy
 * Why: the same snapshot and blockhash must always produce the same winner
 */
package com.tokendraw.engine.service;

import com.tokendraw.engine.model.Holder;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

public final class WeightedWinnerSelector {

  static final int ENTROPY_BYTES = 16;

  private WeightedWinnerSelector() {}

  /** Folds the first 16 UTF-8 bytes of {@code source} big-endian into a non-negative integer. */
  public static BigInteger foldEntropy(String source) {
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("entropy source is required");
    }
    final byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
    final int length = Math.min(bytes.length, ENTROPY_BYTES);
    BigInteger value = BigInteger.ZERO;
    for (int i = 0; i < length; i++) {
      value = value.shiftLeft(8).add(BigInteger.valueOf(bytes[i] & 0xff));
    }
    return value;
  }

  /**
   * Picks a holder with probability proportional to its balance.
   *
   * <p>{@code r = entropy mod totalWeight}; walking holders in order, the first one at which the
   * remaining {@code r} drops to zero or below wins.
   */
  public static Optional<Holder> select(List<Holder> eligibleHolders, BigInteger entropy) {
    if (eligibleHolders.isEmpty()) {
      return Optional.empty();
    }
    if (entropy.signum() < 0) {
      throw new IllegalArgumentException("entropy must not be negative");
    }
    BigInteger totalWeight = BigInteger.ZERO;
    for (Holder holder : eligibleHolders) {
      totalWeight = totalWeight.add(BigInteger.valueOf(holder.balance()));
    }
    if (totalWeight.signum() == 0) {
      return Optional.of(eligibleHolders.get(0));
    }
    BigInteger remaining = entropy.mod(totalWeight);
    for (Holder holder : eligibleHolders) {
      remaining = remaining.subtract(BigInteger.valueOf(holder.balance()));
      if (remaining.signum() <= 0) {
        return Optional.of(holder);
      }
    }
    return Optional.of(eligibleHolders.get(0));
  }
}
