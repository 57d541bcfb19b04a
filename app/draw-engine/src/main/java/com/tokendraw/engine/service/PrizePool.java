/*
 * Where: draw engine service layer
 * What: the current pot and its growth rules
 * Why: the pot only ever moves through growth or a one-directional funding raise
 */
package com.tokendraw.engine.service;

import com.tokendraw.engine.config.PotProperties;
import com.tokendraw.engine.model.PotGrowth;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalLong;
import org.springframework.stereotype.Component;

@Component
public class PrizePool {

  private final PotProperties properties;
  private long currentAmount;

  public PrizePool(PotProperties properties) {
    this.properties = properties;
    this.currentAmount = properties.baseAmount();
  }

  public synchronized long current() {
    return currentAmount;
  }

  public synchronized void restore(long amount) {
    currentAmount = Math.max(0, amount);
  }

  /** Raises the pot to {@code fundingAmount} if larger. Never lowers it. */
  public synchronized boolean raiseTo(long fundingAmount) {
    if (fundingAmount > currentAmount) {
      currentAmount = fundingAmount;
      return true;
    }
    return false;
  }

  public synchronized PotGrowth applyGrowth(OptionalLong fundingAmount) {
    final long previous = currentAmount;
    long next =
        grow(previous, properties.growthRate(), properties.maxGrowth(), properties.baseAmount());
    if (fundingAmount.isPresent() && fundingAmount.getAsLong() > next) {
      next = fundingAmount.getAsLong();
    }
    currentAmount = next;
    return new PotGrowth(previous, next - previous, next);
  }

  /** {@code max(pot + min(floor(pot * rate), maxGrowth), baseAmount)}. */
  public static long grow(long pot, double rate, long maxGrowth, long baseAmount) {
    final long growth =
        Math.min(
            BigDecimal.valueOf(pot)
                .multiply(BigDecimal.valueOf(rate))
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact(),
            maxGrowth);
    return Math.max(pot + growth, baseAmount);
  }

  public static long share(long amount, double percentage) {
    return BigDecimal.valueOf(amount)
        .multiply(BigDecimal.valueOf(percentage))
        .divide(BigDecimal.valueOf(100))
        .setScale(0, RoundingMode.FLOOR)
        .longValueExact();
  }
}
