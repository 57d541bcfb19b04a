package com.tokendraw.engine.model;

public record PotGrowth(long previousPot, long growthAmount, long newPot) {

  public double growthPercentage() {
    if (previousPot <= 0) {
      return 0.0d;
    }
    return (growthAmount * 100.0d) / previousPot;
  }
}
