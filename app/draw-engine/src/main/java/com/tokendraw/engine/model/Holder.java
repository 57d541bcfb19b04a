/*
 * Where: draw engine domain model
 * What: one token holder as observed by the latest rescan
 * Why: eligibility and weight are derived once per scan and never mutated afterwards
 */
package com.tokendraw.engine.model;

import java.time.Instant;

public record Holder(
    String address,
    long balance,
    double percentageOfSupply,
    boolean eligible,
    Instant lastObservedAt) {

  public Holder {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("address is required");
    }
    if (balance < 0) {
      throw new IllegalArgumentException("balance must not be negative");
    }
  }

  public static Holder observed(
      String address, long balance, long totalSupply, long minimumHoldAmount, Instant observedAt) {
    final double percentage = totalSupply > 0 ? (balance * 100.0d) / totalSupply : 0.0d;
    return new Holder(address, balance, percentage, balance >= minimumHoldAmount, observedAt);
  }

  /** Shortened address for wheel labels, e.g. {@code AbCd...WxYz}. */
  public String displayName() {
    if (address.length() <= 8) {
      return address;
    }
    return address.substring(0, 4) + "..." + address.substring(address.length() - 4);
  }
}
