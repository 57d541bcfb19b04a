/*
 * Where: draw engine domain model
 * What: immutable result of one holder rescan
 * Why: readers hold one reference and never see a mix of old and new balances
 */
package com.tokendraw.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class HolderSnapshot {

  private static final HolderSnapshot EMPTY =
      new HolderSnapshot(List.of(), 0L, 0L, null, Duration.ZERO);

  private final Map<String, Holder> holdersByAddress;
  private final List<Holder> holders;
  private final List<Holder> eligibleHolders;
  private final long totalSupply;
  private final long minimumHoldAmount;
  private final Instant scannedAt;
  private final Duration scanDuration;

  public HolderSnapshot(
      List<Holder> holders,
      long totalSupply,
      long minimumHoldAmount,
      Instant scannedAt,
      Duration scanDuration) {
    final Map<String, Holder> byAddress = new LinkedHashMap<>();
    for (Holder holder : holders) {
      byAddress.put(holder.address(), holder);
    }
    this.holdersByAddress = Collections.unmodifiableMap(byAddress);
    this.holders = List.copyOf(byAddress.values());
    this.eligibleHolders = this.holders.stream().filter(Holder::eligible).toList();
    this.totalSupply = totalSupply;
    this.minimumHoldAmount = minimumHoldAmount;
    this.scannedAt = scannedAt;
    this.scanDuration = scanDuration == null ? Duration.ZERO : scanDuration;
  }

  public static HolderSnapshot empty() {
    return EMPTY;
  }

  /** Holders in snapshot (insertion) order. */
  public List<Holder> holders() {
    return holders;
  }

  /** Eligible holders in the same stable order used for weighted selection. */
  public List<Holder> eligibleHolders() {
    return eligibleHolders;
  }

  public Optional<Holder> holder(String address) {
    return Optional.ofNullable(holdersByAddress.get(address));
  }

  public int holderCount() {
    return holders.size();
  }

  public int eligibleCount() {
    return eligibleHolders.size();
  }

  public long totalSupply() {
    return totalSupply;
  }

  public long minimumHoldAmount() {
    return minimumHoldAmount;
  }

  public Instant scannedAt() {
    return scannedAt;
  }

  public Duration scanDuration() {
    return scanDuration;
  }
}
