/*
 * Where: draw engine service layer
 * What: keeps the holder snapshot fresh with adaptive rescans and answers eligibility queries
 * Why: rounds read a consistent snapshot while the next scan is still running
 */
package com.tokendraw.engine.service;

import com.google.common.annotations.VisibleForTesting;
import com.tokendraw.engine.config.HolderTrackerProperties;
import com.tokendraw.engine.event.DrawEvent;
import com.tokendraw.engine.event.DrawEventBus;
import com.tokendraw.engine.event.DrawEventNames;
import com.tokendraw.engine.ledger.LedgerGateway;
import com.tokendraw.engine.model.Holder;
import com.tokendraw.engine.model.HolderShare;
import com.tokendraw.engine.model.HolderSnapshot;
import com.tokendraw.engine.model.HolderStats;
import com.tokendraw.engine.model.TokenAccount;
import com.tokendraw.engine.repository.HolderRepository;
import com.tokendraw.engine.worker.CycleScheduler;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HolderTracker {

  private static final Logger logger = LoggerFactory.getLogger(HolderTracker.class);

  static final String RESCAN_TIMER = "holder-rescan";

  private final LedgerGateway ledgerGateway;
  private final HolderTrackerProperties properties;
  private final HolderRepository holderRepository;
  private final DrawEventBus eventBus;
  private final DrawMetrics metrics;
  private final CycleScheduler scheduler;
  private final Clock clock;

  private final AtomicReference<HolderSnapshot> snapshot =
      new AtomicReference<>(HolderSnapshot.empty());
  private final ReentrantLock scanLock = new ReentrantLock();
  private volatile boolean tracking;
  private volatile Duration currentInterval;

  public void start() {
    restoreHolders();
    tracking = true;
    scheduler.schedule(RESCAN_TIMER, Duration.ZERO, this::runScheduledRescan);
    logger.info("holder tracking started mint={}", properties.tokenMint());
  }

  public void stop() {
    tracking = false;
    scheduler.cancel(RESCAN_TIMER);
    logger.info("holder tracking stopped");
  }

  /**
   * Reads supply and every token account, then swaps in a new snapshot.
   *
   * <p>On failure the previous snapshot stays in place and the error is rethrown.
   */
  public HolderSnapshot rescan() {
    scanLock.lock();
    try {
      final long started = System.nanoTime();
      final HolderSnapshot previous = snapshot.get();
      final String mint = properties.tokenMint();
      final long totalSupply = ledgerGateway.tokenSupply(mint);
      final long minimumHold = minimumHoldAmount(totalSupply, properties.minimumHoldPercentage());
      final List<TokenAccount> accounts = ledgerGateway.tokenHolders(mint);
      final Instant observedAt = Instant.now(clock);

      final Map<String, Long> balances = new LinkedHashMap<>();
      for (TokenAccount account : accounts) {
        if (account.amount() <= 0 || properties.isExcluded(account.owner())) {
          continue;
        }
        balances.merge(account.owner(), account.amount(), Math::addExact);
      }
      final List<Holder> holders =
          balances.entrySet().stream()
              .map(
                  entry ->
                      Holder.observed(
                          entry.getKey(), entry.getValue(), totalSupply, minimumHold, observedAt))
              .toList();
      final Duration scanDuration = Duration.ofNanos(System.nanoTime() - started);
      final HolderSnapshot next =
          new HolderSnapshot(holders, totalSupply, minimumHold, observedAt, scanDuration);
      snapshot.set(next);
      currentInterval = properties.intervalFor(next.eligibleCount());

      persist(holders);
      metrics.recordHolderScan(scanDuration, next.holderCount(), next.eligibleCount());
      logger.info(
          "holder scan completed durationMs={} holders={} eligible={} minimumHold={} nextIntervalMs={}",
          scanDuration.toMillis(),
          next.holderCount(),
          next.eligibleCount(),
          minimumHold,
          currentInterval.toMillis());
      publishScanEvents(previous, next);
      return next;
    } finally {
      scanLock.unlock();
    }
  }

  public HolderStats forceRescan() {
    logger.info("forced holder rescan requested");
    rescan();
    if (tracking) {
      scheduler.schedule(RESCAN_TIMER, currentRescanInterval(), this::runScheduledRescan);
    }
    return stats();
  }

  public HolderSnapshot snapshot() {
    return snapshot.get();
  }

  public Holder selectWeightedRandom(BigInteger entropy) {
    return selectWeightedRandom(snapshot.get(), entropy);
  }

  public Holder selectWeightedRandom(HolderSnapshot source, BigInteger entropy) {
    return WeightedWinnerSelector.select(source.eligibleHolders(), entropy)
        .orElseThrow(NoEligibleHoldersException::new);
  }

  public List<Holder> topHolders(int limit) {
    return snapshot.get().holders().stream()
        .sorted(Comparator.comparingLong(Holder::balance).reversed())
        .limit(Math.max(0, limit))
        .toList();
  }

  public boolean isEligible(String address) {
    return snapshot.get().holder(address).map(Holder::eligible).orElse(false);
  }

  public Optional<Holder> holder(String address) {
    return snapshot.get().holder(address);
  }

  public List<Holder> eligibleHolders() {
    return snapshot.get().eligibleHolders();
  }

  /** Share of the eligible weight per holder, in selection order. */
  public List<HolderShare> distribution() {
    return distribution(snapshot.get());
  }

  public HolderStats stats() {
    final HolderSnapshot current = snapshot.get();
    return new HolderStats(
        current.holderCount(),
        current.eligibleCount(),
        current.totalSupply(),
        current.minimumHoldAmount(),
        properties.minimumHoldPercentage(),
        current.scannedAt(),
        tracking,
        currentRescanInterval(),
        topHolders(properties.topHoldersLimit()));
  }

  public Duration currentRescanInterval() {
    final Duration interval = currentInterval;
    return interval != null ? interval : properties.intervalFor(snapshot.get().eligibleCount());
  }

  @VisibleForTesting
  static long minimumHoldAmount(long totalSupply, double percentage) {
    return BigDecimal.valueOf(totalSupply)
        .multiply(BigDecimal.valueOf(percentage))
        .divide(BigDecimal.valueOf(100))
        .setScale(0, RoundingMode.FLOOR)
        .longValueExact();
  }

  static List<HolderShare> distribution(HolderSnapshot source) {
    final List<Holder> eligible = source.eligibleHolders();
    final long totalWeight = eligible.stream().mapToLong(Holder::balance).sum();
    return eligible.stream()
        .map(
            holder ->
                new HolderShare(
                    holder.address(),
                    holder.displayName(),
                    holder.balance(),
                    totalWeight > 0 ? (holder.balance() * 100.0d) / totalWeight : 0.0d))
        .toList();
  }

  private void runScheduledRescan() {
    try {
      rescan();
    } catch (RuntimeException ex) {
      logger.warn("holder rescan failed; keeping previous snapshot", ex);
    } finally {
      if (tracking) {
        scheduler.schedule(RESCAN_TIMER, currentRescanInterval(), this::runScheduledRescan);
      }
    }
  }

  private void restoreHolders() {
    try {
      final List<Holder> stored = holderRepository.findAll();
      if (!stored.isEmpty()) {
        snapshot.compareAndSet(
            HolderSnapshot.empty(), new HolderSnapshot(stored, 0L, 0L, null, Duration.ZERO));
        logger.info("restored holders from storage count={}", stored.size());
      }
    } catch (RuntimeException ex) {
      logger.warn("holder restore failed; starting with an empty snapshot", ex);
    }
  }

  private void persist(List<Holder> holders) {
    for (Holder holder : holders) {
      try {
        holderRepository.upsert(holder);
      } catch (RuntimeException ex) {
        logger.warn("holder persist failed address={}", holder.address(), ex);
      }
    }
  }

  private void publishScanEvents(HolderSnapshot previous, HolderSnapshot next) {
    final Instant now = Instant.now(clock);
    final Map<String, Object> update = new LinkedHashMap<>();
    update.put("totalHolders", next.holderCount());
    update.put("eligibleHolders", next.eligibleCount());
    update.put("minimumHoldAmount", next.minimumHoldAmount());
    update.put("minimumHoldPercentage", properties.minimumHoldPercentage());
    update.put("totalSupply", next.totalSupply());
    update.put("topHolders", topHolders(properties.topHoldersLimit()));
    update.put("scanTimeMs", next.scanDuration().toMillis());
    eventBus.publish(new DrawEvent(DrawEventNames.HOLDER_UPDATE, null, null, null, now, update));

    if (previous.eligibleCount() != next.eligibleCount()) {
      eventBus.publish(
          new DrawEvent(
              DrawEventNames.ELIGIBILITY_CHANGE,
              null,
              null,
              null,
              now,
              Map.of(
                  "previousCount", previous.eligibleCount(),
                  "newCount", next.eligibleCount(),
                  "change", next.eligibleCount() - previous.eligibleCount())));
    }
    if (next.holderCount() > previous.holderCount()
        && next.holderCount() < properties.smallPopulation()) {
      eventBus.publish(
          new DrawEvent(
              DrawEventNames.NEW_HOLDER_ALERT,
              null,
              null,
              null,
              now,
              Map.of(
                  "newHolders", next.holderCount() - previous.holderCount(),
                  "totalHolders", next.holderCount())));
    }
  }
}
