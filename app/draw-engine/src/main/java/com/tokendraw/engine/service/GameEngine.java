/*
 * Where: draw engine service layer
 * What: drives the round cycle from countdown through winner selection to payout
 * Why: a single lock-guarded state field keeps exactly one round in flight
 */
package com.tokendraw.engine.service;

import com.tokendraw.common.TraceIds;
import com.tokendraw.engine.config.DrawEngineProperties;
import com.tokendraw.engine.config.PotProperties;
import com.tokendraw.engine.event.DrawEvent;
import com.tokendraw.engine.event.DrawEventBus;
import com.tokendraw.engine.event.DrawEventNames;
import com.tokendraw.engine.ledger.LedgerGateway;
import com.tokendraw.engine.model.EngineState;
import com.tokendraw.engine.model.EngineStats;
import com.tokendraw.engine.model.EngineStatus;
import com.tokendraw.engine.model.Holder;
import com.tokendraw.engine.model.HolderSnapshot;
import com.tokendraw.engine.model.Payout;
import com.tokendraw.engine.model.PayoutStatus;
import com.tokendraw.engine.model.PotGrowth;
import com.tokendraw.engine.model.Round;
import com.tokendraw.engine.model.RoundStatus;
import com.tokendraw.engine.repository.PrizePoolRepository;
import com.tokendraw.engine.repository.RoundRepository;
import com.tokendraw.engine.worker.CycleScheduler;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GameEngine {

  private static final Logger logger = LoggerFactory.getLogger(GameEngine.class);

  static final String TICK_TIMER = "engine-tick";
  static final String POT_TIMER = "pot-refresh";
  static final String ROUND_TIMER = "round-stage";

  private static final int STATUS_RECENT_ROUNDS = 5;

  private final LedgerGateway ledgerGateway;
  private final HolderTracker holderTracker;
  private final PayoutPipeline payoutPipeline;
  private final PrizePool prizePool;
  private final DrawEngineProperties properties;
  private final PotProperties potProperties;
  private final RoundRepository roundRepository;
  private final PrizePoolRepository prizePoolRepository;
  private final DrawEventBus eventBus;
  private final DrawMetrics metrics;
  private final CycleScheduler scheduler;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final List<Round> history = new ArrayList<>();
  private EngineState state = EngineState.WAITING;
  private Instant nextSpinTime;
  private Round currentRound;
  private boolean running;

  public void start() {
    restoreState();
    lock.lock();
    try {
      running = true;
      state = EngineState.WAITING;
      nextSpinTime = computeNextSpinTime();
    } finally {
      lock.unlock();
    }
    scheduleTimers();
    try {
      refreshPot();
    } catch (RuntimeException ex) {
      logger.warn("initial pot refresh failed", ex);
    }
    metrics.updatePot(prizePool.current());
    logger.info(
        "game engine started spinInterval={} nextSpinTime={} pot={}",
        properties.spinInterval(),
        nextSpinTime,
        prizePool.current());
    publishState(EngineState.WAITING, null);
  }

  public void stop() {
    lock.lock();
    try {
      running = false;
    } finally {
      lock.unlock();
    }
    scheduler.cancel(TICK_TIMER);
    scheduler.cancel(POT_TIMER);
    scheduler.cancel(ROUND_TIMER);
    logger.info("game engine stopped");
  }

  /** Starts a round once the spin time is reached; otherwise publishes the countdown. */
  public void tick() {
    final PendingSpin spin;
    lock.lock();
    try {
      if (!running || state != EngineState.WAITING) {
        return;
      }
      final Instant now = Instant.now(clock);
      spin = now.isBefore(nextSpinTime) ? null : beginRoundLocked(now);
    } finally {
      lock.unlock();
    }
    if (spin == null) {
      publishCountdown();
      return;
    }
    publishState(EngineState.SPINNING, spin.round());
    scheduler.schedule(ROUND_TIMER, Duration.ZERO, () -> runSpinStage(spin));
  }

  /**
   * Starts a round immediately.
   *
   * @throws InvalidEngineStateException unless the engine is waiting
   */
  public Round forceSpin() {
    final PendingSpin spin;
    lock.lock();
    try {
      if (state != EngineState.WAITING) {
        throw new InvalidEngineStateException("forceSpin", state);
      }
      spin = beginRoundLocked(Instant.now(clock));
    } finally {
      lock.unlock();
    }
    logger.info("forced spin roundId={}", spin.round().roundId());
    publishState(EngineState.SPINNING, spin.round());
    runSpinStage(spin);
    return spin.round();
  }

  public void pause() {
    lock.lock();
    try {
      if (state != EngineState.WAITING) {
        throw new InvalidEngineStateException("pause", state);
      }
      state = EngineState.PAUSED;
    } finally {
      lock.unlock();
    }
    scheduler.cancel(TICK_TIMER);
    scheduler.cancel(POT_TIMER);
    logger.info("game engine paused");
    publishState(EngineState.PAUSED, null);
  }

  public void resume() {
    lock.lock();
    try {
      if (state != EngineState.PAUSED) {
        throw new InvalidEngineStateException("resume", state);
      }
      state = EngineState.WAITING;
      nextSpinTime = computeNextSpinTime();
    } finally {
      lock.unlock();
    }
    scheduleTimers();
    logger.info("game engine resumed nextSpinTime={}", nextSpinTime);
    publishState(EngineState.WAITING, null);
  }

  /** Raises the pot to the funding source amount when that is larger. */
  public long refreshPot() {
    final OptionalLong funding = readFundingAmount();
    if (funding.isEmpty()) {
      return prizePool.current();
    }
    final boolean raised = prizePool.raiseTo(funding.getAsLong());
    final long current = prizePool.current();
    metrics.updatePot(current);
    if (raised) {
      savePot(current);
      logger.info("pot raised to funding amount pot={}", current);
    }
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("amount", current);
    data.put("fundingAmount", funding.getAsLong());
    data.put("raised", raised);
    publish(DrawEventNames.POT_UPDATE, null, data);
    return current;
  }

  /** Settles the round whose payout succeeded through a manual retry. */
  public Optional<Round> recordPayoutRetry(Payout payout) {
    if (!payout.status().isSuccessful()) {
      return Optional.empty();
    }
    Round settled = null;
    lock.lock();
    try {
      for (int i = 0; i < history.size(); i++) {
        final Round round = history.get(i);
        if (payout.payoutId().equals(round.payoutId())) {
          settled = round.settledByRetry(payout, Instant.now(clock));
          history.set(i, settled);
          break;
        }
      }
    } finally {
      lock.unlock();
    }
    if (settled == null) {
      logger.warn("no round found for retried payout payoutId={}", payout.payoutId());
      return Optional.empty();
    }
    saveRound(settled);
    logger.info(
        "round settled by payout retry roundId={} payoutId={}",
        settled.roundId(),
        payout.payoutId());
    publish(DrawEventNames.PAYOUT_COMPLETED, settled, payoutData(settled, payout, true));
    return Optional.of(settled);
  }

  public EngineStatus currentState() {
    lock.lock();
    try {
      return new EngineStatus(
          state,
          running,
          prizePool.current(),
          nextSpinTime,
          properties.spinInterval(),
          currentRound,
          List.copyOf(history.subList(0, Math.min(STATUS_RECENT_ROUNDS, history.size()))));
    } finally {
      lock.unlock();
    }
  }

  public List<Round> recentRounds(int limit) {
    lock.lock();
    try {
      return List.copyOf(history.subList(0, Math.min(Math.max(0, limit), history.size())));
    } finally {
      lock.unlock();
    }
  }

  public EngineStats stats() {
    final List<Round> rounds;
    final EngineState currentState;
    lock.lock();
    try {
      rounds = List.copyOf(history);
      currentState = state;
    } finally {
      lock.unlock();
    }
    int completed = 0;
    int failed = 0;
    long winnerTotal = 0;
    long potTotal = 0;
    for (Round round : rounds) {
      potTotal += round.potAmountAtStart();
      if (round.status() == RoundStatus.COMPLETED) {
        completed++;
        winnerTotal += round.winnerPayout();
      } else if (round.status() == RoundStatus.FAILED) {
        failed++;
      }
    }
    return new EngineStats(
        rounds.size(),
        completed,
        failed,
        winnerTotal,
        rounds.isEmpty() ? 0L : potTotal / rounds.size(),
        prizePool.current(),
        currentState);
  }

  public EngineState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  private PendingSpin beginRoundLocked(Instant now) {
    final HolderSnapshot holders = holderTracker.snapshot();
    final Round round =
        Round.start(
            TraceIds.newPrefixedId("round", clock),
            TraceIds.newTraceId(),
            now,
            prizePool.current(),
            holders.eligibleCount());
    state = EngineState.SPINNING;
    currentRound = round;
    return new PendingSpin(round, holders);
  }

  private void runSpinStage(PendingSpin spin) {
    final Round round = spin.round();
    putMdc(round);
    try {
      final Map<String, Object> data = new LinkedHashMap<>();
      data.put("potAmount", round.potAmountAtStart());
      data.put("eligibleHolders", round.eligibleHolderCountAtStart());
      data.put("distribution", HolderTracker.distribution(spin.holders()));
      publish(DrawEventNames.SPIN_START, round, data);

      if (spin.holders().eligibleCount() == 0) {
        throw new NoEligibleHoldersException();
      }
      final BigInteger entropy = WeightedWinnerSelector.foldEntropy(ledgerGateway.latestBlockhash());
      final Holder winner = holderTracker.selectWeightedRandom(spin.holders(), entropy);
      final Round selected = round.winnerSelected(winner);
      transition(EngineState.WINNER_SELECTED, selected);
      saveRound(selected);
      logger.info(
          "winner selected roundId={} winner={} balance={} pot={}",
          selected.roundId(),
          winner.address(),
          winner.balance(),
          selected.potAmountAtStart());
      schedulePayoutStage(selected);
    } catch (NoEligibleHoldersException ex) {
      logger.warn("no eligible holders; skipping round roundId={}", round.roundId());
      metrics.recordRoundResult("skipped");
      returnToWaiting();
    } catch (RuntimeException ex) {
      logger.error("spin failed roundId={}", round.roundId(), ex);
      recordFinished(round.failed(truncateError(ex.getMessage()), Instant.now(clock)), "failed");
      returnToWaiting();
    } finally {
      clearMdc();
    }
  }

  private void schedulePayoutStage(Round selected) {
    final Duration delay = properties.presentationDelay();
    if (delay.isZero() || delay.isNegative()) {
      runPayoutStage(selected);
      return;
    }
    scheduler.schedule(ROUND_TIMER, delay, () -> runPayoutStage(selected));
  }

  private void runPayoutStage(Round selected) {
    putMdc(selected);
    Round processing = selected;
    try {
      final long pot = selected.potAmountAtStart();
      final long winnerPayout = share(pot, properties.winnerPercentage());
      final long creatorPayout = share(pot, properties.creatorPercentage());
      processing = selected.processingPayout(winnerPayout, creatorPayout);
      transition(EngineState.PROCESSING_PAYOUT, processing);
      publish(DrawEventNames.WINNER_SELECTED, processing, winnerData(processing));

      final Payout payout =
          payoutPipeline.disburse(
              processing.roundId(), processing.winner().address(), winnerPayout, creatorPayout);
      if (payout.status().isSuccessful()) {
        final Round completed = processing.completed(payout, Instant.now(clock));
        transition(EngineState.COMPLETED, completed);
        recordFinished(completed, "completed");
        logger.info(
            "round completed roundId={} payoutId={} reference={}",
            completed.roundId(),
            payout.payoutId(),
            payout.settlementReference());
        publish(DrawEventNames.PAYOUT_COMPLETED, completed, payoutData(completed, payout, false));
        applyPotGrowth();
      } else {
        final Round failed = processing.payoutFailed(payout, Instant.now(clock));
        recordFinished(failed, "failed");
        logger.error(
            "round payout failed roundId={} payoutId={} error={}",
            failed.roundId(),
            payout.payoutId(),
            payout.errorMessage());
        publish(DrawEventNames.PAYOUT_FAILED, failed, failureData(failed));
      }
    } catch (RuntimeException ex) {
      logger.error("payout stage failed roundId={}", selected.roundId(), ex);
      final Round failed = processing.failed(truncateError(ex.getMessage()), Instant.now(clock));
      recordFinished(failed, "failed");
      publish(DrawEventNames.PAYOUT_FAILED, failed, failureData(failed));
    } finally {
      returnToWaiting();
      clearMdc();
    }
  }

  private void applyPotGrowth() {
    final PotGrowth growth = prizePool.applyGrowth(readFundingAmount());
    savePot(growth.newPot());
    metrics.updatePot(growth.newPot());
    logger.info(
        "pot grown previous={} growth={} newPot={}",
        growth.previousPot(),
        growth.growthAmount(),
        growth.newPot());
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("previousPot", growth.previousPot());
    data.put("newPot", growth.newPot());
    data.put("growthAmount", growth.growthAmount());
    data.put("growthPercentage", growth.growthPercentage());
    publish(DrawEventNames.POT_GROWTH_UPDATE, null, data);
  }

  private OptionalLong readFundingAmount() {
    if (!potProperties.fundingEnabled()) {
      return OptionalLong.empty();
    }
    try {
      final long balance =
          ledgerGateway.tokenBalance(potProperties.fundingWallet(), potProperties.fundingMint());
      return OptionalLong.of(
          BigDecimal.valueOf(balance)
              .multiply(BigDecimal.valueOf(potProperties.fundingShare()))
              .setScale(0, RoundingMode.FLOOR)
              .longValueExact());
    } catch (RuntimeException ex) {
      logger.warn("funding balance read failed wallet={}", potProperties.fundingWallet(), ex);
      return OptionalLong.empty();
    }
  }

  private void transition(EngineState next, Round round) {
    lock.lock();
    try {
      state = next;
      currentRound = round;
    } finally {
      lock.unlock();
    }
    publishState(next, round);
  }

  private void returnToWaiting() {
    lock.lock();
    try {
      state = EngineState.WAITING;
      currentRound = null;
      nextSpinTime = computeNextSpinTime();
    } finally {
      lock.unlock();
    }
    publishState(EngineState.WAITING, null);
    publishCountdown();
  }

  private void recordFinished(Round round, String result) {
    lock.lock();
    try {
      currentRound = round;
      history.add(0, round);
      while (history.size() > properties.historySize()) {
        history.remove(history.size() - 1);
      }
    } finally {
      lock.unlock();
    }
    metrics.recordRoundResult(result);
    saveRound(round);
  }

  private void scheduleTimers() {
    scheduler.scheduleAtFixedRate(TICK_TIMER, properties.tickInterval(), this::tick);
    scheduler.scheduleAtFixedRate(POT_TIMER, properties.potRefreshInterval(), this::refreshPot);
  }

  private void restoreState() {
    try {
      prizePoolRepository.loadCurrentAmount().ifPresent(prizePool::restore);
      final List<Round> stored = roundRepository.findRecentRounds(properties.historySize());
      lock.lock();
      try {
        history.clear();
        history.addAll(stored);
      } finally {
        lock.unlock();
      }
      logger.info("engine state restored pot={} rounds={}", prizePool.current(), stored.size());
    } catch (RuntimeException ex) {
      logger.warn("engine state restore failed; starting fresh", ex);
    }
  }

  private void saveRound(Round round) {
    try {
      roundRepository.save(round);
    } catch (RuntimeException ex) {
      logger.warn("round persist failed roundId={}", round.roundId(), ex);
    }
  }

  private void savePot(long amount) {
    try {
      prizePoolRepository.saveCurrentAmount(amount, Instant.now(clock));
    } catch (RuntimeException ex) {
      logger.warn("pot persist failed amount={}", amount, ex);
    }
  }

  private Instant computeNextSpinTime() {
    return SpinSchedule.nextSpinTime(
        Instant.now(clock), properties.spinInterval(), properties.spinGuard());
  }

  private void publishCountdown() {
    final Instant next;
    lock.lock();
    try {
      next = nextSpinTime;
    } finally {
      lock.unlock();
    }
    if (next == null) {
      return;
    }
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("nextSpinTime", next.toString());
    data.put(
        "secondsRemaining", Math.max(0L, Duration.between(Instant.now(clock), next).toSeconds()));
    data.put("currentPot", prizePool.current());
    data.put("eligibleHolders", holderTracker.snapshot().eligibleCount());
    publish(DrawEventNames.COUNTDOWN, null, data);
  }

  private void publishState(EngineState engineState, Round round) {
    publish(
        DrawEventNames.ENGINE_STATE_CHANGED, round, Map.of("state", engineState.name()), engineState);
  }

  private void publish(String name, Round round, Map<String, Object> data) {
    publish(name, round, data, state());
  }

  private void publish(String name, Round round, Map<String, Object> data, EngineState engineState) {
    eventBus.publish(
        new DrawEvent(
            name,
            round == null ? null : round.roundId(),
            round == null ? null : round.traceId(),
            engineState,
            Instant.now(clock),
            data));
  }

  private Map<String, Object> winnerData(Round round) {
    final Holder winner = round.winner();
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("winner", winner.address());
    data.put("displayName", winner.displayName());
    data.put("balance", winner.balance());
    data.put("percentageOfSupply", winner.percentageOfSupply());
    data.put("potAmount", round.potAmountAtStart());
    data.put("winnerPayout", round.winnerPayout());
    data.put("creatorPayout", round.creatorPayout());
    return data;
  }

  private Map<String, Object> payoutData(Round round, Payout payout, boolean retried) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("payoutId", payout.payoutId());
    data.put("settlementReference", payout.settlementReference());
    data.put("winner", payout.winnerAddress());
    data.put("winnerPayout", round.winnerPayout());
    data.put("creatorPayout", round.creatorPayout());
    data.put("simulated", payout.status() == PayoutStatus.SIMULATED);
    data.put("retried", retried);
    return data;
  }

  private Map<String, Object> failureData(Round round) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("payoutId", round.payoutId());
    data.put("winner", round.winner() == null ? null : round.winner().address());
    data.put("error", round.errorMessage());
    return data;
  }

  private long share(long pot, double percentage) {
    return PrizePool.share(pot, percentage);
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private void putMdc(Round round) {
    MDC.put("trace_id", round.traceId());
    MDC.put("round_id", round.roundId());
  }

  private void clearMdc() {
    MDC.remove("trace_id");
    MDC.remove("round_id");
  }

  private record PendingSpin(Round round, HolderSnapshot holders) {}
}
