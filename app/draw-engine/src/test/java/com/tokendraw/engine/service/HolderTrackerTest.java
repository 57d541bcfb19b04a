/*
 * Where: Holder tracker tests
 * What: eligibility threshold, exclusions, rescan events and interval tiers
 * Why: holder scans feed winner selection, so a threshold drift changes who can win
 */
package com.tokendraw.engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tokendraw.engine.config.HolderTrackerProperties;
import com.tokendraw.engine.event.DrawEventBus;
import com.tokendraw.engine.event.DrawEventNames;
import com.tokendraw.engine.ledger.LedgerGateway;
import com.tokendraw.engine.ledger.LedgerIntegrationException;
import com.tokendraw.engine.model.Holder;
import com.tokendraw.engine.model.HolderShare;
import com.tokendraw.engine.model.HolderSnapshot;
import com.tokendraw.engine.model.TokenAccount;
import com.tokendraw.engine.repository.NoopDrawRepository;
import com.tokendraw.engine.support.RecordingListener;
import com.tokendraw.engine.worker.CycleScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HolderTrackerTest {

  private static final String MINT = "MintAddress1111111111111111111111111111111";
  private static final String BONDING_CURVE = "BondingCurve11111111111111111111111111111";

  private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
  private LedgerGateway ledgerGateway;
  private CycleScheduler scheduler;
  private RecordingListener listener;
  private HolderTracker tracker;

  @BeforeEach
  void setUp() {
    ledgerGateway = mock(LedgerGateway.class);
    scheduler = mock(CycleScheduler.class);
    listener = new RecordingListener();
    final DrawMetrics metrics = new DrawMetrics(new SimpleMeterRegistry());
    final DrawEventBus eventBus = new DrawEventBus(Runnable::run, metrics);
    eventBus.register(listener);
    final HolderTrackerProperties properties =
        new HolderTrackerProperties(
            MINT, 0.1d, List.of(BONDING_CURVE), null, null, null, null, null, null);
    tracker =
        new HolderTracker(
            ledgerGateway,
            properties,
            new NoopDrawRepository(),
            eventBus,
            metrics,
            scheduler,
            clock);
  }

  @Test
  void thresholdSeparatesEligibleFromIneligible() {
    stubLedger(1_000_000L, account("holderA", 999L), account("holderB", 1_000L));

    final HolderSnapshot snapshot = tracker.rescan();

    assertThat(snapshot.minimumHoldAmount()).isEqualTo(1_000L);
    assertThat(tracker.isEligible("holderA")).isFalse();
    assertThat(tracker.isEligible("holderB")).isTrue();
    assertThat(tracker.eligibleHolders()).extracting(Holder::address).containsExactly("holderB");
  }

  @Test
  void doublingSupplyDoublesThreshold() {
    assertThat(HolderTracker.minimumHoldAmount(1_000_000L, 0.1d)).isEqualTo(1_000L);
    assertThat(HolderTracker.minimumHoldAmount(2_000_000L, 0.1d)).isEqualTo(2_000L);
    assertThat(HolderTracker.minimumHoldAmount(1_000_000_000_000L, 0.25d))
        .isEqualTo(HolderTracker.minimumHoldAmount(500_000_000_000L, 0.25d) * 2);
  }

  @Test
  void aggregatesAccountsPerOwnerAndDropsExcluded() {
    stubLedger(
        1_000_000L,
        account("holderA", 600L),
        account("holderA", 600L),
        account("holderZero", 0L),
        account(BONDING_CURVE, 500_000L),
        account("11111111111111111111111111111111", 5_000L),
        account("1111111111111111111111111111111Xyz", 5_000L),
        account("1nc1nerator11111111111111111111111111111111", 5_000L));

    final HolderSnapshot snapshot = tracker.rescan();

    assertThat(snapshot.holders()).extracting(Holder::address).containsExactly("holderA");
    assertThat(tracker.holder("holderA")).get().extracting(Holder::balance).isEqualTo(1_200L);
    assertThat(tracker.isEligible("holderA")).isTrue();
  }

  @Test
  void failedRescanKeepsPreviousSnapshot() {
    stubLedger(1_000_000L, account("holderA", 5_000L));
    final HolderSnapshot first = tracker.rescan();
    when(ledgerGateway.tokenSupply(MINT))
        .thenThrow(
            new LedgerIntegrationException(LedgerIntegrationException.Reason.TIMEOUT, "timeout"));

    assertThatThrownBy(() -> tracker.rescan()).isInstanceOf(LedgerIntegrationException.class);
    assertThat(tracker.snapshot()).isSameAs(first);
  }

  @Test
  void publishesUpdateAndEligibilityChangeEvents() {
    stubLedger(1_000_000L, account("holderA", 5_000L), account("holderB", 3_000L));

    tracker.rescan();

    assertThat(listener.names())
        .containsExactly(
            DrawEventNames.HOLDER_UPDATE,
            DrawEventNames.ELIGIBILITY_CHANGE,
            DrawEventNames.NEW_HOLDER_ALERT);
    assertThat(listener.named(DrawEventNames.HOLDER_UPDATE).get(0).data())
        .containsEntry("eligibleHolders", 2)
        .containsEntry("minimumHoldAmount", 1_000L);
    assertThat(listener.named(DrawEventNames.ELIGIBILITY_CHANGE).get(0).data())
        .containsEntry("previousCount", 0)
        .containsEntry("newCount", 2);
  }

  @Test
  void unchangedPopulationPublishesOnlyHolderUpdate() {
    stubLedger(1_000_000L, account("holderA", 5_000L));
    tracker.rescan();
    final int before = listener.events().size();

    tracker.rescan();

    assertThat(listener.names().subList(before, listener.names().size()))
        .containsExactly(DrawEventNames.HOLDER_UPDATE);
  }

  @Test
  void rescanIntervalFollowsEligiblePopulation() {
    final List<TokenAccount> accounts = new ArrayList<>();
    for (int i = 0; i < 60; i++) {
      accounts.add(account("holder" + i, 10_000L));
    }
    when(ledgerGateway.tokenSupply(MINT)).thenReturn(1_000_000L);
    when(ledgerGateway.tokenHolders(MINT)).thenReturn(accounts);

    tracker.rescan();

    assertThat(tracker.currentRescanInterval()).isEqualTo(Duration.ofSeconds(15));
  }

  @Test
  void smallPopulationUsesFastInterval() {
    stubLedger(1_000_000L, account("holderA", 5_000L));

    tracker.rescan();

    assertThat(tracker.currentRescanInterval()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void selectWeightedRandomFailsWithoutEligibleHolders() {
    stubLedger(1_000_000L, account("holderA", 10L));
    tracker.rescan();

    assertThatThrownBy(() -> tracker.selectWeightedRandom(BigInteger.ONE))
        .isInstanceOf(NoEligibleHoldersException.class);
  }

  @Test
  void distributionSharesSumToHundredPercent() {
    stubLedger(1_000_000L, account("holderAlpha", 7_000L), account("holderBeta", 3_000L));
    tracker.rescan();

    final List<HolderShare> distribution = tracker.distribution();

    assertThat(distribution).extracting(HolderShare::percentage).containsExactly(70.0d, 30.0d);
    assertThat(distribution.get(0).displayName()).isEqualTo("hold...lpha");
  }

  @Test
  void topHoldersAreSortedByBalance() {
    stubLedger(
        1_000_000L, account("small", 2_000L), account("large", 9_000L), account("mid", 5_000L));
    tracker.rescan();

    assertThat(tracker.topHolders(2)).extracting(Holder::address).containsExactly("large", "mid");
  }

  @Test
  void startSchedulesImmediateRescanAndStopCancelsIt() {
    tracker.start();
    verify(scheduler).schedule(eq(HolderTracker.RESCAN_TIMER), eq(Duration.ZERO), any());
    assertThat(tracker.stats().tracking()).isTrue();

    tracker.stop();
    verify(scheduler).cancel(HolderTracker.RESCAN_TIMER);
    assertThat(tracker.stats().tracking()).isFalse();
  }

  private void stubLedger(long supply, TokenAccount... accounts) {
    when(ledgerGateway.tokenSupply(MINT)).thenReturn(supply);
    when(ledgerGateway.tokenHolders(MINT)).thenReturn(List.of(accounts));
  }

  private TokenAccount account(String owner, long amount) {
    return new TokenAccount("acct-" + owner + "-" + amount, owner, MINT, amount);
  }
}
