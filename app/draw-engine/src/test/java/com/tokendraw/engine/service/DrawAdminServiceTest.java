package com.tokendraw.engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tokendraw.engine.ledger.LedgerGateway;
import com.tokendraw.engine.model.AdminStatus;
import com.tokendraw.engine.model.EngineState;
import com.tokendraw.engine.model.EngineStatus;
import com.tokendraw.engine.model.HolderStats;
import com.tokendraw.engine.model.Payout;
import com.tokendraw.engine.model.PayoutStats;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DrawAdminServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private GameEngine gameEngine;
  private HolderTracker holderTracker;
  private PayoutPipeline payoutPipeline;
  private LedgerGateway ledgerGateway;
  private DrawAdminService service;

  @BeforeEach
  void setUp() {
    gameEngine = mock(GameEngine.class);
    holderTracker = mock(HolderTracker.class);
    payoutPipeline = mock(PayoutPipeline.class);
    ledgerGateway = mock(LedgerGateway.class);
    service = new DrawAdminService(gameEngine, holderTracker, payoutPipeline, ledgerGateway);
  }

  @Test
  void retryPayoutSettlesRoundWithRetriedPayout() {
    final Payout retried =
        Payout.pending("payout_1", "round_1", "winner", 600L, 400L, NOW).simulated(NOW);
    when(payoutPipeline.retryFailedPayout("payout_1")).thenReturn(retried);
    when(gameEngine.recordPayoutRetry(retried)).thenReturn(Optional.empty());

    assertThat(service.retryPayout("payout_1")).isSameAs(retried);
    verify(gameEngine).recordPayoutRetry(retried);
  }

  @Test
  void retryPayoutPropagatesMissingPayout() {
    when(payoutPipeline.retryFailedPayout("payout_x"))
        .thenThrow(new PayoutNotFoundException("payout_x"));

    assertThatThrownBy(() -> service.retryPayout("payout_x"))
        .isInstanceOf(PayoutNotFoundException.class);
    verify(gameEngine, never()).recordPayoutRetry(any());
  }

  @Test
  void pauseRejectionIsPropagated() {
    doThrow(new InvalidEngineStateException("pause", EngineState.SPINNING))
        .when(gameEngine)
        .pause();

    assertThatThrownBy(service::pause).isInstanceOf(InvalidEngineStateException.class);
  }

  @Test
  void statusAggregatesEveryComponent() {
    final EngineStatus engineStatus =
        new EngineStatus(
            EngineState.WAITING,
            true,
            10_000_000L,
            NOW.plusSeconds(300),
            Duration.ofMinutes(5),
            null,
            List.of());
    final HolderStats holderStats =
        new HolderStats(3, 2, 1_000L, 1L, 0.1d, NOW, true, Duration.ofSeconds(5), List.of());
    final PayoutStats payoutStats = new PayoutStats(0, 0, 0, 0, 0, 0L, 0L, 0L, 0L, 0.0d);
    when(gameEngine.currentState()).thenReturn(engineStatus);
    when(holderTracker.stats()).thenReturn(holderStats);
    when(payoutPipeline.stats()).thenReturn(payoutStats);
    when(ledgerGateway.checkConnection()).thenReturn(true);
    when(ledgerGateway.activeEndpoint()).thenReturn("http://rpc.test");

    final AdminStatus status = service.status();

    assertThat(status.engine()).isSameAs(engineStatus);
    assertThat(status.holders()).isSameAs(holderStats);
    assertThat(status.payouts()).isSameAs(payoutStats);
    assertThat(status.ledgerHealthy()).isTrue();
    assertThat(status.ledgerEndpoint()).isEqualTo("http://rpc.test");
  }
}
