package com.tokendraw.engine.worker;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tokendraw.engine.service.GameEngine;
import com.tokendraw.engine.service.HolderTracker;
import com.tokendraw.engine.service.PayoutPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class DrawLifecycleTest {

  private HolderTracker holderTracker;
  private GameEngine gameEngine;
  private PayoutPipeline payoutPipeline;
  private CycleScheduler scheduler;
  private DrawLifecycle lifecycle;

  @BeforeEach
  void setUp() {
    holderTracker = mock(HolderTracker.class);
    gameEngine = mock(GameEngine.class);
    payoutPipeline = mock(PayoutPipeline.class);
    scheduler = mock(CycleScheduler.class);
    lifecycle = new DrawLifecycle(holderTracker, gameEngine, payoutPipeline, scheduler);
  }

  @Test
  void readyChecksBalanceRestoresPayoutsThenStartsTrackerBeforeEngine() {
    when(payoutPipeline.isSimulated()).thenReturn(false);

    lifecycle.onReady();

    final InOrder order = inOrder(payoutPipeline, holderTracker, gameEngine);
    order.verify(payoutPipeline).validateDisbursingBalance();
    order.verify(payoutPipeline).restoreHistory();
    order.verify(holderTracker).start();
    order.verify(gameEngine).start();
  }

  @Test
  void simulatedModeSkipsBalanceCheck() {
    when(payoutPipeline.isSimulated()).thenReturn(true);

    lifecycle.onReady();

    verify(payoutPipeline, never()).validateDisbursingBalance();
    verify(gameEngine).start();
  }

  @Test
  void shutdownStopsEverything() {
    lifecycle.onShutdown();

    verify(gameEngine).stop();
    verify(holderTracker).stop();
    verify(scheduler).cancelAll();
  }
}
