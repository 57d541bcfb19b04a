/*
 * Where: draw engine service layer
 * What: operator actions over the engine, holder tracker and payout pipeline
 * Why: manual recovery paths go through one place that logs who changed what
 */
package com.tokendraw.engine.service;

import com.tokendraw.engine.ledger.LedgerGateway;
import com.tokendraw.engine.model.AdminStatus;
import com.tokendraw.engine.model.HolderStats;
import com.tokendraw.engine.model.Payout;
import com.tokendraw.engine.model.Round;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DrawAdminService {

  private static final Logger logger = LoggerFactory.getLogger(DrawAdminService.class);

  private final GameEngine gameEngine;
  private final HolderTracker holderTracker;
  private final PayoutPipeline payoutPipeline;
  private final LedgerGateway ledgerGateway;

  public Round forceSpin() {
    logger.info("admin action=forceSpin");
    return gameEngine.forceSpin();
  }

  public void pause() {
    logger.info("admin action=pause");
    gameEngine.pause();
  }

  public void resume() {
    logger.info("admin action=resume");
    gameEngine.resume();
  }

  /** Retries a failed payout and settles its round when the retry succeeds. */
  public Payout retryPayout(String payoutId) {
    logger.info("admin action=retryPayout payoutId={}", payoutId);
    final Payout payout = payoutPipeline.retryFailedPayout(payoutId);
    gameEngine.recordPayoutRetry(payout);
    return payout;
  }

  public HolderStats forceHolderRescan() {
    logger.info("admin action=forceHolderRescan");
    return holderTracker.forceRescan();
  }

  public AdminStatus status() {
    return new AdminStatus(
        gameEngine.currentState(),
        holderTracker.stats(),
        payoutPipeline.stats(),
        ledgerGateway.checkConnection(),
        ledgerGateway.activeEndpoint());
  }
}
