/*
 * Where: draw engine worker layer
 * What: starts holder tracking and the round cycle once the application is ready
 * Why: timers must not fire before every bean, including the event relay, is wired
 */
package com.tokendraw.engine.worker;

import com.tokendraw.engine.service.GameEngine;
import com.tokendraw.engine.service.HolderTracker;
import com.tokendraw.engine.service.PayoutPipeline;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "draw.engine.enabled", havingValue = "true", matchIfMissing = true)
public class DrawLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(DrawLifecycle.class);

  private final HolderTracker holderTracker;
  private final GameEngine gameEngine;
  private final PayoutPipeline payoutPipeline;
  private final CycleScheduler scheduler;

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    if (!payoutPipeline.isSimulated()) {
      payoutPipeline.validateDisbursingBalance();
    }
    payoutPipeline.restoreHistory();
    holderTracker.start();
    gameEngine.start();
    logger.info("draw engine ready simulatedPayouts={}", payoutPipeline.isSimulated());
  }

  @EventListener(ContextClosedEvent.class)
  public void onShutdown() {
    gameEngine.stop();
    holderTracker.stop();
    scheduler.cancelAll();
  }
}
