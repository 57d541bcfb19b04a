/*
 * Where: draw engine event boundary
 * What: fans draw events out to listeners on a dedicated executor
 * Why: a slow or failing listener must not stall the round cycle
 */
package com.tokendraw.engine.event;

import com.tokendraw.engine.service.DrawMetrics;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class DrawEventBus {

  private static final Logger logger = LoggerFactory.getLogger(DrawEventBus.class);

  private final List<DrawEventListener> listeners;
  private final Executor dispatchExecutor;
  private final DrawMetrics metrics;

  @Autowired
  public DrawEventBus(
      ObjectProvider<DrawEventListener> listeners,
      @Qualifier("drawEventExecutor") Executor dispatchExecutor,
      DrawMetrics metrics) {
    this(dispatchExecutor, metrics);
    listeners.orderedStream().forEach(this.listeners::add);
  }

  public DrawEventBus(Executor dispatchExecutor, DrawMetrics metrics) {
    this.listeners = new CopyOnWriteArrayList<>();
    this.dispatchExecutor = dispatchExecutor;
    this.metrics = metrics;
  }

  public void register(DrawEventListener listener) {
    listeners.add(listener);
  }

  public void unregister(DrawEventListener listener) {
    listeners.remove(listener);
  }

  public void publish(DrawEvent event) {
    try {
      dispatchExecutor.execute(() -> dispatch(event));
    } catch (RejectedExecutionException ex) {
      logger.warn("draw event dropped because dispatcher is shut down event={}", event.name());
    }
  }

  private void dispatch(DrawEvent event) {
    for (DrawEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException ex) {
        metrics.recordEventDeliveryFailure(event.name());
        logger.warn(
            "draw event listener failed event={} listener={}",
            event.name(),
            listener.getClass().getSimpleName(),
            ex);
      }
    }
  }
}
