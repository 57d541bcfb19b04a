/*
 * Where: draw engine worker layer
 * What: named, cancellable and reschedulable timers on the shared task scheduler
 * Why: pause, resume and adaptive rescans each replace one timer by name
 */
package com.tokendraw.engine.worker;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class CycleScheduler {

  private static final Logger logger = LoggerFactory.getLogger(CycleScheduler.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "TaskScheduler is a shared Spring-managed component and cannot be copied")
  private final TaskScheduler taskScheduler;

  private final Clock clock;
  private final ConcurrentMap<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

  public CycleScheduler(TaskScheduler taskScheduler, Clock clock) {
    this.taskScheduler = taskScheduler;
    this.clock = clock;
  }

  /** Runs {@code task} once after {@code delay}, replacing any timer with the same name. */
  public void schedule(String name, Duration delay, Runnable task) {
    final Instant startAt = Instant.now(clock).plus(delay);
    replace(name, () -> taskScheduler.schedule(guarded(name, task), startAt));
  }

  /** Runs {@code task} every {@code period}, first after one period. */
  public void scheduleAtFixedRate(String name, Duration period, Runnable task) {
    final Instant startAt = Instant.now(clock).plus(period);
    replace(name, () -> taskScheduler.scheduleAtFixedRate(guarded(name, task), startAt, period));
  }

  public void cancel(String name) {
    final ScheduledFuture<?> future = timers.remove(name);
    if (future != null) {
      future.cancel(false);
      logger.debug("timer cancelled name={}", name);
    }
  }

  public void cancelAll() {
    timers.keySet().forEach(this::cancel);
  }

  public boolean isScheduled(String name) {
    final ScheduledFuture<?> future = timers.get(name);
    return future != null && !future.isDone();
  }

  /**
   * Cancels and registers under the map's per-key lock. A task that reschedules its own name
   * blocks until the outer registration is stored, so its new timer is never the one cancelled.
   */
  private void replace(String name, Supplier<ScheduledFuture<?>> submit) {
    timers.compute(
        name,
        (key, previous) -> {
          if (previous != null) {
            previous.cancel(false);
          }
          return submit.get();
        });
  }

  private Runnable guarded(String name, Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        logger.error("timer task failed name={}", name, ex);
      }
    };
  }
}
