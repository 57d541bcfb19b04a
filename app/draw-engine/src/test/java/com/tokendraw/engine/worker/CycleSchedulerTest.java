package com.tokendraw.engine.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class CycleSchedulerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private TaskScheduler taskScheduler;
  private CycleScheduler scheduler;

  @BeforeEach
  void setUp() {
    taskScheduler = mock(TaskScheduler.class);
    scheduler = new CycleScheduler(taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void scheduleRunsOnceAfterDelay() {
    final ScheduledFuture<?> future = mock(ScheduledFuture.class);
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

    scheduler.schedule("round-stage", Duration.ofSeconds(4), () -> {});

    verify(taskScheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(4)));
    assertThat(scheduler.isScheduled("round-stage")).isTrue();
  }

  @Test
  void fixedRateStartsAfterOnePeriod() {
    final ScheduledFuture<?> future = mock(ScheduledFuture.class);
    doReturn(future)
        .when(taskScheduler)
        .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

    scheduler.scheduleAtFixedRate("engine-tick", Duration.ofMinutes(1), () -> {});

    verify(taskScheduler)
        .scheduleAtFixedRate(any(Runnable.class), eq(NOW.plusSeconds(60)), eq(Duration.ofMinutes(1)));
  }

  @Test
  void reschedulingByNameCancelsPreviousTimer() {
    final ScheduledFuture<?> first = mock(ScheduledFuture.class);
    final ScheduledFuture<?> second = mock(ScheduledFuture.class);
    doReturn(first, second).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

    scheduler.schedule("holder-rescan", Duration.ofSeconds(5), () -> {});
    scheduler.schedule("holder-rescan", Duration.ofSeconds(15), () -> {});

    verify(first).cancel(false);
    verify(second, never()).cancel(false);
  }

  @Test
  void cancelStopsTimerAndForgetsIt() {
    final ScheduledFuture<?> future = mock(ScheduledFuture.class);
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    scheduler.schedule("pot-refresh", Duration.ofSeconds(10), () -> {});

    scheduler.cancel("pot-refresh");

    verify(future).cancel(false);
    assertThat(scheduler.isScheduled("pot-refresh")).isFalse();
  }

  @Test
  void finishedTimerIsNotScheduled() {
    final ScheduledFuture<?> future = mock(ScheduledFuture.class);
    when(future.isDone()).thenReturn(true);
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

    scheduler.schedule("round-stage", Duration.ZERO, () -> {});

    assertThat(scheduler.isScheduled("round-stage")).isFalse();
  }

  @Test
  void failingTaskDoesNotEscapeTimer() {
    final ScheduledFuture<?> future = mock(ScheduledFuture.class);
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    scheduler.schedule(
        "round-stage",
        Duration.ZERO,
        () -> {
          throw new IllegalStateException("stage failed");
        });

    final ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(taskScheduler).schedule(task.capture(), any(Instant.class));

    assertThatCode(() -> task.getValue().run()).doesNotThrowAnyException();
  }

  @Test
  void selfReschedulingTaskSurvivesSlowOuterRegistration() throws InterruptedException {
    final Thread caller = Thread.currentThread();
    final ThreadPoolTaskScheduler pool =
        new ThreadPoolTaskScheduler() {
          @Override
          public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
            final ScheduledFuture<?> future = super.schedule(task, startTime);
            if (Thread.currentThread() == caller) {
              // the first run starts before this registration returns
              try {
                Thread.sleep(200);
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
              }
            }
            return future;
          }
        };
    pool.setPoolSize(2);
    pool.initialize();
    try {
      final CycleScheduler realScheduler = new CycleScheduler(pool, Clock.systemUTC());
      final AtomicInteger runs = new AtomicInteger();
      final CountDownLatch done = new CountDownLatch(3);
      final Runnable[] rescan = new Runnable[1];
      rescan[0] =
          () -> {
            done.countDown();
            if (runs.incrementAndGet() < 3) {
              realScheduler.schedule("holder-rescan", Duration.ofMillis(50), rescan[0]);
            }
          };

      realScheduler.schedule("holder-rescan", Duration.ZERO, rescan[0]);

      assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(runs).hasValue(3);
    } finally {
      pool.shutdown();
    }
  }
}
