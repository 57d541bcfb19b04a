package com.tokendraw.engine.service;

import java.time.Duration;
import java.time.Instant;

/** Epoch-aligned spin times. */
public final class SpinSchedule {

  private SpinSchedule() {}

  /**
   * Next multiple of {@code interval} since the epoch at or after {@code now}, pushed one interval
   * further when it would start within {@code guard}.
   */
  public static Instant nextSpinTime(Instant now, Duration interval, Duration guard) {
    final long intervalMillis = interval.toMillis();
    if (intervalMillis <= 0) {
      throw new IllegalArgumentException("interval must be positive");
    }
    final long nowMillis = now.toEpochMilli();
    long next = -Math.floorDiv(-nowMillis, intervalMillis) * intervalMillis;
    if (next - nowMillis < guard.toMillis()) {
      next += intervalMillis;
    }
    return Instant.ofEpochMilli(next);
  }
}
