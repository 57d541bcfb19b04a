package com.tokendraw.engine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class DrawMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer holderScanTimer;
  private final Counter payoutAttemptCounter;
  private final Counter ledgerFailoverCounter;
  private final AtomicLong currentPot = new AtomicLong();
  private final AtomicLong totalHolders = new AtomicLong();
  private final AtomicLong eligibleHolders = new AtomicLong();
  private final ConcurrentMap<String, Counter> roundResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> payoutResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> ledgerRetryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> eventFailureCounters = new ConcurrentHashMap<>();

  public DrawMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.holderScanTimer =
        Timer.builder("draw.holders.scan.duration")
            .description("Duration of a full holder rescan")
            .register(meterRegistry);
    this.payoutAttemptCounter =
        Counter.builder("draw.payout.attempt.total")
            .description("Payout submission attempts")
            .register(meterRegistry);
    this.ledgerFailoverCounter =
        Counter.builder("draw.ledger.failover.total")
            .description("Switches to another ledger endpoint")
            .register(meterRegistry);
    Gauge.builder("draw.pot.current", currentPot, AtomicLong::get).register(meterRegistry);
    Gauge.builder("draw.holders.total", totalHolders, AtomicLong::get).register(meterRegistry);
    Gauge.builder("draw.holders.eligible", eligibleHolders, AtomicLong::get)
        .register(meterRegistry);
  }

  public void recordRoundResult(String result) {
    roundResultCounters.computeIfAbsent(result, this::registerRoundResultCounter).increment();
  }

  public void recordPayoutResult(String status) {
    payoutResultCounters.computeIfAbsent(status, this::registerPayoutResultCounter).increment();
  }

  public void recordPayoutAttempt() {
    payoutAttemptCounter.increment();
  }

  public void recordLedgerRetry(String operation) {
    ledgerRetryCounters.computeIfAbsent(operation, this::registerLedgerRetryCounter).increment();
  }

  public void recordLedgerFailover() {
    ledgerFailoverCounter.increment();
  }

  public void recordHolderScan(Duration duration, int holders, int eligible) {
    if (!duration.isNegative()) {
      holderScanTimer.record(duration);
    }
    totalHolders.set(Math.max(0, holders));
    eligibleHolders.set(Math.max(0, eligible));
  }

  public void updatePot(long amount) {
    currentPot.set(Math.max(0, amount));
  }

  public void recordEventDeliveryFailure(String eventName) {
    eventFailureCounters.computeIfAbsent(eventName, this::registerEventFailureCounter).increment();
  }

  private Counter registerRoundResultCounter(String result) {
    return Counter.builder("draw.round.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerPayoutResultCounter(String status) {
    return Counter.builder("draw.payout.total")
        .tags(Tags.of("status", status))
        .register(meterRegistry);
  }

  private Counter registerLedgerRetryCounter(String operation) {
    return Counter.builder("draw.ledger.retry.total")
        .tags(Tags.of("operation", operation))
        .register(meterRegistry);
  }

  private Counter registerEventFailureCounter(String eventName) {
    return Counter.builder("draw.event.delivery.error.total")
        .tags(Tags.of("event", eventName))
        .register(meterRegistry);
  }
}
