package com.example.commitment.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class CommitmentMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer sweepDurationTimer;
  private final ConcurrentMap<String, Counter> createCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sweepCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> expiryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> warningCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> externalFailureCounters = new ConcurrentHashMap<>();

  public CommitmentMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.sweepDurationTimer =
        Timer.builder("commitment.sweep.duration")
            .description("Time spent in one expiry sweep")
            .register(meterRegistry);
  }

  public void recordCreate(String result) {
    createCounters
        .computeIfAbsent(result, key -> register("commitment.create.total", "result", key))
        .increment();
  }

  public void recordSweep(String result) {
    sweepCounters
        .computeIfAbsent(result, key -> register("commitment.sweep.total", "result", key))
        .increment();
  }

  public void recordSweepDuration(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    sweepDurationTimer.record(duration);
  }

  public void recordExpiry(String result) {
    expiryCounters
        .computeIfAbsent(result, key -> register("commitment.expiry.total", "result", key))
        .increment();
  }

  public void recordWarning(String result) {
    warningCounters
        .computeIfAbsent(result, key -> register("commitment.warning.total", "result", key))
        .increment();
  }

  public void recordExternalFailure(CallSite site, ExternalErrorKind kind) {
    final String key = site.name() + "|" + kind.name();
    externalFailureCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder("commitment.external.failure.total")
                    .tags(
                        Tags.of(
                            "site",
                            site.name().toLowerCase(Locale.ROOT),
                            "kind",
                            kind.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
  }

  private Counter register(String name, String tagKey, String tagValue) {
    return Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry);
  }
}
