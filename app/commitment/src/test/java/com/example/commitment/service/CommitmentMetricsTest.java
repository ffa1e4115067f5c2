package com.example.commitment.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CommitmentMetricsTest {

  @Test
  void countersAreTaggedByResult() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CommitmentMetrics metrics = new CommitmentMetrics(registry);

    metrics.recordCreate("created");
    metrics.recordCreate("created");
    metrics.recordCreate("rolled_back");
    metrics.recordSweep("skipped");
    metrics.recordExpiry("expired");
    metrics.recordWarning("sent");

    assertThat(registry.get("commitment.create.total").tag("result", "created").counter().count())
        .isEqualTo(2.0d);
    assertThat(
            registry.get("commitment.create.total").tag("result", "rolled_back").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("commitment.sweep.total").tag("result", "skipped").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("commitment.expiry.total").tag("result", "expired").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("commitment.warning.total").tag("result", "sent").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void sweepDurationIgnoresNegativeValues() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CommitmentMetrics metrics = new CommitmentMetrics(registry);

    metrics.recordSweepDuration(Duration.ofMillis(250));
    metrics.recordSweepDuration(Duration.ofMillis(-1));

    assertThat(registry.get("commitment.sweep.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("commitment.sweep.duration").timer().totalTime(TimeUnit.MILLISECONDS))
        .isEqualTo(250.0d);
  }

  @Test
  void externalFailureUsesLowercaseTags() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CommitmentMetrics metrics = new CommitmentMetrics(registry);

    metrics.recordExternalFailure(CallSite.REMOVE_ON_EXPIRY, ExternalErrorKind.UNAVAILABLE);

    assertThat(
            registry
                .get("commitment.external.failure.total")
                .tag("site", "remove_on_expiry")
                .tag("kind", "unavailable")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }
}
