package com.example.commitment.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.commitment.service.provider.ProviderIntegrationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExternalCallsTest {

  private SimpleMeterRegistry registry;
  private ExternalCalls externalCalls;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    externalCalls = new ExternalCalls(new FailurePolicy(), new CommitmentMetrics(registry));
  }

  @Test
  void successReturnsValue() {
    final CallResult<String> result =
        externalCalls.call(CallSite.CREATE_PROFILE, "c-1", () -> "profile-1");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo("profile-1");
    assertThat(registry.find("commitment.external.failure.total").counters()).isEmpty();
  }

  @Test
  void classifiedFailureKeepsItsKindAndIsCounted() {
    final CallResult<Void> result =
        externalCalls.run(
            CallSite.DEPLOY_PROFILE,
            "c-1",
            () -> {
              throw new ProviderIntegrationException(ExternalErrorKind.TIMEOUT, "read timeout");
            });

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.errorKind()).isEqualTo(ExternalErrorKind.TIMEOUT);
    assertThat(result.errorKind().isRetryable()).isTrue();
    assertThat(
            registry
                .get("commitment.external.failure.total")
                .tag("site", "deploy_profile")
                .tag("kind", "timeout")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void unclassifiedFailureBecomesUnexpected() {
    final CallResult<String> result =
        externalCalls.call(
            CallSite.NOTIFY_WARNING,
            "c-1",
            () -> {
              throw new IllegalStateException("boom");
            });

    assertThat(result.errorKind()).isEqualTo(ExternalErrorKind.UNEXPECTED);
    assertThat(result.errorMessage()).isEqualTo("boom");
    assertThat(result.value()).isNull();
  }

  @Test
  void actionForDelegatesToFailurePolicy() {
    assertThat(externalCalls.actionFor(CallSite.NOTIFY_WARNING))
        .isEqualTo(FailureAction.RETRY_NEXT_SWEEP);
  }
}
