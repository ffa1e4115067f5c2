/*
 * どこで: Commitment サービス層
 * 何を: プロバイダ/通知呼び出しを実行し、例外を CallResult へ畳み込む
 * なぜ: 失敗の扱いを呼び出し箇所ごとの FailurePolicy で一様に決めるため
 */
package com.example.commitment.service;

import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ExternalCalls {

  private static final Logger logger = LoggerFactory.getLogger(ExternalCalls.class);

  private final FailurePolicy failurePolicy;
  private final CommitmentMetrics metrics;

  public <T> CallResult<T> call(CallSite site, Object subject, Supplier<T> call) {
    try {
      return CallResult.success(call.get());
    } catch (ExternalCallException ex) {
      return failed(site, subject, ex.kind(), ex);
    } catch (RuntimeException ex) {
      return failed(site, subject, ExternalErrorKind.UNEXPECTED, ex);
    }
  }

  public CallResult<Void> run(CallSite site, Object subject, Runnable call) {
    return call(
        site,
        subject,
        () -> {
          call.run();
          return null;
        });
  }

  public FailureAction actionFor(CallSite site) {
    return failurePolicy.actionFor(site);
  }

  private <T> CallResult<T> failed(
      CallSite site, Object subject, ExternalErrorKind kind, RuntimeException ex) {
    metrics.recordExternalFailure(site, kind);
    final FailureAction action = failurePolicy.actionFor(site);
    if (kind == ExternalErrorKind.UNEXPECTED) {
      logger.error(
          "external call failed site={} subject={} kind={} action={}",
          site,
          subject,
          kind,
          action,
          ex);
    } else {
      logger.warn(
          "external call failed site={} subject={} kind={} action={} message={}",
          site,
          subject,
          kind,
          action,
          ex.getMessage());
    }
    return CallResult.failure(kind, ex.getMessage());
  }
}
