/*
 * どこで: Commitment サービス層
 * 何を: 期限切れコミットメントの解除と期限間近の警告送信を 1 回分実行する
 * なぜ: 期限処理を API 要求から切り離し、項目ごとに失敗を閉じ込めて進めるため
 */
package com.example.commitment.service;

import com.example.commitment.config.CommitmentSweeperProperties;
import com.example.commitment.model.CommitmentRecord;
import com.example.commitment.model.CommitmentStatus;
import com.example.commitment.repository.CommitmentRepository;
import com.example.commitment.service.notifier.CommitmentNotifier;
import com.example.commitment.service.notifier.CompletionNotice;
import com.example.commitment.service.notifier.ExpiryWarningNotice;
import com.example.commitment.service.provider.RestrictionProvider;
import com.example.common.TraceIds;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CommitmentExpirySweeper {

  private static final Logger logger = LoggerFactory.getLogger(CommitmentExpirySweeper.class);
  private static final String MDC_SWEEP_ID = "sweep_id";
  private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

  private final CommitmentRepository commitmentRepository;
  private final RestrictionProvider restrictionProvider;
  private final CommitmentNotifier notifier;
  private final ExternalCalls externalCalls;
  private final CommitmentMetrics metrics;
  private final CommitmentSweeperProperties properties;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicReference<Instant> lastRunAt = new AtomicReference<>();

  /**
   * Runs one sweep. Returns {@link SweepResult#skippedRun()} when another sweep is in progress.
   */
  public SweepResult sweep() {
    if (!running.compareAndSet(false, true)) {
      logger.debug("expiry sweep skipped, previous run still in progress");
      metrics.recordSweep("skipped");
      return SweepResult.skippedRun();
    }
    MDC.put(MDC_SWEEP_ID, TraceIds.newShortId());
    final long startedNanos = System.nanoTime();
    try {
      final Instant now = Instant.now(clock);
      final ExpiryCounts expiry = expireDue(now);
      final int warned = warnExpiring(now);
      final int reclaimed = reclaimStalePending(now);
      lastRunAt.set(now);
      metrics.recordSweep("completed");
      final SweepResult result =
          new SweepResult(false, expiry.expired(), expiry.failed(), warned, reclaimed);
      if (result.hasWork()) {
        logger.info(
            "expiry sweep completed expired={} failed={} warned={} reclaimed={}",
            result.expired(),
            result.failed(),
            result.warned(),
            result.reclaimed());
      }
      return result;
    } finally {
      metrics.recordSweepDuration(Duration.ofNanos(System.nanoTime() - startedNanos));
      MDC.remove(MDC_SWEEP_ID);
      running.set(false);
    }
  }

  public Optional<Instant> lastRunAt() {
    return Optional.ofNullable(lastRunAt.get());
  }

  public boolean isRunning() {
    return running.get();
  }

  private ExpiryCounts expireDue(Instant now) {
    final List<CommitmentRecord> due;
    try {
      due = commitmentRepository.findDueForExpiry(now);
    } catch (RuntimeException ex) {
      logger.error("expiry phase query failed", ex);
      return new ExpiryCounts(0, 0);
    }
    int expired = 0;
    int failed = 0;
    for (CommitmentRecord record : due) {
      final ExpiryOutcome outcome = expireOne(record, now);
      if (outcome == ExpiryOutcome.EXPIRED) {
        expired++;
      } else if (outcome == ExpiryOutcome.FAILED) {
        failed++;
      }
    }
    return new ExpiryCounts(expired, failed);
  }

  private ExpiryOutcome expireOne(CommitmentRecord record, Instant now) {
    final UUID commitmentId = record.commitmentId();
    if (record.hasEnforcementReference()) {
      final CallResult<Void> removal =
          externalCalls.run(
              CallSite.REMOVE_ON_EXPIRY,
              commitmentId,
              () ->
                  restrictionProvider.removeProfile(
                      record.providerDeviceId(), record.enforcementReference()));
      if (!removal.isSuccess()) {
        logger.warn(
            "enforcement removal needs manual cleanup commitmentId={} providerDeviceId={}"
                + " profileId={}",
            commitmentId,
            record.providerDeviceId(),
            record.enforcementReference());
      }
    }

    final int updated;
    try {
      updated =
          commitmentRepository.updateStatus(
              commitmentId, CommitmentStatus.ACTIVE, CommitmentStatus.EXPIRED, now);
    } catch (RuntimeException ex) {
      logger.error("commitment expiry update failed commitmentId={}", commitmentId, ex);
      markFailed(commitmentId, now);
      metrics.recordExpiry("failed");
      return ExpiryOutcome.FAILED;
    }
    if (updated == 0) {
      // 管理者による手動終了などで既に遷移済み
      logger.info("commitment already transitioned, skipping commitmentId={}", commitmentId);
      metrics.recordExpiry("skipped");
      return ExpiryOutcome.SKIPPED;
    }
    metrics.recordExpiry("expired");
    logger.info(
        "commitment expired commitmentId={} userId={} deviceId={}",
        commitmentId,
        record.userId(),
        record.deviceId());

    externalCalls.run(
        CallSite.NOTIFY_COMPLETION,
        commitmentId,
        () ->
            notifier.sendCompletion(
                new CompletionNotice(
                    commitmentId,
                    record.userId(),
                    record.deviceName(),
                    record.durationDays(),
                    record.commitmentStart(),
                    record.commitmentEnd())));
    return ExpiryOutcome.EXPIRED;
  }

  private void markFailed(UUID commitmentId, Instant now) {
    try {
      final int updated =
          commitmentRepository.updateStatus(
              commitmentId, CommitmentStatus.ACTIVE, CommitmentStatus.FAILED, now);
      if (updated > 0) {
        logger.warn("commitment marked failed commitmentId={}", commitmentId);
      }
    } catch (RuntimeException ex) {
      logger.error("commitment failed-mark update failed commitmentId={}", commitmentId, ex);
    }
  }

  private int warnExpiring(Instant now) {
    final List<CommitmentRecord> expiring;
    try {
      expiring =
          commitmentRepository.findDueForWarning(now, now.plus(properties.warningWindow()));
    } catch (RuntimeException ex) {
      logger.error("warning phase query failed", ex);
      return 0;
    }
    int warned = 0;
    for (CommitmentRecord record : expiring) {
      if (warnOne(record, now)) {
        warned++;
      }
    }
    return warned;
  }

  private boolean warnOne(CommitmentRecord record, Instant now) {
    final UUID commitmentId = record.commitmentId();
    final long hoursLeft = hoursRemaining(record.commitmentEnd(), now);
    final CallResult<Void> sent =
        externalCalls.run(
            CallSite.NOTIFY_WARNING,
            commitmentId,
            () ->
                notifier.sendExpiryWarning(
                    new ExpiryWarningNotice(
                        commitmentId,
                        record.userId(),
                        record.deviceName(),
                        record.commitmentEnd(),
                        hoursLeft)));
    if (!sent.isSuccess()) {
      metrics.recordWarning("failed");
      if (externalCalls.actionFor(CallSite.NOTIFY_WARNING) == FailureAction.RETRY_NEXT_SWEEP) {
        // 送信済みフラグを立てず、次回スイープで再送させる
        return false;
      }
    }
    try {
      commitmentRepository.markWarningSent(commitmentId, now);
    } catch (RuntimeException ex) {
      logger.error("warning flag update failed commitmentId={}", commitmentId, ex);
      return false;
    }
    if (!sent.isSuccess()) {
      return false;
    }
    metrics.recordWarning("sent");
    logger.info("expiry warning sent commitmentId={} hoursLeft={}", commitmentId, hoursLeft);
    return true;
  }

  private int reclaimStalePending(Instant now) {
    try {
      final List<UUID> reclaimed =
          commitmentRepository.failStalePending(now.minus(properties.pendingTimeout()), now);
      for (UUID commitmentId : reclaimed) {
        logger.warn(
            "stale pending commitment marked failed commitmentId={}, provider state needs review",
            commitmentId);
      }
      return reclaimed.size();
    } catch (RuntimeException ex) {
      logger.error("stale pending reclamation failed", ex);
      return 0;
    }
  }

  @VisibleForTesting
  static long hoursRemaining(Instant end, Instant now) {
    final long millis = Duration.between(now, end).toMillis();
    if (millis <= 0) {
      return 0;
    }
    return (millis + MILLIS_PER_HOUR - 1) / MILLIS_PER_HOUR;
  }

  private enum ExpiryOutcome {
    EXPIRED,
    SKIPPED,
    FAILED
  }

  private record ExpiryCounts(int expired, int failed) {}
}
