/*
 * どこで: Commitment サービス層
 * 何を: コミットメントの作成と利用者向け参照/緊急解除申請を扱う
 * なぜ: 検証 -> PENDING 挿入 -> プロバイダ適用 -> ACTIVE 化の順序を一箇所で保証するため
 */
package com.example.commitment.service;

import com.example.commitment.api.ApiErrorCode;
import com.example.commitment.api.CommitmentActivationException;
import com.example.commitment.api.CommitmentNotFoundException;
import com.example.commitment.api.CommitmentValidationException;
import com.example.commitment.api.response.ActiveCommitmentResponse;
import com.example.commitment.api.response.CommitmentHistoryResponse;
import com.example.commitment.api.response.CommitmentLimitsResponse;
import com.example.commitment.api.response.CommitmentResponse;
import com.example.commitment.api.response.EmergencyCancellationResponse;
import com.example.commitment.config.CommitmentEmergencyProperties;
import com.example.commitment.config.CommitmentPolicyProperties;
import com.example.commitment.model.CommitmentRecord;
import com.example.commitment.model.CommitmentStatus;
import com.example.commitment.model.DeviceRecord;
import com.example.commitment.model.EmergencyCancellationRecord;
import com.example.commitment.model.LockedSettings;
import com.example.commitment.repository.CommitmentRepository;
import com.example.commitment.repository.EmergencyCancellationRepository;
import com.example.commitment.service.CommitmentPolicy.TierLimits;
import com.example.commitment.service.client.DeviceRegistryClient;
import com.example.commitment.service.client.SubscriptionClient;
import com.example.commitment.service.provider.RestrictionProvider;
import com.example.commitment.service.provider.dto.ProviderDeviceStatus;
import com.example.commitment.service.provider.dto.RestrictionProfileDescriptor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CommitmentService {

  private static final Logger logger = LoggerFactory.getLogger(CommitmentService.class);
  private static final int MIN_EMERGENCY_REASON_LENGTH = 10;
  private static final int MAX_HISTORY_LIMIT = 100;
  private static final String EMERGENCY_STATUS = "PENDING_REVIEW";
  private static final String EMERGENCY_MESSAGE =
      "Emergency cancellation requests require manual review. Support has been notified.";

  private final CommitmentRepository commitmentRepository;
  private final EmergencyCancellationRepository emergencyCancellationRepository;
  private final CommitmentPolicy policy;
  private final CommitmentPolicyProperties policyProperties;
  private final CommitmentEmergencyProperties emergencyProperties;
  private final SubscriptionClient subscriptionClient;
  private final DeviceRegistryClient deviceRegistryClient;
  private final RestrictionProvider restrictionProvider;
  private final ExternalCalls externalCalls;
  private final CommitmentMetrics metrics;
  private final Clock clock;

  public CommitmentResponse create(
      String userId, String deviceId, Integer durationDays, Boolean confirmUnderstanding) {
    requireText(userId, "user_id");
    requireText(deviceId, "device_id");
    final CommitmentRecord pending;
    try {
      pending = validateAndInsertPending(userId, deviceId, durationDays, confirmUnderstanding);
    } catch (CommitmentValidationException ex) {
      metrics.recordCreate("rejected");
      logger.info(
          "commitment create rejected userId={} deviceId={} code={}",
          userId,
          deviceId,
          ex.code());
      throw ex;
    }
    final CommitmentRecord active = activate(pending);
    metrics.recordCreate("created");
    logger.info(
        "commitment created commitmentId={} userId={} deviceId={} durationDays={} end={}",
        active.commitmentId(),
        userId,
        deviceId,
        active.durationDays(),
        active.commitmentEnd());
    return CommitmentResponse.from(active);
  }

  public ActiveCommitmentResponse getActiveCommitment(String userId, String deviceId) {
    requireText(userId, "user_id");
    requireText(deviceId, "device_id");
    final CommitmentRecord record =
        commitmentRepository
            .findActiveByDevice(userId, deviceId)
            .orElseThrow(
                () -> new CommitmentNotFoundException("no active commitment for device"));
    final Instant now = Instant.now(clock);
    // 表示用の参考情報。取得失敗でも応答は返す
    final CallResult<ProviderDeviceStatus> status =
        externalCalls.call(
            CallSite.DEVICE_STATUS,
            record.commitmentId(),
            () -> restrictionProvider.getDeviceStatus(record.providerDeviceId()));
    ActiveCommitmentResponse.DeviceStatusView deviceStatus = null;
    if (status.isSuccess() && status.value() != null) {
      final ProviderDeviceStatus value = status.value();
      deviceStatus =
          new ActiveCommitmentResponse.DeviceStatusView(
              value.online(),
              value.compliant(),
              value.lastSeenAt() == null ? null : value.lastSeenAt().toString());
    }
    return new ActiveCommitmentResponse(
        CommitmentResponse.from(record), record.remaining(now).getSeconds(), deviceStatus);
  }

  public CommitmentLimitsResponse getLimits(String userId) {
    requireText(userId, "user_id");
    final TierLimits limits =
        subscriptionClient
            .getActivePlanType(userId)
            .map(policy::limitsForPlan)
            .orElseGet(policy::noSubscription);
    return new CommitmentLimitsResponse(
        limits.maxDays(), limits.tier(), limits.label(), limits.hasSubscription());
  }

  public CommitmentHistoryResponse listHistory(String userId, int page, int limit) {
    requireText(userId, "user_id");
    if (page < 1) {
      throw new CommitmentValidationException(ApiErrorCode.BAD_REQUEST, "page must be >= 1");
    }
    if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
      throw new CommitmentValidationException(
          ApiErrorCode.BAD_REQUEST, "limit must be between 1 and " + MAX_HISTORY_LIMIT);
    }
    final int offset;
    try {
      offset = Math.multiplyExact(page - 1, limit);
    } catch (ArithmeticException ex) {
      throw new CommitmentValidationException(ApiErrorCode.BAD_REQUEST, "page is too large");
    }
    final Instant now = Instant.now(clock);
    final List<CommitmentHistoryResponse.Item> items =
        commitmentRepository.findHistoryByUser(userId, limit, offset).stream()
            .map(record -> toHistoryItem(record, now))
            .toList();
    final long total = commitmentRepository.countHistoryByUser(userId);
    final long totalPages = (total + limit - 1) / limit;
    return new CommitmentHistoryResponse(items, page, limit, total, totalPages);
  }

  public EmergencyCancellationResponse requestEmergencyCancellation(
      String userId,
      String deviceId,
      String reason,
      Boolean confirmEmergency,
      String clientIp,
      String userAgent) {
    requireText(userId, "user_id");
    requireText(deviceId, "device_id");
    if (!Boolean.TRUE.equals(confirmEmergency)) {
      throw new CommitmentValidationException(
          ApiErrorCode.CONFIRMATION_REQUIRED, "must confirm this is a genuine emergency");
    }
    if (reason == null || reason.strip().length() < MIN_EMERGENCY_REASON_LENGTH) {
      throw new CommitmentValidationException(
          ApiErrorCode.BAD_REQUEST,
          "reason must be at least " + MIN_EMERGENCY_REASON_LENGTH + " characters");
    }
    final CommitmentRecord record =
        commitmentRepository
            .findActiveByDevice(userId, deviceId)
            .orElseThrow(
                () -> new CommitmentNotFoundException("no active commitment for device"));
    final Instant now = Instant.now(clock);
    final String ticketId = "EMG-" + record.commitmentId() + "-" + now.toEpochMilli();
    emergencyCancellationRepository.insert(
        new EmergencyCancellationRecord(
            UUID.randomUUID(),
            record.commitmentId(),
            userId,
            reason.strip(),
            clientIp,
            userAgent,
            ticketId,
            now));
    // 利用者からの早期解除はできない。記録してサポートの手動審査に回す
    logger.warn(
        "emergency cancellation requested commitmentId={} userId={} ticketId={}",
        record.commitmentId(),
        userId,
        ticketId);
    return new EmergencyCancellationResponse(
        ticketId, emergencyProperties.supportEmail(), EMERGENCY_STATUS, EMERGENCY_MESSAGE);
  }

  private CommitmentRecord validateAndInsertPending(
      String userId, String deviceId, Integer durationDays, Boolean confirmUnderstanding) {
    if (!Boolean.TRUE.equals(confirmUnderstanding)) {
      throw new CommitmentValidationException(
          ApiErrorCode.CONFIRMATION_REQUIRED,
          "must confirm understanding that the commitment cannot be cancelled early");
    }
    if (durationDays == null
        || durationDays < policyProperties.minDurationDays()
        || durationDays > policyProperties.maxDurationDays()) {
      throw new CommitmentValidationException(
          ApiErrorCode.BAD_REQUEST,
          "duration_days must be between "
              + policyProperties.minDurationDays()
              + " and "
              + policyProperties.maxDurationDays());
    }
    final Optional<String> planType = subscriptionClient.getActivePlanType(userId);
    if (planType.isEmpty()) {
      throw new CommitmentValidationException(
          ApiErrorCode.SUBSCRIPTION_REQUIRED, "active subscription required");
    }
    final TierLimits limits = policy.limitsForPlan(planType.get());
    if (!policy.isWithinLimit(durationDays, limits)) {
      throw new CommitmentValidationException(
          ApiErrorCode.POLICY_VIOLATION,
          "duration exceeds plan limit of " + limits.maxDays() + " days",
          Map.of("max_allowed", limits.maxDays(), "tier", limits.label()));
    }
    final DeviceRecord device =
        deviceRegistryClient
            .getDevice(deviceId, userId)
            .orElseThrow(
                () ->
                    new CommitmentValidationException(
                        ApiErrorCode.DEVICE_NOT_FOUND, "device not found"));
    if (!device.isEnrolled()) {
      throw new CommitmentValidationException(
          ApiErrorCode.DEVICE_NOT_ENROLLED,
          "device is not enrolled in device management",
          Map.of("action", "enroll_device"));
    }
    if (commitmentRepository.existsOpenForDevice(deviceId)) {
      throw activeCommitmentExists();
    }
    final Instant now = Instant.now(clock);
    final CommitmentRecord pending =
        new CommitmentRecord(
            UUID.randomUUID(),
            userId,
            deviceId,
            device.deviceName(),
            device.providerDeviceId(),
            limits.tier(),
            durationDays,
            now,
            now.plus(Duration.ofDays(durationDays)),
            CommitmentStatus.PENDING,
            null,
            false,
            LockedSettings.allLocked(),
            now,
            now);
    // 事前チェック後に並行作成された場合は部分ユニークインデックスで弾かれる
    return commitmentRepository.insertPending(pending).orElseThrow(this::activeCommitmentExists);
  }

  private CommitmentRecord activate(CommitmentRecord pending) {
    final RestrictionProfileDescriptor descriptor =
        RestrictionProfileDescriptor.forCommitment(
            pending.durationDays(), pending.commitmentEnd(), pending.lockedSettings());
    final CallResult<String> profile =
        externalCalls.call(
            CallSite.CREATE_PROFILE,
            pending.commitmentId(),
            () ->
                restrictionProvider.createRestrictionProfile(
                    pending.providerDeviceId(), descriptor));
    if (!profile.isSuccess()) {
      throw abort(pending, null, CallSite.CREATE_PROFILE, profile.errorKind());
    }
    final String enforcementReference = profile.value();
    final CallResult<String> deployment =
        externalCalls.call(
            CallSite.DEPLOY_PROFILE,
            pending.commitmentId(),
            () ->
                restrictionProvider.deployProfile(
                    pending.providerDeviceId(), enforcementReference));
    if (!deployment.isSuccess()) {
      throw abort(pending, enforcementReference, CallSite.DEPLOY_PROFILE, deployment.errorKind());
    }
    final Optional<CommitmentRecord> active;
    try {
      active =
          commitmentRepository.activate(
              pending.commitmentId(), enforcementReference, Instant.now(clock));
    } catch (RuntimeException ex) {
      logger.error(
          "commitment activation update failed commitmentId={}", pending.commitmentId(), ex);
      // 更新がコミット済みで応答だけ失われた場合は作成成功として扱う
      final Optional<CommitmentRecord> committed = findActive(pending.commitmentId());
      if (committed.isPresent()) {
        logger.warn(
            "commitment activation committed despite update error commitmentId={}",
            pending.commitmentId());
        return committed.get();
      }
      throw abort(pending, enforcementReference, null, ExternalErrorKind.UNEXPECTED);
    }
    if (active.isEmpty()) {
      logger.error(
          "commitment activation lost pending row commitmentId={}", pending.commitmentId());
      throw abort(pending, enforcementReference, null, ExternalErrorKind.UNEXPECTED);
    }
    return active.get();
  }

  private CommitmentActivationException abort(
      CommitmentRecord pending,
      String enforcementReference,
      CallSite failedSite,
      ExternalErrorKind kind) {
    if (failedSite != null
        && externalCalls.actionFor(failedSite) != FailureAction.ABORT_AND_ROLLBACK) {
      throw new IllegalStateException("call site does not abort creation: " + failedSite);
    }
    rollback(pending, enforcementReference);
    metrics.recordCreate("rolled_back");
    logger.warn(
        "commitment create rolled back commitmentId={} deviceId={} site={} kind={}",
        pending.commitmentId(),
        pending.deviceId(),
        failedSite,
        kind);
    return new CommitmentActivationException(kind, activationMessage(kind));
  }

  private void rollback(CommitmentRecord pending, String enforcementReference) {
    final UUID commitmentId = pending.commitmentId();
    final int deleted = deletePending(commitmentId);
    if (enforcementReference == null) {
      return;
    }
    if (deleted != 1 && !isSettledWithoutActive(commitmentId)) {
      // 行が ACTIVE か状態不明のときは制限を外さない。FAILED へ移った行は手動確認の対象
      logger.error(
          "commitment rollback kept enforcement commitmentId={} providerDeviceId={} profileId={}",
          commitmentId,
          pending.providerDeviceId(),
          enforcementReference);
      return;
    }
    externalCalls.run(
        CallSite.REMOVE_ON_ROLLBACK,
        commitmentId,
        () -> restrictionProvider.removeProfile(pending.providerDeviceId(), enforcementReference));
  }

  private int deletePending(UUID commitmentId) {
    try {
      return commitmentRepository.deletePending(commitmentId);
    } catch (RuntimeException ex) {
      // 残った PENDING 行はスイーパーが pending-timeout 経過後に FAILED へ移す
      logger.error("commitment pending row cleanup failed commitmentId={}", commitmentId, ex);
      return -1;
    }
  }

  // 行が消えているか終端状態なら true。読めないときは false
  private boolean isSettledWithoutActive(UUID commitmentId) {
    try {
      return commitmentRepository
          .findById(commitmentId)
          .map(record -> record.status().isTerminal())
          .orElse(true);
    } catch (RuntimeException ex) {
      logger.error("commitment state lookup failed commitmentId={}", commitmentId, ex);
      return false;
    }
  }

  private Optional<CommitmentRecord> findActive(UUID commitmentId) {
    try {
      return commitmentRepository
          .findById(commitmentId)
          .filter(record -> record.status() == CommitmentStatus.ACTIVE);
    } catch (RuntimeException ex) {
      logger.error("commitment state lookup failed commitmentId={}", commitmentId, ex);
      return Optional.empty();
    }
  }

  private String activationMessage(ExternalErrorKind kind) {
    if (kind.requiresReenrollment()) {
      return "device must be re-enrolled before starting a commitment";
    }
    if (kind.isRetryable()) {
      return "device management provider is temporarily unavailable, please retry";
    }
    return "failed to apply device restrictions";
  }

  private CommitmentValidationException activeCommitmentExists() {
    return new CommitmentValidationException(
        ApiErrorCode.ACTIVE_COMMITMENT_EXISTS, "device already has an active commitment");
  }

  private CommitmentHistoryResponse.Item toHistoryItem(CommitmentRecord record, Instant now) {
    // スイープ前でも終了時刻を過ぎた ACTIVE は EXPIRED として見せる
    final String status =
        record.status() == CommitmentStatus.ACTIVE && record.isDue(now)
            ? CommitmentStatus.EXPIRED.name()
            : record.status().name();
    return new CommitmentHistoryResponse.Item(
        record.commitmentId().toString(),
        record.deviceId(),
        record.deviceName(),
        record.durationDays(),
        record.commitmentStart().toString(),
        record.commitmentEnd().toString(),
        status,
        record.createdAt().toString());
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
