package com.example.commitment.service;

import com.example.commitment.api.ApiErrorCode;
import com.example.commitment.api.CommitmentNotFoundException;
import com.example.commitment.api.CommitmentStateConflictException;
import com.example.commitment.api.CommitmentValidationException;
import com.example.commitment.api.response.ManualTerminateResponse;
import com.example.commitment.model.CommitmentAuditRecord;
import com.example.commitment.model.CommitmentRecord;
import com.example.commitment.model.CommitmentStatus;
import com.example.commitment.repository.CommitmentAuditRepository;
import com.example.commitment.repository.CommitmentRepository;
import com.example.commitment.service.notifier.CommitmentNotifier;
import com.example.commitment.service.notifier.CompletionNotice;
import com.example.commitment.service.provider.RestrictionProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class CommitmentAdminService {

  private static final Logger logger = LoggerFactory.getLogger(CommitmentAdminService.class);
  private static final String ACTION_MANUAL_TERMINATE = "MANUAL_TERMINATE";

  private final CommitmentRepository commitmentRepository;
  private final CommitmentAuditRepository auditRepository;
  private final RestrictionProvider restrictionProvider;
  private final CommitmentNotifier notifier;
  private final ExternalCalls externalCalls;
  private final PlatformTransactionManager transactionManager;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ManualTerminateResponse manualTerminate(
      UUID commitmentId, String actorUserId, String reason) {
    if (actorUserId == null || actorUserId.isBlank()) {
      throw new IllegalArgumentException("actor_user_id is required");
    }
    if (reason == null || reason.isBlank()) {
      throw new CommitmentValidationException(ApiErrorCode.BAD_REQUEST, "reason is required");
    }
    final CommitmentRecord record =
        commitmentRepository
            .findById(commitmentId)
            .orElseThrow(() -> new CommitmentNotFoundException("commitment not found"));
    if (record.status() != CommitmentStatus.ACTIVE) {
      throw new CommitmentStateConflictException(
          "commitment is not active: " + record.status().name());
    }

    final String providerCleanup = removeEnforcement(record);
    final Instant now = Instant.now(clock);
    final String detailJson = createDetailJson(record, providerCleanup);

    // 状態遷移と監査記録は同じトランザクションで確定させる
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean updated =
        transactionTemplate.execute(
            status -> {
              final int rows =
                  commitmentRepository.updateStatus(
                      commitmentId,
                      CommitmentStatus.ACTIVE,
                      CommitmentStatus.MANUALLY_EXPIRED,
                      now);
              if (rows == 0) {
                return false;
              }
              auditRepository.insert(
                  new CommitmentAuditRecord(
                      UUID.randomUUID(),
                      commitmentId,
                      actorUserId,
                      ACTION_MANUAL_TERMINATE,
                      reason.strip(),
                      detailJson,
                      now));
              return true;
            });
    if (!Boolean.TRUE.equals(updated)) {
      throw new CommitmentStateConflictException("commitment is no longer active");
    }
    logger.warn(
        "commitment manually terminated commitmentId={} actorUserId={} providerCleanup={}",
        commitmentId,
        actorUserId,
        providerCleanup);

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
    return new ManualTerminateResponse(
        commitmentId.toString(), CommitmentStatus.MANUALLY_EXPIRED.name(), providerCleanup);
  }

  private String removeEnforcement(CommitmentRecord record) {
    if (!record.hasEnforcementReference()) {
      return ManualTerminateResponse.CLEANUP_SKIPPED;
    }
    final CallResult<Void> removal =
        externalCalls.run(
            CallSite.REMOVE_ON_MANUAL_TERMINATE,
            record.commitmentId(),
            () ->
                restrictionProvider.removeProfile(
                    record.providerDeviceId(), record.enforcementReference()));
    return removal.isSuccess()
        ? ManualTerminateResponse.CLEANUP_COMPLETED
        : ManualTerminateResponse.CLEANUP_FAILED;
  }

  private String createDetailJson(CommitmentRecord record, String providerCleanup) {
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("device_id", record.deviceId());
    detail.put("provider_device_id", record.providerDeviceId());
    detail.put("enforcement_ref", record.enforcementReference());
    detail.put("provider_cleanup", providerCleanup);
    try {
      return objectMapper.writeValueAsString(detail);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize audit detail", e);
    }
  }
}
