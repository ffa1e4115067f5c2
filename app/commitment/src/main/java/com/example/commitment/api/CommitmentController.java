/*
 * どこで: Commitment API
 * 何を: 利用者向けのコミットメント作成/参照/緊急解除申請エンドポイントを公開する
 * なぜ: gateway からの要求をサービス層へ薄く受け渡すため
 */
package com.example.commitment.api;

import com.example.commitment.api.request.CreateCommitmentRequest;
import com.example.commitment.api.request.EmergencyCancellationRequest;
import com.example.commitment.api.response.ActiveCommitmentResponse;
import com.example.commitment.api.response.CommitmentHistoryResponse;
import com.example.commitment.api.response.CommitmentLimitsResponse;
import com.example.commitment.api.response.CommitmentResponse;
import com.example.commitment.api.response.EmergencyCancellationResponse;
import com.example.commitment.config.ClientIps;
import com.example.commitment.service.CommitmentService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{userId}")
@RequiredArgsConstructor
public class CommitmentController {

  private final CommitmentService commitmentService;

  @PostMapping("/devices/{deviceId}/commitments")
  public ResponseEntity<CommitmentResponse> createCommitment(
      @PathVariable("userId") String userId,
      @PathVariable("deviceId") String deviceId,
      @Valid @RequestBody CreateCommitmentRequest request) {
    final CommitmentResponse response =
        commitmentService.create(
            userId, deviceId, request.durationDays(), request.confirmUnderstanding());
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/devices/{deviceId}/commitments/active")
  public ResponseEntity<ActiveCommitmentResponse> getActiveCommitment(
      @PathVariable("userId") String userId, @PathVariable("deviceId") String deviceId) {
    return ResponseEntity.ok(commitmentService.getActiveCommitment(userId, deviceId));
  }

  @PostMapping("/devices/{deviceId}/commitments/emergency-cancellations")
  public ResponseEntity<EmergencyCancellationResponse> requestEmergencyCancellation(
      @PathVariable("userId") String userId,
      @PathVariable("deviceId") String deviceId,
      @Valid @RequestBody EmergencyCancellationRequest request,
      HttpServletRequest httpRequest) {
    final EmergencyCancellationResponse response =
        commitmentService.requestEmergencyCancellation(
            userId,
            deviceId,
            request.reason(),
            request.confirmEmergency(),
            ClientIps.resolve(httpRequest),
            httpRequest.getHeader(HttpHeaders.USER_AGENT));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
  }

  @GetMapping("/commitment-limits")
  public ResponseEntity<CommitmentLimitsResponse> getLimits(
      @PathVariable("userId") String userId) {
    return ResponseEntity.ok(commitmentService.getLimits(userId));
  }

  @GetMapping("/commitments")
  public ResponseEntity<CommitmentHistoryResponse> listHistory(
      @PathVariable("userId") String userId,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "limit", defaultValue = "20") int limit) {
    return ResponseEntity.ok(commitmentService.listHistory(userId, page, limit));
  }
}
