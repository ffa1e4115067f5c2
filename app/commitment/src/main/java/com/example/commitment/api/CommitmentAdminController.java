package com.example.commitment.api;

import com.example.commitment.api.request.ManualTerminateRequest;
import com.example.commitment.api.response.CommitmentStatsResponse;
import com.example.commitment.api.response.ManualTerminateResponse;
import com.example.commitment.service.CommitmentAdminService;
import com.example.commitment.service.ExpirySweepScheduler;
import jakarta.validation.Valid;
import java.security.Principal;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/commitments")
@RequiredArgsConstructor
public class CommitmentAdminController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final CommitmentAdminService commitmentAdminService;
  private final ExpirySweepScheduler expirySweepScheduler;

  @PostMapping("/{commitmentId}:terminate")
  public ResponseEntity<ManualTerminateResponse> terminate(
      @PathVariable("commitmentId") UUID commitmentId,
      @RequestHeader(value = HEADER_USER_ID, required = false) String forwardedUserId,
      @Valid @RequestBody ManualTerminateRequest request,
      Principal principal) {
    final String actorUserId = principal != null ? principal.getName() : forwardedUserId;
    return ResponseEntity.ok(
        commitmentAdminService.manualTerminate(commitmentId, actorUserId, request.reason()));
  }

  @GetMapping("/stats")
  public ResponseEntity<CommitmentStatsResponse> getStats() {
    return ResponseEntity.ok(expirySweepScheduler.getStats());
  }
}
