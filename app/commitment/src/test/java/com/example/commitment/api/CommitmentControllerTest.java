package com.example.commitment.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.commitment.api.response.ActiveCommitmentResponse;
import com.example.commitment.api.response.CommitmentHistoryResponse;
import com.example.commitment.api.response.CommitmentLimitsResponse;
import com.example.commitment.api.response.CommitmentResponse;
import com.example.commitment.api.response.EmergencyCancellationResponse;
import com.example.commitment.model.LockedSettings;
import com.example.commitment.service.CommitmentService;
import com.example.commitment.service.ExternalErrorKind;
import com.example.commitment.service.client.CollaboratorIntegrationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CommitmentController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class CommitmentControllerTest {

  private static final String CREATE_PATH = "/v1/users/user-1/devices/device-1/commitments";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CommitmentService commitmentService;

  @Test
  void createReturns201WithCommitment() throws Exception {
    when(commitmentService.create("user-1", "device-1", 7, true)).thenReturn(sampleCommitment());

    mockMvc
        .perform(
            post(CREATE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"duration_days":7,"confirm_understanding":true}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.commitment_id").value("c-1"))
        .andExpect(jsonPath("$.status").value("ACTIVE"))
        .andExpect(jsonPath("$.locked_settings.factoryReset").value(false));
  }

  @Test
  void createReturns400WhenDurationMissing() throws Exception {
    mockMvc
        .perform(
            post(CREATE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"confirm_understanding":true}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("duration_days is required"));

    verifyNoInteractions(commitmentService);
  }

  @Test
  void createMapsPolicyViolationWithDetails() throws Exception {
    when(commitmentService.create("user-1", "device-1", 45, true))
        .thenThrow(
            new CommitmentValidationException(
                ApiErrorCode.POLICY_VIOLATION,
                "duration exceeds plan limit of 30 days",
                Map.of("max_allowed", 30, "tier", "Monthly")));

    mockMvc
        .perform(
            post(CREATE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"duration_days\":45,\"confirm_understanding\":true}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("POLICY_VIOLATION"))
        .andExpect(jsonPath("$.details.max_allowed").value(30));
  }

  @Test
  void createMapsMissingSubscriptionTo403AndDuplicateTo409() throws Exception {
    when(commitmentService.create("user-1", "device-1", 7, true))
        .thenThrow(
            new CommitmentValidationException(
                ApiErrorCode.SUBSCRIPTION_REQUIRED, "active subscription required"))
        .thenThrow(
            new CommitmentValidationException(
                ApiErrorCode.ACTIVE_COMMITMENT_EXISTS, "device already has an active commitment"));
    final String body = "{\"duration_days\":7,\"confirm_understanding\":true}";

    mockMvc
        .perform(post(CREATE_PATH).contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("SUBSCRIPTION_REQUIRED"));
    mockMvc
        .perform(post(CREATE_PATH).contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ACTIVE_COMMITMENT_EXISTS"));
  }

  @Test
  void createMapsProviderFailures() throws Exception {
    when(commitmentService.create("user-1", "device-1", 7, true))
        .thenThrow(new CommitmentActivationException(ExternalErrorKind.TIMEOUT, "retry later"))
        .thenThrow(
            new CommitmentActivationException(
                ExternalErrorKind.DEVICE_NOT_ENROLLED, "device must be re-enrolled"))
        .thenThrow(new CommitmentActivationException(ExternalErrorKind.REJECTED, "failed"));
    final String body = "{\"duration_days\":7,\"confirm_understanding\":true}";

    mockMvc
        .perform(post(CREATE_PATH).contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("PROVIDER_UNAVAILABLE"))
        .andExpect(jsonPath("$.details.retryable").value(true));
    mockMvc
        .perform(post(CREATE_PATH).contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("DEVICE_NOT_ENROLLED"))
        .andExpect(jsonPath("$.details.reenroll_required").value(true));
    mockMvc
        .perform(post(CREATE_PATH).contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("PROVIDER_ERROR"));
  }

  @Test
  void createMapsUpstreamTimeoutTo504() throws Exception {
    when(commitmentService.create(any(), any(), any(), any()))
        .thenThrow(
            new CollaboratorIntegrationException(
                CollaboratorIntegrationException.Reason.TIMEOUT, "billing timeout"));

    mockMvc
        .perform(
            post(CREATE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"duration_days\":7,\"confirm_understanding\":true}"))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("UPSTREAM_TIMEOUT"));
  }

  @Test
  void getActiveReturnsRemainingSeconds() throws Exception {
    when(commitmentService.getActiveCommitment("user-1", "device-1"))
        .thenReturn(
            new ActiveCommitmentResponse(
                sampleCommitment(),
                3600L,
                new ActiveCommitmentResponse.DeviceStatusView(
                    true, true, "2026-01-01T00:00:00Z")));

    mockMvc
        .perform(get(CREATE_PATH + "/active"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.seconds_remaining").value(3600))
        .andExpect(jsonPath("$.device_status.online").value(true));
  }

  @Test
  void getActiveReturns404WhenNone() throws Exception {
    when(commitmentService.getActiveCommitment("user-1", "device-1"))
        .thenThrow(new CommitmentNotFoundException("no active commitment for device"));

    mockMvc
        .perform(get(CREATE_PATH + "/active"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("COMMITMENT_NOT_FOUND"));
  }

  @Test
  void getActiveMapsStoreFailureTo503() throws Exception {
    when(commitmentService.getActiveCommitment("user-1", "device-1"))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(get(CREATE_PATH + "/active"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"))
        .andExpect(jsonPath("$.message").value("commitment store is temporarily unavailable"));
  }

  @Test
  void emergencyCancellationReturns202WithTicket() throws Exception {
    when(commitmentService.requestEmergencyCancellation(
            eq("user-1"),
            eq("device-1"),
            eq("medical emergency, need the phone"),
            eq(true),
            eq("203.0.113.9"),
            eq("ios-app/2.1")))
        .thenReturn(
            new EmergencyCancellationResponse(
                "EMG-c-1-1", "support@example.com", "PENDING_REVIEW", "review"));

    mockMvc
        .perform(
            post(CREATE_PATH + "/emergency-cancellations")
                .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                .header("User-Agent", "ios-app/2.1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"reason":"medical emergency, need the phone","confirm_emergency":true}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.ticket_id").value("EMG-c-1-1"))
        .andExpect(jsonPath("$.status").value("PENDING_REVIEW"));
  }

  @Test
  void emergencyCancellationRejectsShortReason() throws Exception {
    mockMvc
        .perform(
            post(CREATE_PATH + "/emergency-cancellations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"short\",\"confirm_emergency\":true}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

    verifyNoInteractions(commitmentService);
  }

  @Test
  void limitsAndHistoryAreReturned() throws Exception {
    when(commitmentService.getLimits("user-1"))
        .thenReturn(new CommitmentLimitsResponse(90, "3month", "3-Month", true));
    when(commitmentService.listHistory("user-1", 2, 10))
        .thenReturn(
            new CommitmentHistoryResponse(
                List.of(
                    new CommitmentHistoryResponse.Item(
                        "c-1",
                        "device-1",
                        "iPhone",
                        7,
                        "2026-01-01T00:00:00Z",
                        "2026-01-08T00:00:00Z",
                        "EXPIRED",
                        "2026-01-01T00:00:00Z")),
                2,
                10,
                11L,
                2L));

    mockMvc
        .perform(get("/v1/users/user-1/commitment-limits"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.max_days").value(90))
        .andExpect(jsonPath("$.tier_label").value("3-Month"));
    mockMvc
        .perform(get("/v1/users/user-1/commitments").param("page", "2").param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.commitments[0].status").value("EXPIRED"))
        .andExpect(jsonPath("$.total_pages").value(2));
    verify(commitmentService).listHistory("user-1", 2, 10);
  }

  @Test
  void historyRejectsNonNumericPage() throws Exception {
    mockMvc
        .perform(get("/v1/users/user-1/commitments").param("page", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("page is invalid"));
  }

  private CommitmentResponse sampleCommitment() {
    return new CommitmentResponse(
        "c-1",
        "user-1",
        "device-1",
        "iPhone",
        7,
        "2026-01-01T00:00:00Z",
        "2026-01-08T00:00:00Z",
        "ACTIVE",
        "1month",
        LockedSettings.allLocked());
  }
}
