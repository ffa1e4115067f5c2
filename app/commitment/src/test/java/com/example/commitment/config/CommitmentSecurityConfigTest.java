package com.example.commitment.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.commitment.api.CommitmentAdminController;
import com.example.commitment.api.CommitmentController;
import com.example.commitment.api.response.CommitmentLimitsResponse;
import com.example.commitment.api.response.CommitmentStatsResponse;
import com.example.commitment.api.response.ManualTerminateResponse;
import com.example.commitment.service.CommitmentAdminService;
import com.example.commitment.service.CommitmentService;
import com.example.commitment.service.ExpirySweepScheduler;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({CommitmentController.class, CommitmentAdminController.class})
@AutoConfigureMockMvc
@Import(CommitmentSecurityConfig.class)
@TestPropertySource(properties = "commitment.internal-api.token=test-internal-token")
class CommitmentSecurityConfigTest {

  private static final String LIMITS_PATH = "/v1/users/user-1/commitment-limits";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CommitmentService commitmentService;
  @MockitoBean private CommitmentAdminService commitmentAdminService;
  @MockitoBean private ExpirySweepScheduler expirySweepScheduler;

  @Test
  void userEndpointRejectsWhenNoInternalToken() throws Exception {
    mockMvc.perform(get(LIMITS_PATH)).andExpect(status().isForbidden());
  }

  @Test
  void userEndpointAllowsInternalOwnerWithHeaders() throws Exception {
    when(commitmentService.getLimits("user-1"))
        .thenReturn(new CommitmentLimitsResponse(30, "1month", "Monthly", true));

    mockMvc
        .perform(
            get(LIMITS_PATH)
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "user-1"))
        .andExpect(status().isOk());
  }

  @Test
  void userEndpointRejectsInternalNonOwner() throws Exception {
    mockMvc
        .perform(
            get("/v1/users/user-2/commitment-limits")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "user-1"))
        .andExpect(status().isForbidden());
  }

  @Test
  void userEndpointRejectsWhenUserIdHeaderMissing() throws Exception {
    mockMvc
        .perform(get(LIMITS_PATH).header("X-Internal-Token", "test-internal-token"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void userEndpointRejectsInvalidToken() throws Exception {
    mockMvc
        .perform(
            get(LIMITS_PATH)
                .header("X-Internal-Token", "wrong-token")
                .header("X-User-Id", "user-1"))
        .andExpect(status().isForbidden());
  }

  @Test
  void userEndpointAllowsAdminForAnotherUser() throws Exception {
    when(commitmentService.getLimits("user-2"))
        .thenReturn(new CommitmentLimitsResponse(30, "1month", "Monthly", true));

    mockMvc
        .perform(get("/v1/users/user-2/commitment-limits").with(user("admin").roles("ADMIN")))
        .andExpect(status().isOk());
  }

  @Test
  void adminEndpointRequiresAdminRole() throws Exception {
    mockMvc
        .perform(
            get("/v1/admin/commitments/stats")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "user-1"))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(get("/v1/admin/commitments/stats").with(user("user-1").roles("USER")))
        .andExpect(status().isForbidden());
  }

  @Test
  void adminEndpointAllowsForwardedAdminRole() throws Exception {
    when(expirySweepScheduler.getStats()).thenReturn(new CommitmentStatsResponse(List.of(), null));
    final UUID commitmentId = UUID.randomUUID();
    when(commitmentAdminService.manualTerminate(eq(commitmentId), eq("admin-1"), any()))
        .thenReturn(
            new ManualTerminateResponse(
                commitmentId.toString(),
                "MANUALLY_EXPIRED",
                ManualTerminateResponse.CLEANUP_COMPLETED));

    mockMvc
        .perform(
            get("/v1/admin/commitments/stats")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "USER,ADMIN"))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            post("/v1/admin/commitments/" + commitmentId + ":terminate")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"device returned\"}"))
        .andExpect(status().isOk());
  }
}
