package com.example.commitment.service.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.DELETE;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.commitment.config.ProviderClientProperties;
import com.example.commitment.model.LockedSettings;
import com.example.commitment.service.ExternalErrorKind;
import com.example.commitment.service.provider.dto.DeviceInvitation;
import com.example.commitment.service.provider.dto.ProviderDeviceStatus;
import com.example.commitment.service.provider.dto.RestrictionProfileDescriptor;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class MdmProviderClientTest {

  private static final Instant NOW = Instant.parse("2026-02-01T12:00:00Z");

  @Test
  void createRestrictionProfilePostsLockedSettingsScopedToDevice() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/profiles"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.organizationId").value("org-1"))
        .andExpect(jsonPath("$.name").value("Timer Lock - 7 days"))
        .andExpect(jsonPath("$.payloads[0].type").value("com.apple.applicationaccess"))
        .andExpect(
            jsonPath("$.payloads[0].settings.allowEraseContentAndSettings").value(false))
        .andExpect(jsonPath("$.scope.devices[0]").value("mdm-1"))
        .andRespond(
            withSuccess(
                "{\"id\":\"profile-1\",\"name\":\"Timer Lock - 7 days\"}",
                MediaType.APPLICATION_JSON));

    final String profileId =
        fixture.client.createRestrictionProfile(
            "mdm-1",
            RestrictionProfileDescriptor.forCommitment(
                7, NOW.plus(Duration.ofDays(7)), LockedSettings.allLocked()));

    assertThat(profileId).isEqualTo("profile-1");
    fixture.server.verify();
  }

  @Test
  void deployProfileReturnsDeploymentId() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-1/profiles"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.profileId").value("profile-1"))
        .andRespond(
            withSuccess("{\"id\":\"deploy-1\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.deployProfile("mdm-1", "profile-1")).isEqualTo("deploy-1");
  }

  @Test
  void removeProfileTreatsMissingProfileAsRemoved() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-1/profiles/profile-1"))
        .andExpect(method(DELETE))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatCode(() -> fixture.client.removeProfile("mdm-1", "profile-1"))
        .doesNotThrowAnyException();
  }

  @Test
  void removeProfileMapsServerErrorToUnavailable() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-1/profiles/profile-1"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.removeProfile("mdm-1", "profile-1"))
        .isInstanceOf(ProviderIntegrationException.class)
        .extracting(ex -> ((ProviderIntegrationException) ex).kind())
        .isEqualTo(ExternalErrorKind.UNAVAILABLE);
  }

  @Test
  void deployMaps404ToDeviceNotEnrolled() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-gone/profiles"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> fixture.client.deployProfile("mdm-gone", "profile-1"))
        .isInstanceOf(ProviderIntegrationException.class)
        .extracting(ex -> ((ProviderIntegrationException) ex).kind())
        .isEqualTo(ExternalErrorKind.DEVICE_NOT_ENROLLED);
  }

  @Test
  void rateLimitMapsToUnavailableAndBadRequestToRejected() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-1/profiles"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-1/profiles"))
        .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

    assertThatThrownBy(() -> fixture.client.deployProfile("mdm-1", "profile-1"))
        .isInstanceOf(ProviderIntegrationException.class)
        .extracting(ex -> ((ProviderIntegrationException) ex).kind())
        .isEqualTo(ExternalErrorKind.UNAVAILABLE);
    assertThatThrownBy(() -> fixture.client.deployProfile("mdm-1", "profile-1"))
        .isInstanceOf(ProviderIntegrationException.class)
        .extracting(ex -> ((ProviderIntegrationException) ex).kind())
        .isEqualTo(ExternalErrorKind.REJECTED);
  }

  @Test
  void createProfileMapsTimeoutAndConnectionFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/profiles"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/profiles"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });
    final RestrictionProfileDescriptor descriptor =
        RestrictionProfileDescriptor.forCommitment(3, NOW, LockedSettings.allLocked());

    assertThatThrownBy(() -> fixture.client.createRestrictionProfile("mdm-1", descriptor))
        .isInstanceOf(ProviderIntegrationException.class)
        .extracting(ex -> ((ProviderIntegrationException) ex).kind())
        .isEqualTo(ExternalErrorKind.TIMEOUT);
    assertThatThrownBy(() -> fixture.client.createRestrictionProfile("mdm-1", descriptor))
        .isInstanceOf(ProviderIntegrationException.class)
        .extracting(ex -> ((ProviderIntegrationException) ex).kind())
        .isEqualTo(ExternalErrorKind.UNAVAILABLE);
  }

  @Test
  void createProfileWithoutIdIsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/profiles"))
        .andRespond(withSuccess("{\"name\":\"x\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(
            () ->
                fixture.client.createRestrictionProfile(
                    "mdm-1",
                    RestrictionProfileDescriptor.forCommitment(3, NOW, LockedSettings.allLocked())))
        .isInstanceOf(ProviderIntegrationException.class)
        .extracting(ex -> ((ProviderIntegrationException) ex).kind())
        .isEqualTo(ExternalErrorKind.INVALID_RESPONSE);
  }

  @Test
  void getDeviceStatusDerivesOnlineAndCompliance() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-1"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                {"id":"mdm-1","lastSeenAt":"2026-02-01T11:50:00Z",
                 "profiles":[{"id":"profile-1","status":"installed"}]}
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/devices/mdm-1"))
        .andRespond(
            withSuccess(
                """
                {"id":"mdm-1","lastSeenAt":"2026-02-01T10:00:00Z",
                 "profiles":[{"id":"profile-1","status":"pending"}]}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderDeviceStatus fresh = fixture.client.getDeviceStatus("mdm-1");
    final ProviderDeviceStatus stale = fixture.client.getDeviceStatus("mdm-1");

    assertThat(fresh.online()).isTrue();
    assertThat(fresh.compliant()).isTrue();
    assertThat(stale.online()).isFalse();
    assertThat(stale.compliant()).isFalse();
  }

  @Test
  void createDeviceInvitationReturnsEnrollmentUrl() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://mdm.test/v1/invitations"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.deviceName").value("Kid iPad"))
        .andRespond(
            withSuccess(
                """
                {"id":"inv-1","enrollmentUrl":"https://mdm.test/enroll/abc","invitationCode":"abc"}
                """,
                MediaType.APPLICATION_JSON));

    final DeviceInvitation invitation =
        fixture.client.createDeviceInvitation("Kid iPad", "owner@example.com");

    assertThat(invitation.enrollmentUrl()).isEqualTo("https://mdm.test/enroll/abc");
    assertThat(invitation.invitationCode()).isEqualTo("abc");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://mdm.test/v1").build();
    final ProviderClientProperties properties =
        new ProviderClientProperties(
            "http", "http://mdm.test/v1", "token", "org-1", Duration.ofSeconds(1), null);
    return new ClientFixture(
        new MdmProviderClient(restClient, properties, Clock.fixed(NOW, ZoneOffset.UTC)), server);
  }

  private record ClientFixture(MdmProviderClient client, MockRestServiceServer server) {}
}
