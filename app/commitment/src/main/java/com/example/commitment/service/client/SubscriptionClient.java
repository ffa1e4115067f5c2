/*
 * どこで: Commitment サービス層 (下流サービス連携)
 * 何を: 課金サービスから利用者の有効なプラン種別を取得する
 * なぜ: コミットメント日数の上限をプランから決めるため
 */
package com.example.commitment.service.client;

import com.example.commitment.config.SubscriptionClientProperties;
import com.example.commitment.service.client.dto.ActiveSubscriptionResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class SubscriptionClient {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionClient.class);
  private static final String OPERATION = "subscription getActivePlanType";

  private final RestClient subscriptionRestClient;
  private final SubscriptionClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public SubscriptionClient(
      RestClient subscriptionRestClient, SubscriptionClientProperties properties) {
    this.subscriptionRestClient = subscriptionRestClient;
    this.properties = properties;
  }

  /** Returns the active plan type, or empty when the user has no active subscription. */
  public Optional<String> getActivePlanType(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    final ActiveSubscriptionResponse response;
    try {
      response =
          subscriptionRestClient
              .get()
              .uri(properties.activeSubscriptionPath(), userId)
              .retrieve()
              .body(ActiveSubscriptionResponse.class);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      throw CollaboratorErrors.fromResponse(logger, OPERATION, ex);
    } catch (ResourceAccessException ex) {
      throw CollaboratorErrors.fromResource(logger, OPERATION, ex);
    } catch (RuntimeException ex) {
      logger.warn("{} response parse failed", OPERATION, ex);
      throw CollaboratorErrors.invalidResponse(OPERATION, ex);
    }
    if (response == null) {
      throw CollaboratorErrors.invalidResponse(OPERATION, null);
    }
    if (response.status() != null && !"active".equalsIgnoreCase(response.status())) {
      return Optional.empty();
    }
    if (response.planType() == null || response.planType().isBlank()) {
      throw CollaboratorErrors.invalidResponse(OPERATION, null);
    }
    return Optional.of(response.planType());
  }
}
