/*
 * どこで: Commitment サービス層 (通知)
 * 何を: notification サービスの HTTP API へ通知を送る
 * なぜ: 通知配送の再送や宛先解決を notification 側へ委ねるため
 */
package com.example.commitment.service.notifier;

import com.example.commitment.config.NotifierClientProperties;
import com.example.commitment.service.ExternalErrorKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(name = "commitment.notifier.type", havingValue = "http")
public class HttpCommitmentNotifier implements CommitmentNotifier {

  private static final Logger logger = LoggerFactory.getLogger(HttpCommitmentNotifier.class);

  private final RestClient notifierRestClient;
  private final NotifierClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpCommitmentNotifier(
      RestClient notifierRestClient, NotifierClientProperties properties) {
    this.notifierRestClient = notifierRestClient;
    this.properties = properties;
  }

  @Override
  public void sendCompletion(CompletionNotice notice) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("commitment_id", notice.commitmentId().toString());
    payload.put("device_name", notice.deviceName());
    payload.put("duration_days", notice.durationDays());
    payload.put("commitment_start", notice.commitmentStart().toString());
    payload.put("commitment_end", notice.commitmentEnd().toString());
    // 通知 ID を種別付きで固定し、notification 側の重複排除キーにする
    post(
        new NotificationRequest(
            "commitment-complete-" + notice.commitmentId(),
            notice.userId(),
            "COMMITMENT_COMPLETED",
            notice.subject(),
            payload));
  }

  @Override
  public void sendExpiryWarning(ExpiryWarningNotice notice) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("commitment_id", notice.commitmentId().toString());
    payload.put("device_name", notice.deviceName());
    payload.put("hours_left", notice.hoursLeft());
    payload.put("commitment_end", notice.commitmentEnd().toString());
    post(
        new NotificationRequest(
            "commitment-warning-" + notice.commitmentId(),
            notice.userId(),
            "COMMITMENT_EXPIRING",
            notice.subject(),
            payload));
  }

  private void post(NotificationRequest request) {
    try {
      notifierRestClient
          .post()
          .uri(properties.path())
          .body(request)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "notification post failed with http status={} notificationId={}",
          ex.getStatusCode().value(),
          request.notificationId());
      final ExternalErrorKind kind =
          ex.getStatusCode().is5xxServerError()
              ? ExternalErrorKind.UNAVAILABLE
              : ExternalErrorKind.REJECTED;
      throw new NotificationDeliveryException(kind, "notification request failed", ex);
    } catch (ResourceAccessException ex) {
      final ExternalErrorKind kind =
          isTimeout(ex) ? ExternalErrorKind.TIMEOUT : ExternalErrorKind.UNAVAILABLE;
      logger.warn(
          "notification post connection failed kind={} notificationId={}",
          kind,
          request.notificationId());
      throw new NotificationDeliveryException(kind, "notification connection failed", ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
