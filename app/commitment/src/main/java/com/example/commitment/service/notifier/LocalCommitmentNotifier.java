package com.example.commitment.service.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

// ローカル起動用。通知内容をログへ出すだけで外部送信しない
@Service
@ConditionalOnProperty(
    name = "commitment.notifier.type",
    havingValue = "local",
    matchIfMissing = true)
public class LocalCommitmentNotifier implements CommitmentNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LocalCommitmentNotifier.class);

  @Override
  public void sendCompletion(CompletionNotice notice) {
    logger.info(
        "notification sent kind=completion commitmentId={} userId={} subject=\"{}\"",
        notice.commitmentId(),
        notice.userId(),
        notice.subject());
  }

  @Override
  public void sendExpiryWarning(ExpiryWarningNotice notice) {
    logger.info(
        "notification sent kind=expiry_warning commitmentId={} userId={} subject=\"{}\"",
        notice.commitmentId(),
        notice.userId(),
        notice.subject());
  }
}
