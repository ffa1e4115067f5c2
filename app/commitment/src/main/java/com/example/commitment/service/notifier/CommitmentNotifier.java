/*
 * どこで: Commitment サービス層 (通知)
 * 何を: 完了通知と期限間近の警告を利用者へ届ける契約
 * なぜ: 配送経路 (ログ/HTTP) をスイーパーから切り離すため
 */
package com.example.commitment.service.notifier;

public interface CommitmentNotifier {

  /** Sends the completion notice. Failure is reported by {@link NotificationDeliveryException}. */
  void sendCompletion(CompletionNotice notice);

  void sendExpiryWarning(ExpiryWarningNotice notice);
}
