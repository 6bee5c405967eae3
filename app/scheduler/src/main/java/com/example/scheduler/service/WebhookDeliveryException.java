/*
 * どこで: Scheduler サービス層
 * 何を: webhook 配信失敗を表現する
 * なぜ: 配信ワーカーで失敗理由ごとにログ/メトリクスを分けるため
 */
package com.example.scheduler.service;

public class WebhookDeliveryException extends RuntimeException {

  public enum Reason {
    REJECTED,
    TIMEOUT,
    CONNECTION_FAILED,
    INVALID_URL
  }

  private final Reason reason;
  private final String messageId;

  public WebhookDeliveryException(
      Reason reason, String messageId, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.messageId = messageId;
  }

  public Reason reason() {
    return reason;
  }

  public String messageId() {
    return messageId;
  }
}
