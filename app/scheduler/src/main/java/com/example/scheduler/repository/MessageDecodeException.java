/*
 * どこで: Scheduler Repository 層
 * 何を: 保存値を予約メッセージへ復号できなかったことを表現する
 * なぜ: 復元/検索で壊れたレコードだけを個別にスキップするため
 */
package com.example.scheduler.repository;

public class MessageDecodeException extends RuntimeException {

  private final String messageId;

  public MessageDecodeException(String messageId, String message, Throwable cause) {
    super(message + ": " + messageId, cause);
    this.messageId = messageId;
  }

  public String messageId() {
    return messageId;
  }
}
