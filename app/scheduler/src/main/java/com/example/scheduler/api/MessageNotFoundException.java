/*
 * どこで: Scheduler API
 * 何を: メッセージ未検出を表現する
 * なぜ: get/delete の 404 応答へ変換するため
 */
package com.example.scheduler.api;

public class MessageNotFoundException extends RuntimeException {
  public MessageNotFoundException(String messageId) {
    super("message not found: " + messageId);
  }
}
