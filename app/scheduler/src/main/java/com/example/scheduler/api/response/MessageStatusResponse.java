/*
 * どこで: Scheduler API レスポンス DTO
 * 何を: 予約/削除の結果を定義する
 * なぜ: 操作種別ごとに同じ形で受理結果を返すため
 */
package com.example.scheduler.api.response;

public record MessageStatusResponse(String status, String messageId) {

  public static MessageStatusResponse scheduled(String messageId) {
    return new MessageStatusResponse("scheduled", messageId);
  }

  public static MessageStatusResponse deleted(String messageId) {
    return new MessageStatusResponse("deleted", messageId);
  }
}
