/*
 * どこで: Scheduler API レスポンス DTO
 * 何を: ヘルスチェック結果を定義する
 * なぜ: 認証なしで Redis 疎通と未武装の予約を確認できる簡易エンドポイントを提供するため
 */
package com.example.scheduler.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    String status, String redis, String error, String warning, List<String> unarmedMessageIds) {

  private static final String UNARMED_WARNING =
      "stored messages have no armed timer; re-schedule them or restart to restore";

  public static HealthResponse healthy() {
    return new HealthResponse("healthy", "connected", null, null, null);
  }

  public static HealthResponse unhealthy(String error) {
    return new HealthResponse("unhealthy", "disconnected", error, null, null);
  }

  /** 未武装の id があれば警告を付ける。status は Redis 疎通のみで決まる。 */
  public HealthResponse withUnarmed(List<String> messageIds) {
    if (messageIds == null || messageIds.isEmpty()) {
      return this;
    }
    return new HealthResponse(status, redis, error, UNARMED_WARNING, List.copyOf(messageIds));
  }
}
