/*
 * どこで: 共通ユーティリティ
 * 何を: ログ相関用の trace id を生成する
 * なぜ: HTTP リクエストとタイマー発火の双方で同じ形式の trace_id を MDC へ載せるため
 */
package com.example.common;

import java.util.Locale;
import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  // W3C trace-context と同じ 32 桁の小文字 16 進で返す
  public static String newTraceId() {
    final UUID uuid = UUID.randomUUID();
    return String.format(
        Locale.ROOT, "%016x%016x", uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
  }
}
