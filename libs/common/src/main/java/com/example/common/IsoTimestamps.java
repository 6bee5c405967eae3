/*
 * どこで: 共通ユーティリティ
 * 何を: ISO-8601 文字列を UTC の Instant へ正規化する
 * なぜ: オフセット付き/なしの入力を単一の時刻表現で扱うため
 */
package com.example.common;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

public final class IsoTimestamps {
  private IsoTimestamps() {}

  // 前提: オフセットなしの入力は UTC として解釈する
  // トレードオフ: 呼び出し元のローカルタイムゾーンは考慮しない
  public static Instant parseToInstant(String value) {
    if (value == null || value.isBlank()) {
      throw new DateTimeParseException("timestamp is required", String.valueOf(value), 0);
    }
    final TemporalAccessor parsed =
        DateTimeFormatter.ISO_DATE_TIME.parseBest(
            value.trim(), OffsetDateTime::from, LocalDateTime::from);
    if (parsed instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    }
    return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
  }

  public static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
