/*
 * どこで: Scheduler ドメインモデル
 * 何を: 永続化される予約メッセージ 1 件を表現する
 * なぜ: Repository/Service/配信ワーカー間で受け渡す構造を固定するため
 */
package com.example.scheduler.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "payload はコンストラクタで不変ビューへ包んでから保持するため")
public record ScheduledMessage(
    String messageId, Instant fireAt, Map<String, Object> payload, String webhookUrl) {

  public ScheduledMessage {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(fireAt, "fireAt");
    Objects.requireNonNull(webhookUrl, "webhookUrl");
    // JSON の null 値を保持するため Map.copyOf は使わない
    payload =
        payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
