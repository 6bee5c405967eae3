/*
 * どこで: Scheduler 設定
 * 何を: 永続化キー/配信プール/復元/webhook タイムアウトの設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.example.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scheduler")
public record SchedulerProperties(
    String keyPrefix,
    int scanCount,
    int dispatchPoolSize,
    Boolean restoreEnabled,
    Webhook webhook) {

  public SchedulerProperties {
    keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "message:" : keyPrefix;
    scanCount = scanCount <= 0 ? 1000 : scanCount;
    dispatchPoolSize = dispatchPoolSize <= 0 ? 4 : dispatchPoolSize;
    // ScheduleRestorer の @ConditionalOnProperty(matchIfMissing = true) と既定値を揃える
    restoreEnabled = restoreEnabled == null ? Boolean.TRUE : restoreEnabled;
    webhook = webhook == null ? new Webhook(null, null) : webhook;
  }

  public record Webhook(Duration connectTimeout, Duration readTimeout) {

    public Webhook {
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    }
  }
}
