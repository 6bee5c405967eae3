/*
 * どこで: Scheduler ドメインモデル
 * 何を: タイマー登録簿の 1 エントリの時点コピーを表現する
 * なぜ: 発火ハンドルを外へ出さず id と発火時刻だけを公開するため
 */
package com.example.scheduler.model;

import java.time.Instant;

public record TimerSnapshot(String messageId, Instant fireAt) {}
