/*
 * どこで: Scheduler ドメインモデル
 * 何を: 永続化済みメッセージとメモリ上の次回発火時刻の組を表現する
 * なぜ: 検索結果で「保存済みだが未登録」の状態を区別できるようにするため
 */
package com.example.scheduler.model;

import java.time.Instant;

public record AnnotatedMessage(ScheduledMessage message, Instant nextRun) {}
