/*
 * どこで: Scheduler タイマー登録簿
 * 何を: 1 回のタイマー登録（アーミング）を識別する
 * なぜ: 発火後の片付けが、同じ id の新しい登録を誤って消さないようにするため
 */
package com.example.scheduler.scheduling;

import java.time.Instant;

public record TimerTicket(String messageId, Instant fireAt, long generation) {}
