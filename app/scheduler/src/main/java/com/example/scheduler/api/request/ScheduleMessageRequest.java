/*
 * どこで: Scheduler API リクエスト DTO
 * 何を: 予約 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.scheduler.api.request;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record ScheduleMessageRequest(
    @NotBlank String id,
    @NotBlank String scheduleTo,
    @NotNull Map<String, Object> payload,
    @NotBlank String webhookUrl) {}
