/*
 * どこで: Scheduler API レスポンス DTO
 * 何を: メモリ上のタイマー一覧を定義する
 * なぜ: 保存値ではなくプロセス内で実際に待機中の予約を確認できるようにするため
 */
package com.example.scheduler.api.response;

import java.util.List;

public record ScheduledJobsResponse(List<ScheduledJobItem> scheduledJobs, int count) {

  public ScheduledJobsResponse {
    scheduledJobs = List.copyOf(scheduledJobs);
  }
}
