/*
 * どこで: Scheduler API
 * 何を: 予約・検索リクエストの妥当性エラーを表現する
 * なぜ: 日時形式や URL、絞り込み条件の不備を 400 へ正規化するため
 */
package com.example.scheduler.api;

public class InvalidScheduleRequestException extends RuntimeException {
  public InvalidScheduleRequestException(String message) {
    super(message);
  }

  public InvalidScheduleRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
