/*
 * どこで: Scheduler API レスポンス DTO
 * 何を: 検索結果 1 件を定義する
 * なぜ: 保存値に加え、メモリ上の次回発火時刻 (未登録なら null) を返すため
 */
package com.example.scheduler.api.response;

import com.example.common.IsoTimestamps;
import com.example.scheduler.model.AnnotatedMessage;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "payload はドメインモデル側で不変ビューになっているため")
public record MessageSearchItem(
    String id, String scheduleTo, Map<String, Object> payload, String webhookUrl, String nextRun) {

  public static MessageSearchItem from(AnnotatedMessage annotated) {
    return new MessageSearchItem(
        annotated.message().messageId(),
        IsoTimestamps.format(annotated.message().fireAt()),
        annotated.message().payload(),
        annotated.message().webhookUrl(),
        IsoTimestamps.format(annotated.nextRun()));
  }
}
