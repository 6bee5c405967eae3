/*
 * どこで: Scheduler Repository 層
 * 何を: 予約メッセージの永続化操作を抽象化する
 * なぜ: Redis 実装詳細をスケジューリング処理から切り離すため
 */
package com.example.scheduler.repository;

import com.example.scheduler.model.ScheduledMessage;
import java.util.List;
import java.util.Optional;

public interface ScheduledMessageRepository {

  /**
   * 役割: メッセージを保存する。 動作: 同一 id が存在すれば置き換える（upsert）。 前提: message は null でないこと。
   */
  void save(ScheduledMessage message);

  /**
   * 役割: id からメッセージを取得する。 動作: 存在しなければ empty を返し、復号できなければ MessageDecodeException を送出する。
   */
  Optional<ScheduledMessage> findById(String messageId);

  boolean existsById(String messageId);

  /** 役割: メッセージを削除する。 動作: 削除した場合 true、元から存在しなければ false を返す。 */
  boolean deleteById(String messageId);

  /**
   * 役割: 配信済みメッセージを片付ける。 動作: 保存値が expected と同一の場合のみ原子的に削除する。再予約で置き換わっていれば残して false
   * を返す。
   */
  boolean deleteIfUnchanged(ScheduledMessage expected);

  /**
   * 役割: id 接頭辞に一致する保存済み id を列挙する。 動作: 空文字列は全件走査となる。 前提: idPrefix は null でないこと。
   */
  List<String> scanIds(String idPrefix);

  /** 役割: ストアへの疎通を確認する。 動作: 到達できなければ DataAccessException を送出する。 */
  void ping();
}
