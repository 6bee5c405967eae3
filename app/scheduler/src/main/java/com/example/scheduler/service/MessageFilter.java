/*
 * どこで: Scheduler サービス層
 * 何を: id の prefix/contains 絞り込み条件を表現する
 * なぜ: 検索と一括削除で同じ一致ルールを共有するため
 */
package com.example.scheduler.service;

import com.example.scheduler.api.InvalidScheduleRequestException;

public record MessageFilter(String prefix, String contains) {

  /**
   * 役割: API の任意パラメータから条件を組み立てる。 動作: 空文字は未指定として扱い、両方未指定なら
   * InvalidScheduleRequestException を送出する。空白のみの値は id に含まれうる文字列として条件に残す。
   */
  public static MessageFilter of(String prefix, String contains) {
    final String normalizedPrefix = emptyToNull(prefix);
    final String normalizedContains = emptyToNull(contains);
    if (normalizedPrefix == null && normalizedContains == null) {
      throw new InvalidScheduleRequestException(
          "at least one filter is required: 'prefix' or 'contains'");
    }
    return new MessageFilter(normalizedPrefix, normalizedContains);
  }

  public boolean hasPrefix() {
    return prefix != null;
  }

  public boolean matches(String messageId) {
    if (messageId == null) {
      return false;
    }
    if (prefix != null && !messageId.startsWith(prefix)) {
      return false;
    }
    return contains == null || messageId.contains(contains);
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
