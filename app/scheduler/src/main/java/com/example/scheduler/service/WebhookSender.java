/*
 * どこで: Scheduler サービス層
 * 何を: webhook 送信の抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.example.scheduler.service;

import com.example.scheduler.model.ScheduledMessage;

public interface WebhookSender {

  /**
   * 役割: payload を webhookUrl へ 1 回だけ POST する。 動作: 2xx 以外や接続失敗は WebhookDeliveryException
   * を送出する。再送はしない。
   */
  void send(ScheduledMessage message);
}
