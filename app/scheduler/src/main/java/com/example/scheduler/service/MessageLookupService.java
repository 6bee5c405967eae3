/*
 * どこで: Scheduler サービス層
 * 何を: id の prefix/contains による検索と一括削除を行う
 * なぜ: Redis の走査結果とメモリ上のタイマー情報を一か所で突き合わせるため
 */
package com.example.scheduler.service;

import com.example.scheduler.model.AnnotatedMessage;
import com.example.scheduler.model.ScheduledMessage;
import com.example.scheduler.model.TimerSnapshot;
import com.example.scheduler.repository.MessageDecodeException;
import com.example.scheduler.repository.ScheduledMessageRepository;
import com.example.scheduler.scheduling.TimerRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MessageLookupService {

  private static final Logger logger = LoggerFactory.getLogger(MessageLookupService.class);

  private final ScheduledMessageRepository repository;
  private final TimerRegistry timerRegistry;
  private final SchedulerMetrics metrics;

  public MessageLookupService(
      ScheduledMessageRepository repository,
      TimerRegistry timerRegistry,
      SchedulerMetrics metrics) {
    this.repository = repository;
    this.timerRegistry = timerRegistry;
    this.metrics = metrics;
  }

  /**
   * 役割: 条件に一致する id を列挙する。 動作: prefix があればストア側の接頭辞走査（一致件数に比例）、contains のみなら全件走査して id
   * を個別判定する（全件数に比例）。
   */
  public List<String> matchIds(MessageFilter filter) {
    // contains のみの検索は全キー走査になる。件数が大きい環境ではスケール上限になる
    final List<String> candidates = repository.scanIds(filter.hasPrefix() ? filter.prefix() : "");
    final List<String> matched = new ArrayList<>();
    for (String messageId : candidates) {
      if (filter.matches(messageId)) {
        matched.add(messageId);
      }
    }
    return matched;
  }

  public List<AnnotatedMessage> search(MessageFilter filter) {
    final List<String> messageIds = matchIds(filter);
    final Map<String, Instant> nextRuns = new HashMap<>();
    for (TimerSnapshot snapshot : timerRegistry.snapshot()) {
      nextRuns.put(snapshot.messageId(), snapshot.fireAt());
    }
    final List<AnnotatedMessage> results = new ArrayList<>(messageIds.size());
    for (String messageId : messageIds) {
      final Optional<ScheduledMessage> message;
      try {
        message = repository.findById(messageId);
      } catch (MessageDecodeException ex) {
        logger.warn("skipping unreadable scheduled message id={}", messageId, ex);
        metrics.recordDependencyError("search_decode");
        continue;
      }
      // 走査後に配信/削除されたものは結果に含めない
      message.ifPresent(m -> results.add(new AnnotatedMessage(m, nextRuns.get(messageId))));
    }
    return results;
  }

  /**
   * 役割: 条件に一致するメッセージを削除しタイマーも取り消す。 動作: 1 件の失敗で残りを中断せず、実際に削除できた id だけを返す。
   */
  public List<String> bulkDelete(MessageFilter filter) {
    final List<String> deletedIds = new ArrayList<>();
    for (String messageId : matchIds(filter)) {
      try {
        final boolean deleted = repository.deleteById(messageId);
        timerRegistry.cancel(messageId);
        if (deleted) {
          deletedIds.add(messageId);
        }
      } catch (RuntimeException ex) {
        logger.warn("bulk delete failed for scheduled message id={}", messageId, ex);
        metrics.recordDependencyError("bulk_delete");
      }
    }
    logger.info(
        "bulk delete finished prefix={} contains={} deleted={}",
        filter.prefix(),
        filter.contains(),
        deletedIds.size());
    return deletedIds;
  }
}
