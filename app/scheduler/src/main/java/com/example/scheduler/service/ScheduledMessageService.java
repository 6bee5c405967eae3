/*
 * どこで: Scheduler サービス層
 * 何を: 予約/取得/検索/削除/一覧/ヘルスチェックの各操作をまとめる
 * なぜ: API 層から Redis とタイマー登録簿の同期手順を隠蔽するため
 */
package com.example.scheduler.service;

import com.example.common.IsoTimestamps;
import com.example.scheduler.api.InvalidScheduleRequestException;
import com.example.scheduler.api.MessageNotFoundException;
import com.example.scheduler.model.AnnotatedMessage;
import com.example.scheduler.model.ScheduledMessage;
import com.example.scheduler.model.TimerSnapshot;
import com.example.scheduler.repository.ScheduledMessageRepository;
import com.example.scheduler.scheduling.TimerRegistry;
import com.example.scheduler.worker.MessageDispatcher;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ScheduledMessageService {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledMessageService.class);

  private final ScheduledMessageRepository repository;
  private final TimerRegistry timerRegistry;
  private final MessageDispatcher messageDispatcher;
  private final MessageLookupService lookupService;
  private final Clock clock;

  public ScheduledMessageService(
      ScheduledMessageRepository repository,
      TimerRegistry timerRegistry,
      MessageDispatcher messageDispatcher,
      MessageLookupService lookupService,
      Clock clock) {
    this.repository = repository;
    this.timerRegistry = timerRegistry;
    this.messageDispatcher = messageDispatcher;
    this.lookupService = lookupService;
    this.clock = clock;
  }

  /**
   * 役割: メッセージを保存しタイマーを登録する。
   *
   * <p>動作: 同じ id が既にあれば保存値とタイマーを置き換える。保存に失敗した場合はタイマーを触らない。
   *
   * <p>前提: scheduleTo はオフセット付き ISO-8601。オフセット無しは UTC とみなす。
   */
  public ScheduledMessage schedule(
      String messageId, String scheduleTo, Map<String, Object> payload, String webhookUrl) {
    if (messageId == null || messageId.isBlank()) {
      throw new InvalidScheduleRequestException("id is required");
    }
    final Instant fireAt = parseScheduleTo(scheduleTo);
    validateWebhookUrl(webhookUrl);
    final ScheduledMessage message = new ScheduledMessage(messageId, fireAt, payload, webhookUrl);

    if (repository.existsById(messageId)) {
      logger.info("message exists, updating id={} fireAt={}", messageId, fireAt);
    } else {
      logger.info("creating new message id={} fireAt={}", messageId, fireAt);
    }
    repository.save(message);
    timerRegistry.upsert(messageId, fireAt, messageDispatcher::dispatch);
    if (fireAt.isBefore(clock.instant())) {
      logger.info("scheduled time already passed; firing immediately id={}", messageId);
    }
    return message;
  }

  public ScheduledMessage get(String messageId) {
    return repository
        .findById(messageId)
        .orElseThrow(() -> new MessageNotFoundException(messageId));
  }

  public List<AnnotatedMessage> search(String prefix, String contains) {
    return lookupService.search(MessageFilter.of(prefix, contains));
  }

  /** 役割: 1 件削除する。 動作: 保存値が無ければ NotFound。タイマーだけ残っていても取り消す。 */
  public void delete(String messageId) {
    final boolean deleted = repository.deleteById(messageId);
    timerRegistry.cancel(messageId);
    if (!deleted) {
      throw new MessageNotFoundException(messageId);
    }
    logger.info("deleted scheduled message id={}", messageId);
  }

  public List<String> bulkDelete(String prefix, String contains) {
    return lookupService.bulkDelete(MessageFilter.of(prefix, contains));
  }

  public List<TimerSnapshot> listInMemory() {
    return timerRegistry.snapshot();
  }

  /** 役割: ストア疎通を確認する。 動作: 例外は外へ出さず、unhealthy として原因文字列を返す。 */
  public HealthStatus healthCheck() {
    try {
      repository.ping();
      return HealthStatus.healthy(timerRegistry.unarmedIds());
    } catch (RuntimeException ex) {
      logger.warn("redis health check failed", ex);
      final String error = ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage();
      return HealthStatus.unhealthy(error, timerRegistry.unarmedIds());
    }
  }

  private static Instant parseScheduleTo(String scheduleTo) {
    try {
      return IsoTimestamps.parseToInstant(scheduleTo);
    } catch (DateTimeParseException ex) {
      throw new InvalidScheduleRequestException("invalid scheduleTo: " + scheduleTo, ex);
    }
  }

  private static void validateWebhookUrl(String webhookUrl) {
    if (webhookUrl == null || webhookUrl.isBlank()) {
      throw new InvalidScheduleRequestException("webhookUrl is required");
    }
    final URI uri;
    try {
      uri = new URI(webhookUrl);
    } catch (URISyntaxException ex) {
      throw new InvalidScheduleRequestException("invalid webhookUrl: " + webhookUrl, ex);
    }
    final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
      throw new InvalidScheduleRequestException("webhookUrl must be an absolute http(s) URL");
    }
  }

  /** unarmedMessageIds は保存済みだが発火タイマーを失った id（再予約か再起動で解消する）。 */
  public record HealthStatus(boolean storeReachable, String error, List<String> unarmedMessageIds) {

    public HealthStatus {
      unarmedMessageIds = unarmedMessageIds == null ? List.of() : List.copyOf(unarmedMessageIds);
    }

    static HealthStatus healthy(List<String> unarmedMessageIds) {
      return new HealthStatus(true, null, unarmedMessageIds);
    }

    static HealthStatus unhealthy(String error, List<String> unarmedMessageIds) {
      return new HealthStatus(false, error, unarmedMessageIds);
    }
  }
}
