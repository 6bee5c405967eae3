package com.example.scheduler.worker;

import com.example.scheduler.model.ScheduledMessage;
import com.example.scheduler.repository.MessageDecodeException;
import com.example.scheduler.repository.ScheduledMessageRepository;
import com.example.scheduler.scheduling.TimerRegistry;
import com.example.scheduler.service.SchedulerMetrics;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * 起動時に 1 回だけ Redis の予約メッセージを走査し、タイマー登録簿を再構築する。
 *
 * <p>全シングルトン生成後・Web サーバ起動前に同期実行されるため、API 受付開始時には復元が終わっている。保存値は書き換えない。
 */
@Component
@ConditionalOnProperty(
    name = "scheduler.restore-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ScheduleRestorer implements SmartInitializingSingleton {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleRestorer.class);

  private final ScheduledMessageRepository repository;
  private final TimerRegistry timerRegistry;
  private final MessageDispatcher dispatcher;
  private final SchedulerMetrics metrics;

  public ScheduleRestorer(
      ScheduledMessageRepository repository,
      TimerRegistry timerRegistry,
      MessageDispatcher dispatcher,
      SchedulerMetrics metrics) {
    this.repository = repository;
    this.timerRegistry = timerRegistry;
    this.dispatcher = dispatcher;
    this.metrics = metrics;
  }

  @Override
  public void afterSingletonsInstantiated() {
    restore();
  }

  public RestoreResult restore() {
    final List<String> messageIds;
    try {
      messageIds = repository.scanIds("");
    } catch (DataAccessException ex) {
      // Redis 停止中でもプロセスは起動させ、health で検知できるようにする
      logger.error("failed to scan scheduled messages; restore skipped", ex);
      metrics.recordDependencyError("restore_scan");
      return new RestoreResult(0, 0);
    }

    int restored = 0;
    int failed = 0;
    for (String messageId : messageIds) {
      try {
        final Optional<ScheduledMessage> message = repository.findById(messageId);
        if (message.isEmpty()) {
          continue;
        }
        timerRegistry.upsert(messageId, message.get().fireAt(), dispatcher::dispatch);
        restored++;
        metrics.recordRestore("restored");
        logger.info(
            "restored scheduled message id={} fireAt={}", messageId, message.get().fireAt());
      } catch (MessageDecodeException | DataAccessException ex) {
        failed++;
        metrics.recordRestore("failed");
        logger.warn("failed to restore scheduled message id={}", messageId, ex);
      }
    }
    logger.info("restored scheduled messages restored={} failed={}", restored, failed);
    return new RestoreResult(restored, failed);
  }

  public record RestoreResult(int restored, int failed) {}
}
