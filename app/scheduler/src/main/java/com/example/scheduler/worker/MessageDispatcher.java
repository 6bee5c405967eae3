package com.example.scheduler.worker;

import com.example.common.TraceIds;
import com.example.scheduler.model.ScheduledMessage;
import com.example.scheduler.repository.MessageDecodeException;
import com.example.scheduler.repository.ScheduledMessageRepository;
import com.example.scheduler.scheduling.TimerRegistry;
import com.example.scheduler.scheduling.TimerTicket;
import com.example.scheduler.service.SchedulerMetrics;
import com.example.scheduler.service.WebhookDeliveryException;
import com.example.scheduler.service.WebhookSender;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * タイマー発火時に 1 回だけ webhook 配信を行い、配信結果に関わらず保存値と登録簿エントリを片付ける。
 *
 * <p>TimerRegistry のロック外で実行される。ロックを取るのは最後の登録簿エントリ除去だけ。
 */
@Component
public class MessageDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(MessageDispatcher.class);

  private final ScheduledMessageRepository repository;
  private final WebhookSender webhookSender;
  private final TimerRegistry timerRegistry;
  private final SchedulerMetrics metrics;

  public MessageDispatcher(
      ScheduledMessageRepository repository,
      WebhookSender webhookSender,
      TimerRegistry timerRegistry,
      SchedulerMetrics metrics) {
    this.repository = repository;
    this.webhookSender = webhookSender;
    this.timerRegistry = timerRegistry;
    this.metrics = metrics;
  }

  public void dispatch(TimerTicket ticket) {
    MDC.put("message_id", ticket.messageId());
    MDC.put("trace_id", TraceIds.newTraceId());
    try {
      dispatchOnce(ticket);
    } finally {
      MDC.remove("message_id");
      MDC.remove("trace_id");
    }
  }

  private void dispatchOnce(TimerTicket ticket) {
    final Optional<ScheduledMessage> current;
    try {
      current = repository.findById(ticket.messageId());
    } catch (MessageDecodeException ex) {
      logger.error("scheduled message unreadable at fire time id={}", ticket.messageId(), ex);
      metrics.recordDependencyError("dispatch_decode");
      timerRegistry.removeAndMarkUnarmed(ticket);
      return;
    } catch (DataAccessException ex) {
      // 保存値は残り次回起動時の復元で再登録される。それまでは /health に未武装として出る
      logger.error("store unavailable at fire time id={}", ticket.messageId(), ex);
      metrics.recordDependencyError("dispatch_store_unavailable");
      timerRegistry.removeAndMarkUnarmed(ticket);
      return;
    }

    if (current.isEmpty()) {
      logger.info("scheduled message already removed; skipping id={}", ticket.messageId());
      metrics.recordDispatch("skipped_missing");
      timerRegistry.removeIfCurrent(ticket);
      return;
    }
    final ScheduledMessage message = current.get();
    if (!message.fireAt().equals(ticket.fireAt())) {
      // 発火時刻が変わっていれば再予約済み。配信は新しい登録に任せる
      logger.info(
          "scheduled message rescheduled; skipping id={} firedFor={} current={}",
          message.messageId(),
          ticket.fireAt(),
          message.fireAt());
      metrics.recordDispatch("skipped_superseded");
      timerRegistry.removeIfCurrent(ticket);
      return;
    }

    try {
      webhookSender.send(message);
      metrics.recordDispatch("delivered");
      logger.info("webhook fired successfully id={}", message.messageId());
    } catch (WebhookDeliveryException ex) {
      metrics.recordDispatch("failed");
      logger.warn(
          "failed to fire webhook id={} reason={}", message.messageId(), ex.reason(), ex);
    } catch (RuntimeException ex) {
      metrics.recordDispatch("failed");
      logger.warn("failed to fire webhook id={}", message.messageId(), ex);
    } finally {
      cleanup(ticket, message);
    }
  }

  private void cleanup(TimerTicket ticket, ScheduledMessage delivered) {
    try {
      if (repository.deleteIfUnchanged(delivered)) {
        logger.info("scheduled message cleaned from store id={}", delivered.messageId());
      } else {
        logger.info(
            "scheduled message changed during dispatch; keeping newer record id={}",
            delivered.messageId());
      }
    } catch (RuntimeException ex) {
      logger.error(
          "failed to delete dispatched message from store id={}", delivered.messageId(), ex);
      metrics.recordDependencyError("dispatch_cleanup");
    } finally {
      timerRegistry.removeIfCurrent(ticket);
    }
  }
}
