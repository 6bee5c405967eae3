package com.example.scheduler.scheduling;

import com.example.scheduler.model.TimerSnapshot;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * メッセージ id ごとの発火タイマーを保持する登録簿。
 *
 * <p>全操作は単一の {@link ReentrantLock} で直列化する。ロックを保持するのは map の更新/コピーと TaskScheduler
 * への登録の間だけで、発火したコールバック（webhook 送信や Redis 削除）はロック外で実行される。
 */
@Component
public class TimerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(TimerRegistry.class);

  private final TaskScheduler taskScheduler;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, TimerEntry> entries = new HashMap<>();
  // 保存値は残っているがタイマーを失った id。再登録/取消で外れる
  private final Set<String> unarmed = new HashSet<>();
  private long generation;

  public TimerRegistry(TaskScheduler taskScheduler) {
    this.taskScheduler = taskScheduler;
  }

  /**
   * 役割: id のタイマーを登録し直す。 動作: 既存エントリがあれば先に取り消し、fireAt で発火する新しいタイマーを登録する。過去/現在時刻なら即時発火する。
   * 前提: 引数はすべて null でないこと。
   */
  public TimerTicket upsert(String messageId, Instant fireAt, Consumer<TimerTicket> onFire) {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(fireAt, "fireAt");
    Objects.requireNonNull(onFire, "onFire");
    lock.lock();
    try {
      cancel(messageId);
      unarmed.remove(messageId);
      final TimerTicket ticket = new TimerTicket(messageId, fireAt, ++generation);
      // 即時発火した場合もコールバックの片付けはこのロック解放まで待つため、put 前に消されることはない
      final ScheduledFuture<?> handle = taskScheduler.schedule(() -> onFire.accept(ticket), fireAt);
      entries.put(messageId, new TimerEntry(ticket, handle));
      logger.debug(
          "timer armed messageId={} fireAt={} generation={}",
          messageId,
          fireAt,
          ticket.generation());
      return ticket;
    } finally {
      lock.unlock();
    }
  }

  /** 役割: id のタイマーを取り消して外す。 動作: 未登録でもエラーにせず false を返す。発火中の処理は中断しない。 */
  public boolean cancel(String messageId) {
    lock.lock();
    try {
      unarmed.remove(messageId);
      final TimerEntry removed = entries.remove(messageId);
      if (removed == null) {
        return false;
      }
      removed.handle().cancel(false);
      logger.debug(
          "timer cancelled messageId={} generation={}",
          messageId,
          removed.ticket().generation());
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** 役割: 発火を終えた登録を外す。 動作: ticket が現在の登録と同じ世代の場合のみ外し、再登録済みなら何もしない。 */
  public boolean removeIfCurrent(TimerTicket ticket) {
    lock.lock();
    try {
      final TimerEntry current = entries.get(ticket.messageId());
      if (current == null || current.ticket().generation() != ticket.generation()) {
        return false;
      }
      entries.remove(ticket.messageId());
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: 発火時にストアを読めなかった登録を外し、未武装として記録する。 動作: ticket が現在の世代の場合のみ外して記録する。記録は次の upsert か
   * cancel まで残り、ヘルスチェックで報告される。
   */
  public boolean removeAndMarkUnarmed(TimerTicket ticket) {
    lock.lock();
    try {
      if (!removeIfCurrent(ticket)) {
        return false;
      }
      unarmed.add(ticket.messageId());
      logger.warn("timer dropped while record remains stored messageId={}", ticket.messageId());
      return true;
    } finally {
      lock.unlock();
    }
  }

  public List<String> unarmedIds() {
    final List<String> copy;
    lock.lock();
    try {
      copy = new ArrayList<>(unarmed);
    } finally {
      lock.unlock();
    }
    copy.sort(Comparator.naturalOrder());
    return List.copyOf(copy);
  }

  public int unarmedCount() {
    lock.lock();
    try {
      return unarmed.size();
    } finally {
      lock.unlock();
    }
  }

  public Optional<Instant> get(String messageId) {
    lock.lock();
    try {
      final TimerEntry entry = entries.get(messageId);
      return entry == null ? Optional.empty() : Optional.of(entry.ticket().fireAt());
    } finally {
      lock.unlock();
    }
  }

  /** 役割: 登録内容の時点コピーを返す。 動作: 発火時刻の昇順（同時刻は id 順）に並べた不変リストを返す。 */
  public List<TimerSnapshot> snapshot() {
    final List<TimerSnapshot> copy;
    lock.lock();
    try {
      copy = new ArrayList<>(entries.size());
      for (TimerEntry entry : entries.values()) {
        copy.add(new TimerSnapshot(entry.ticket().messageId(), entry.ticket().fireAt()));
      }
    } finally {
      lock.unlock();
    }
    copy.sort(
        Comparator.comparing(TimerSnapshot::fireAt).thenComparing(TimerSnapshot::messageId));
    return List.copyOf(copy);
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** 停止時に未発火タイマーをすべて取り消す。永続化済みの予約は次回起動時の復元で再登録される。 */
  @PreDestroy
  public void cancelAll() {
    lock.lock();
    try {
      for (TimerEntry entry : entries.values()) {
        entry.handle().cancel(false);
      }
      if (!entries.isEmpty()) {
        logger.info("cancelled outstanding timers count={}", entries.size());
      }
      entries.clear();
      unarmed.clear();
    } finally {
      lock.unlock();
    }
  }

  private record TimerEntry(TimerTicket ticket, ScheduledFuture<?> handle) {}
}
