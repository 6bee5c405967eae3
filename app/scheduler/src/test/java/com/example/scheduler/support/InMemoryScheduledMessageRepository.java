/*
 * どこで: Scheduler テスト支援
 * 何を: Redis を使わない ScheduledMessageRepository のメモリ実装
 * なぜ: サービス層/配信ワーカーの振る舞いをストア実装から切り離して検証するため
 */
package com.example.scheduler.support;

import com.example.scheduler.model.ScheduledMessage;
import com.example.scheduler.repository.ScheduledMessageRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryScheduledMessageRepository implements ScheduledMessageRepository {

  private final ConcurrentSkipListMap<String, ScheduledMessage> messages =
      new ConcurrentSkipListMap<>();

  @Override
  public void save(ScheduledMessage message) {
    messages.put(message.messageId(), message);
  }

  @Override
  public Optional<ScheduledMessage> findById(String messageId) {
    return Optional.ofNullable(messages.get(messageId));
  }

  @Override
  public boolean existsById(String messageId) {
    return messages.containsKey(messageId);
  }

  @Override
  public boolean deleteById(String messageId) {
    return messages.remove(messageId) != null;
  }

  @Override
  public boolean deleteIfUnchanged(ScheduledMessage expected) {
    return messages.remove(expected.messageId(), expected);
  }

  @Override
  public List<String> scanIds(String idPrefix) {
    final List<String> ids = new ArrayList<>();
    for (Map.Entry<String, ScheduledMessage> entry : messages.tailMap(idPrefix).entrySet()) {
      if (!entry.getKey().startsWith(idPrefix)) {
        break;
      }
      ids.add(entry.getKey());
    }
    return ids;
  }

  @Override
  public void ping() {
    // メモリ実装は常に到達可能
  }

  public int size() {
    return messages.size();
  }
}
