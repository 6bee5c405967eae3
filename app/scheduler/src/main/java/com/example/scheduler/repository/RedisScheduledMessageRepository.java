package com.example.scheduler.repository;

import com.example.common.IsoTimestamps;
import com.example.scheduler.config.SchedulerProperties;
import com.example.scheduler.model.ScheduledMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisScheduledMessageRepository implements ScheduledMessageRepository {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final RedisScript<Long> compareAndDeleteScript;
  private final SchedulerProperties properties;

  public RedisScheduledMessageRepository(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RedisScript<Long> compareAndDeleteScript,
      SchedulerProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.compareAndDeleteScript = compareAndDeleteScript;
    this.properties = properties;
  }

  @Override
  public void save(ScheduledMessage message) {
    redisTemplate.opsForValue().set(messageKey(message.messageId()), encode(message));
  }

  @Override
  public Optional<ScheduledMessage> findById(String messageId) {
    final String raw = redisTemplate.opsForValue().get(messageKey(messageId));
    if (raw == null) {
      return Optional.empty();
    }
    return Optional.of(decode(messageId, raw));
  }

  @Override
  public boolean existsById(String messageId) {
    return Boolean.TRUE.equals(redisTemplate.hasKey(messageKey(messageId)));
  }

  @Override
  public boolean deleteById(String messageId) {
    return Boolean.TRUE.equals(redisTemplate.delete(messageKey(messageId)));
  }

  @Override
  public boolean deleteIfUnchanged(ScheduledMessage expected) {
    final String key = messageKey(expected.messageId());
    final String raw = redisTemplate.opsForValue().get(key);
    if (raw == null) {
      return false;
    }
    final ScheduledMessage current;
    try {
      current = decode(expected.messageId(), raw);
    } catch (MessageDecodeException ex) {
      // 配信後に壊れた値で上書きされた場合も「変更あり」とみなす
      return false;
    }
    if (!current.equals(expected)) {
      return false;
    }
    // 読み取った生値で比較削除し、GET から DEL までの間の上書きを取りこぼさない
    final Long deleted = redisTemplate.execute(compareAndDeleteScript, List.of(key), raw);
    return deleted != null && deleted > 0;
  }

  @Override
  public List<String> scanIds(String idPrefix) {
    final String keyPrefix = properties.keyPrefix();
    final ScanOptions options =
        ScanOptions.scanOptions()
            .match(escapeGlob(keyPrefix) + escapeGlob(idPrefix) + "*")
            .count(properties.scanCount())
            .build();
    // SCAN は同一キーを複数回返しうるため重複を除く
    final Set<String> ids = new LinkedHashSet<>();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        final String key = cursor.next();
        if (key != null && key.startsWith(keyPrefix)) {
          ids.add(key.substring(keyPrefix.length()));
        }
      }
    }
    return new ArrayList<>(ids);
  }

  @Override
  public void ping() {
    redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
  }

  @VisibleForTesting
  String messageKey(String messageId) {
    return properties.keyPrefix() + messageId;
  }

  // SCAN MATCH の glob 特殊文字をリテラルとして扱う
  @VisibleForTesting
  static String escapeGlob(String value) {
    final StringBuilder escaped = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  private String encode(ScheduledMessage message) {
    final StoredMessage stored =
        new StoredMessage(
            message.messageId(),
            IsoTimestamps.format(message.fireAt()),
            message.payload(),
            message.webhookUrl());
    try {
      return objectMapper.writeValueAsString(stored);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("scheduled message serialization failed", ex);
    }
  }

  private ScheduledMessage decode(String messageId, String raw) {
    final StoredMessage stored;
    try {
      stored = objectMapper.readValue(raw, StoredMessage.class);
    } catch (JsonProcessingException ex) {
      throw new MessageDecodeException(messageId, "stored message is not valid json", ex);
    }
    if (stored == null || isBlank(stored.scheduleTo()) || isBlank(stored.webhookUrl())) {
      throw new MessageDecodeException(messageId, "stored message is missing fields", null);
    }
    // キーから得た id を正とし、値側の id は参照しない
    try {
      return new ScheduledMessage(
          messageId,
          IsoTimestamps.parseToInstant(stored.scheduleTo()),
          stored.payload(),
          stored.webhookUrl());
    } catch (DateTimeParseException ex) {
      throw new MessageDecodeException(messageId, "stored scheduleTo is not a timestamp", ex);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
