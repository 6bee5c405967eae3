package com.example.scheduler.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.scheduler.config.SchedulerProperties;
import com.example.scheduler.model.ScheduledMessage;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

class RedisScheduledMessageRepositoryTest {

  private static final Instant FIRE_AT = Instant.parse("2026-03-01T10:00:00Z");
  private static final String STORED_JSON =
      """
      {"id":"m1","scheduleTo":"2026-03-01T10:00:00Z","payload":{"a":1},\
      "webhookUrl":"http://example.test/hook"}""";

  private StringRedisTemplate redisTemplate;
  private ValueOperations<String, String> valueOps;
  private RedisScript<Long> compareAndDeleteScript;
  private RedisScheduledMessageRepository repository;

  @SuppressWarnings("unchecked")
  @BeforeEach
  void setUp() {
    redisTemplate = Mockito.mock(StringRedisTemplate.class);
    valueOps = Mockito.mock(ValueOperations.class);
    compareAndDeleteScript = Mockito.mock(RedisScript.class);
    when(redisTemplate.opsForValue()).thenReturn(valueOps);
    repository =
        new RedisScheduledMessageRepository(
            redisTemplate,
            new ObjectMapper(),
            compareAndDeleteScript,
            new SchedulerProperties(null, 0, 0, true, null));
  }

  @Test
  void saveWritesJsonUnderPrefixedKey() throws Exception {
    repository.save(message("m1", FIRE_AT));

    final ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    verify(valueOps).set(eq("message:m1"), json.capture());
    final Map<String, Object> stored =
        new ObjectMapper().readValue(json.getValue(), new TypeReference<Map<String, Object>>() {});
    assertThat(stored)
        .containsEntry("id", "m1")
        .containsEntry("scheduleTo", "2026-03-01T10:00:00Z")
        .containsEntry("payload", Map.of("a", 1))
        .containsEntry("webhookUrl", "http://example.test/hook");
  }

  @Test
  void findByIdDecodesStoredJson() {
    when(valueOps.get("message:m1")).thenReturn(STORED_JSON);

    assertThat(repository.findById("m1")).contains(message("m1", FIRE_AT));
  }

  @Test
  void findByIdReturnsEmptyWhenKeyMissing() {
    when(valueOps.get("message:m1")).thenReturn(null);

    assertThat(repository.findById("m1")).isEmpty();
  }

  @Test
  void findByIdTreatsTimestampWithoutOffsetAsUtc() {
    when(valueOps.get("message:m1"))
        .thenReturn(
            """
            {"id":"m1","scheduleTo":"2026-03-01T10:00:00","payload":{},\
            "webhookUrl":"http://example.test/hook"}""");

    assertThat(repository.findById("m1"))
        .get()
        .extracting(ScheduledMessage::fireAt)
        .isEqualTo(FIRE_AT);
  }

  @Test
  void findByIdRejectsUnreadableValues() {
    when(valueOps.get("message:broken")).thenReturn("{not json");
    when(valueOps.get("message:partial")).thenReturn("{\"id\":\"partial\"}");

    assertThatThrownBy(() -> repository.findById("broken"))
        .isInstanceOf(MessageDecodeException.class)
        .extracting(ex -> ((MessageDecodeException) ex).messageId())
        .isEqualTo("broken");
    assertThatThrownBy(() -> repository.findById("partial"))
        .isInstanceOf(MessageDecodeException.class);
  }

  @Test
  void deleteIfUnchangedComparesAgainstRawValue() {
    when(valueOps.get("message:m1")).thenReturn(STORED_JSON);
    when(redisTemplate.execute(
            eq(compareAndDeleteScript), eq(List.of("message:m1")), eq(STORED_JSON)))
        .thenReturn(1L);

    assertThat(repository.deleteIfUnchanged(message("m1", FIRE_AT))).isTrue();
  }

  @Test
  void deleteIfUnchangedKeepsRescheduledRecord() {
    when(valueOps.get("message:m1")).thenReturn(STORED_JSON);

    assertThat(repository.deleteIfUnchanged(message("m1", FIRE_AT.minusSeconds(60)))).isFalse();
    verify(redisTemplate, never()).execute(eq(compareAndDeleteScript), anyList(), any());
  }

  @Test
  void deleteByIdReportsWhetherKeyExisted() {
    when(redisTemplate.delete("message:m1")).thenReturn(Boolean.TRUE);
    when(redisTemplate.delete("message:m2")).thenReturn(Boolean.FALSE);

    assertThat(repository.deleteById("m1")).isTrue();
    assertThat(repository.deleteById("m2")).isFalse();
  }

  @SuppressWarnings("unchecked")
  @Test
  void scanIdsMatchesEscapedPrefixAndStripsNamespace() {
    final Cursor<String> cursor = Mockito.mock(Cursor.class);
    when(cursor.hasNext()).thenReturn(true, true, true, false);
    when(cursor.next()).thenReturn("message:acc*1_a", "message:acc*1_b", "message:acc*1_a");
    final ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
    when(redisTemplate.scan(options.capture())).thenReturn(cursor);

    final List<String> ids = repository.scanIds("acc*1_");

    assertThat(ids).containsExactly("acc*1_a", "acc*1_b");
    assertThat(options.getValue().getPattern()).isEqualTo("message:acc\\*1_*");
    assertThat(options.getValue().getCount()).isEqualTo(1000L);
    verify(cursor).close();
  }

  @Test
  void escapeGlobEscapesSpecialCharacters() {
    assertThat(RedisScheduledMessageRepository.escapeGlob("a?b[c]d\\e*"))
        .isEqualTo("a\\?b\\[c\\]d\\\\e\\*");
  }

  private static ScheduledMessage message(String messageId, Instant fireAt) {
    return new ScheduledMessage(messageId, fireAt, Map.of("a", 1), "http://example.test/hook");
  }
}
