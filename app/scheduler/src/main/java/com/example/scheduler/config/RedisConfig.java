/*
 * どこで: Scheduler インフラ設定
 * 何を: StringRedisTemplate と比較削除用 Lua スクリプトを提供する
 * なぜ: 配信後の削除を「配信した内容のままなら削除」に限定し、再予約を消さないため
 */
package com.example.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

@Configuration
public class RedisConfig {

  // KEYS[1] の値が ARGV[1] と一致する場合のみ削除し、削除件数を返す
  static final String COMPARE_AND_DELETE_LUA =
      """
      if redis.call('GET', KEYS[1]) == ARGV[1] then
        return redis.call('DEL', KEYS[1])
      end
      return 0
      """;

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  @Bean
  RedisScript<Long> compareAndDeleteScript() {
    return RedisScript.of(COMPARE_AND_DELETE_LUA, Long.class);
  }
}
