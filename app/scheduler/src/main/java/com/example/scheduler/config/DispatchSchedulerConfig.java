/*
 * どこで: Scheduler インフラ設定
 * 何を: タイマー発火と webhook 配信を実行する TaskScheduler を提供する
 * なぜ: 配信 IO を API スレッドから切り離し、プールサイズを設定で制御するため
 */
package com.example.scheduler.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class DispatchSchedulerConfig {

  // タイマー発火と過去時刻判定で同じ時計を使う
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  ThreadPoolTaskScheduler dispatchTaskScheduler(SchedulerProperties properties, Clock clock) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.dispatchPoolSize());
    scheduler.setThreadNamePrefix("webhook-dispatch-");
    scheduler.setRemoveOnCancelPolicy(true);
    // 停止時は未発火タイマーを待たない。永続化済みの予約は次回起動時に復元される
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.setClock(clock);
    return scheduler;
  }
}
