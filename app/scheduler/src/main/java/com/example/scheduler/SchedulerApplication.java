/*
 * どこで: Scheduler アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: API + 配信タイマー + Redis 接続設定を単一アプリとして起動するため
 */
package com.example.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SchedulerApplication.class, args);
  }
}
