/*
 * どこで: Scheduler 設定バインドテスト
 * 何を: scheduler.* の値と既定値が record へバインドされることを検証する
 * なぜ: Duration 表記やキー名の変更で起動時の設定が黙って既定値に戻る回帰を防ぐため
 */
package com.example.scheduler.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class SchedulerPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsExplicitValues() {
    contextRunner
        .withPropertyValues(
            "scheduler.key-prefix=sched:",
            "scheduler.scan-count=200",
            "scheduler.dispatch-pool-size=8",
            "scheduler.restore-enabled=false",
            "scheduler.webhook.connect-timeout=2s",
            "scheduler.webhook.read-timeout=10s",
            "scheduler.api.header-name=X-Api-Token",
            "scheduler.api.token=secret")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final SchedulerProperties properties = context.getBean(SchedulerProperties.class);
              final SchedulerApiProperties apiProperties =
                  context.getBean(SchedulerApiProperties.class);

              assertThat(properties.keyPrefix()).isEqualTo("sched:");
              assertThat(properties.scanCount()).isEqualTo(200);
              assertThat(properties.dispatchPoolSize()).isEqualTo(8);
              assertThat(properties.restoreEnabled()).isFalse();
              assertThat(properties.webhook().connectTimeout()).isEqualTo(Duration.ofSeconds(2));
              assertThat(properties.webhook().readTimeout()).isEqualTo(Duration.ofSeconds(10));
              assertThat(apiProperties.headerName()).isEqualTo("X-Api-Token");
              assertThat(apiProperties.token()).isEqualTo("secret");
            });
  }

  @Test
  void appliesDefaultsWhenUnset() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final SchedulerProperties properties = context.getBean(SchedulerProperties.class);
          final SchedulerApiProperties apiProperties =
              context.getBean(SchedulerApiProperties.class);

          assertThat(properties.keyPrefix()).isEqualTo("message:");
          assertThat(properties.scanCount()).isEqualTo(1000);
          assertThat(properties.dispatchPoolSize()).isEqualTo(4);
          assertThat(properties.restoreEnabled()).isTrue();
          assertThat(properties.webhook().readTimeout()).isEqualTo(Duration.ofSeconds(30));
          assertThat(apiProperties.headerName()).isEqualTo("Authorization");
          assertThat(apiProperties.token()).isEmpty();
        });
  }

  @Configuration
  @EnableConfigurationProperties({SchedulerProperties.class, SchedulerApiProperties.class})
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
