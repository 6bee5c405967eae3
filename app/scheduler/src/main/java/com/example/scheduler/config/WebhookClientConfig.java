/*
 * どこで: Scheduler 設定
 * 何を: webhook 配信専用 RestClient を提供する
 * なぜ: 配信先ごとに baseUrl を持たず、タイムアウトだけを共通で適用するため
 */
package com.example.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class WebhookClientConfig {

  @Bean
  RestClient webhookRestClient(RestClient.Builder builder, SchedulerProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.webhook().connectTimeout());
    requestFactory.setReadTimeout(properties.webhook().readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
