/*
 * どこで: Scheduler Web 設定
 * 何を: RequestMdcInterceptor を予約 API とヘルスチェックへ適用する
 * なぜ: API ログへ request_id/message_id を安定して埋め込むため
 */
package com.example.scheduler.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(requestMdcInterceptor)
        .addPathPatterns("/messages", "/messages/**", "/health");
  }
}
