/*
 * どこで: Scheduler Web 層
 * 何を: リクエスト単位の相関情報を MDC へ載せ、完了時に処理結果を 1 行ログへ残す
 * なぜ: 予約 API のログと、その後のタイマー発火ログを message_id で突き合わせられるようにするため
 */
package com.example.scheduler.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final Logger logger = LoggerFactory.getLogger(RequestMdcInterceptor.class);

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final String ATTRIBUTE_STARTED_AT =
      RequestMdcInterceptor.class.getName() + ".STARTED_AT";
  private static final String[] REQUEST_ID_HEADERS = {"X-Request-Id", "X-Correlation-Id"};

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> context = new LinkedHashMap<>();
    final String requestId = resolveRequestId(request);
    context.put("request_id", requestId);
    // トレーサ未導入時は request_id を trace_id として流用する
    if (MDC.get("trace_id") == null) {
      context.put("trace_id", requestId);
    }
    context.put("http_method", request.getMethod());
    context.put("http_path", request.getRequestURI());
    context.put("client_ip", resolveClientIp(request));
    context.put("message_id", resolvePathVariable(request, "messageId"));

    context.values().removeIf(value -> value == null || value.isBlank());
    context.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, context.keySet());
    request.setAttribute(ATTRIBUTE_STARTED_AT, System.nanoTime());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_STARTED_AT) instanceof Long startedAt) {
      logger.info(
          "request completed status={} durationMs={}",
          response.getStatus(),
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
    }
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof Iterable<?> keys) {
      for (Object key : keys) {
        MDC.remove(String.valueOf(key));
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    for (String header : REQUEST_ID_HEADERS) {
      final String value = request.getHeader(header);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return TraceIds.newTraceId();
  }

  // 先頭の X-Forwarded-For がクライアント。無ければ直接の接続元
  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  // パス変数はハンドラ解決時に設定済み。POST /messages のように無い場合は null
  @Nullable
  private String resolvePathVariable(HttpServletRequest request, String name) {
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables) {
      final Object value = variables.get(name);
      return value == null ? null : value.toString();
    }
    return null;
  }
}
