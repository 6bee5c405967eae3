/*
 * どこで: Scheduler API
 * 何を: Redis 疎通を含む簡易ヘルスレスポンスを返す
 * なぜ: 認証なしで監視系から状態確認できるようにするため
 */
package com.example.scheduler.api;

import com.example.scheduler.api.response.HealthResponse;
import com.example.scheduler.service.ScheduledMessageService;
import com.example.scheduler.service.ScheduledMessageService.HealthStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

  private final ScheduledMessageService scheduledMessageService;

  @GetMapping("/health")
  public HealthResponse health() {
    final HealthStatus status = scheduledMessageService.healthCheck();
    final HealthResponse response =
        status.storeReachable()
            ? HealthResponse.healthy()
            : HealthResponse.unhealthy(status.error());
    return response.withUnarmed(status.unarmedMessageIds());
  }
}
