/*
 * どこで: Scheduler API
 * 何を: 予約/取得/検索/削除/一覧エンドポイントを公開する
 * なぜ: 外部システムからの webhook 予約要求を受け付ける入口を提供するため
 */
package com.example.scheduler.api;

import com.example.common.IsoTimestamps;
import com.example.scheduler.api.request.ScheduleMessageRequest;
import com.example.scheduler.api.response.BulkDeleteResponse;
import com.example.scheduler.api.response.MessageSearchItem;
import com.example.scheduler.api.response.MessageStatusResponse;
import com.example.scheduler.api.response.ScheduledJobItem;
import com.example.scheduler.api.response.ScheduledJobsResponse;
import com.example.scheduler.api.response.ScheduledMessageResponse;
import com.example.scheduler.api.response.SearchMessagesResponse;
import com.example.scheduler.service.ScheduledMessageService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/messages")
@RequiredArgsConstructor
public class ScheduledMessageController {

  private final ScheduledMessageService scheduledMessageService;

  @PostMapping
  public ResponseEntity<MessageStatusResponse> schedule(
      @Valid @RequestBody ScheduleMessageRequest request) {
    scheduledMessageService.schedule(
        request.id(), request.scheduleTo(), request.payload(), request.webhookUrl());
    return ResponseEntity.ok(MessageStatusResponse.scheduled(request.id()));
  }

  @GetMapping
  public ResponseEntity<ScheduledJobsResponse> listScheduledJobs() {
    final List<ScheduledJobItem> jobs =
        scheduledMessageService.listInMemory().stream()
            .map(
                snapshot ->
                    new ScheduledJobItem(
                        snapshot.messageId(), IsoTimestamps.format(snapshot.fireAt())))
            .toList();
    return ResponseEntity.ok(new ScheduledJobsResponse(jobs, jobs.size()));
  }

  // "/search" と "/bulk" はリテラルのため {messageId} より優先してマッチする
  @GetMapping("/search")
  public ResponseEntity<SearchMessagesResponse> search(
      @RequestParam(name = "prefix", required = false) String prefix,
      @RequestParam(name = "contains", required = false) String contains) {
    final List<MessageSearchItem> items =
        scheduledMessageService.search(prefix, contains).stream()
            .map(MessageSearchItem::from)
            .toList();
    return ResponseEntity.ok(new SearchMessagesResponse(items.size(), items));
  }

  @DeleteMapping("/bulk")
  public ResponseEntity<BulkDeleteResponse> bulkDelete(
      @RequestParam(name = "prefix", required = false) String prefix,
      @RequestParam(name = "contains", required = false) String contains) {
    final List<String> deletedIds = scheduledMessageService.bulkDelete(prefix, contains);
    return ResponseEntity.ok(new BulkDeleteResponse(deletedIds.size(), deletedIds));
  }

  @GetMapping("/{messageId}")
  public ResponseEntity<ScheduledMessageResponse> getMessage(
      @PathVariable("messageId") String messageId) {
    return ResponseEntity.ok(
        ScheduledMessageResponse.from(scheduledMessageService.get(messageId)));
  }

  @DeleteMapping("/{messageId}")
  public ResponseEntity<MessageStatusResponse> deleteMessage(
      @PathVariable("messageId") String messageId) {
    scheduledMessageService.delete(messageId);
    return ResponseEntity.ok(MessageStatusResponse.deleted(messageId));
  }
}
