package com.example.scheduler.api.response;

import java.util.List;

public record BulkDeleteResponse(int deleted, List<String> messageIds) {

  public BulkDeleteResponse {
    messageIds = List.copyOf(messageIds);
  }
}
