package com.example.scheduler.api.response;

import java.util.List;

public record SearchMessagesResponse(int count, List<MessageSearchItem> messages) {

  public SearchMessagesResponse {
    messages = List.copyOf(messages);
  }
}
