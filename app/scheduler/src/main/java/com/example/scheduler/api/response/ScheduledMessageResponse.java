package com.example.scheduler.api.response;

import com.example.common.IsoTimestamps;
import com.example.scheduler.model.ScheduledMessage;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "payload はドメインモデル側で不変ビューになっているため")
public record ScheduledMessageResponse(
    String id, String scheduleTo, Map<String, Object> payload, String webhookUrl) {

  public static ScheduledMessageResponse from(ScheduledMessage message) {
    return new ScheduledMessageResponse(
        message.messageId(),
        IsoTimestamps.format(message.fireAt()),
        message.payload(),
        message.webhookUrl());
  }
}
