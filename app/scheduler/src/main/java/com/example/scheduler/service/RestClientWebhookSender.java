package com.example.scheduler.service;

import com.example.scheduler.model.ScheduledMessage;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class RestClientWebhookSender implements WebhookSender {

  private static final Logger logger = LoggerFactory.getLogger(RestClientWebhookSender.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient webhookRestClient;

  public RestClientWebhookSender(RestClient webhookRestClient) {
    this.webhookRestClient = webhookRestClient;
  }

  @Override
  public void send(ScheduledMessage message) {
    final URI target = toUri(message);
    try {
      webhookRestClient
          .post()
          .uri(target)
          .contentType(MediaType.APPLICATION_JSON)
          .body(message.payload())
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "webhook responded with error messageId={} status={} statusText={}",
          message.messageId(),
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new WebhookDeliveryException(
          WebhookDeliveryException.Reason.REJECTED,
          message.messageId(),
          "webhook responded with status " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new WebhookDeliveryException(
            WebhookDeliveryException.Reason.TIMEOUT,
            message.messageId(),
            "webhook request timeout",
            ex);
      }
      throw new WebhookDeliveryException(
          WebhookDeliveryException.Reason.CONNECTION_FAILED,
          message.messageId(),
          "webhook connection failed",
          ex);
    }
  }

  private URI toUri(ScheduledMessage message) {
    try {
      final URI uri = URI.create(message.webhookUrl());
      if (!uri.isAbsolute()) {
        throw new IllegalArgumentException("webhookUrl must be absolute");
      }
      return uri;
    } catch (IllegalArgumentException ex) {
      throw new WebhookDeliveryException(
          WebhookDeliveryException.Reason.INVALID_URL,
          message.messageId(),
          "webhookUrl is invalid",
          ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
