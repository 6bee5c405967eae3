package com.example.scheduler.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleInvalidRequestReturns400() {
    final var response =
        handler.handleInvalidRequest(new InvalidScheduleRequestException("bad"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo(new ApiErrorResponse("SCHEDULER_BAD_REQUEST", "bad"));
  }

  @Test
  void handleValidationReturnsFirstFieldError() throws NoSuchMethodException {
    final BeanPropertyBindingResult bindingResult =
        new BeanPropertyBindingResult(new Object(), "request");
    bindingResult.addError(new FieldError("request", "webhookUrl", "must not be blank"));
    final MethodParameter parameter =
        new MethodParameter(
            ApiExceptionHandlerTest.class.getDeclaredMethod("sampleHandler", String.class), 0);

    final var response =
        handler.handleValidation(new MethodArgumentNotValidException(parameter, bindingResult));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse("SCHEDULER_VALIDATION_ERROR", "webhookUrl must not be blank"));
  }

  @Test
  void handleUnreadableBodyHidesParserDetails() {
    final HttpInputMessage input = new MockHttpInputMessage(new byte[0]);
    final var response =
        handler.handleUnreadableBody(
            new HttpMessageNotReadableException("JSON parse error: Unexpected character", input));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("SCHEDULER_VALIDATION_ERROR", "request body is invalid"));
  }

  @Test
  void handleNotFoundReturns404() {
    final var response = handler.handleNotFound(new MessageNotFoundException("m1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo("SCHEDULER_MESSAGE_NOT_FOUND");
    assertThat(response.getBody().message()).contains("m1");
  }

  @Test
  void handleStoreUnavailableReturns503() {
    final var response =
        handler.handleStoreUnavailable(new RedisConnectionFailureException("refused"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().code()).isEqualTo("SCHEDULER_STORE_UNAVAILABLE");
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new RuntimeException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("SCHEDULER_INTERNAL_ERROR");
  }

  @SuppressWarnings("unused")
  private void sampleHandler(String body) {
    // MethodParameter 生成用
  }
}
