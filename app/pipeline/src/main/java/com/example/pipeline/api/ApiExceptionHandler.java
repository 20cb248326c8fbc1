package com.example.pipeline.api;

import com.example.pipeline.service.PipelineConfigurationException;
import com.example.pipeline.service.QueuePublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidWebhookPayloadException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidPayload(InvalidWebhookPayloadException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("WEBHOOK_INVALID_PAYLOAD", ex.getMessage()));
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PIPELINE_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(QueuePublishException.class)
  public ResponseEntity<ApiErrorResponse> handleQueueUnavailable(QueuePublishException ex) {
    logger.error("queue write failed, asking the sender to retry", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("QUEUE_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(PipelineConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(PipelineConfigurationException ex) {
    logger.error(ex.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("PIPELINE_CONFIGURATION_ERROR", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled request failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("PIPELINE_INTERNAL_ERROR", ex.getMessage()));
  }
}
