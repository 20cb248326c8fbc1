package com.example.pipeline.api;

public class InvalidWebhookPayloadException extends RuntimeException {

  public InvalidWebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
