package com.example.pipeline.service;

public class QueuePublishException extends RuntimeException {

  public QueuePublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
