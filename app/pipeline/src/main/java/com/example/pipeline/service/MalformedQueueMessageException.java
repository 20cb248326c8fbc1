package com.example.pipeline.service;

public class MalformedQueueMessageException extends RuntimeException {

  public MalformedQueueMessageException(String message) {
    super(message);
  }

  public MalformedQueueMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
