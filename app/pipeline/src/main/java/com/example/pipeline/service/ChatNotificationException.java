package com.example.pipeline.service;

public class ChatNotificationException extends RuntimeException {

  public ChatNotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
