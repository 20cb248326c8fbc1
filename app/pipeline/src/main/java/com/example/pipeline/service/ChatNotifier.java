package com.example.pipeline.service;

/**
 * Posts pipeline status to the chat integration.
 *
 * <p>Implementations throw {@link ChatNotificationException} on failure; callers log it and
 * carry on.
 */
public interface ChatNotifier {

  void notifyCancelled(String executionId);

  void notifyCompleted(String executionId, String resultUrl);

  void notifyFailed(String executionId, String reason);
}
