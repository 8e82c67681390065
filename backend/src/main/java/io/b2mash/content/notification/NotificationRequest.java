package io.b2mash.content.notification;

import java.util.Map;

/** Body of {@code POST /notifications/send} on the notification service. */
public record NotificationRequest(
    String userId, NotificationType type, String title, String body, Map<String, String> metadata) {

  public NotificationRequest {
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }
}
