package io.b2mash.content.notification;

/** Outbound port to the notification service. Implementations may block. */
public interface NotificationClient {

  void send(NotificationRequest request);
}
