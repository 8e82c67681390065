package io.b2mash.content.notification;

public class NotificationDeliveryException extends RuntimeException {

  public NotificationDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
