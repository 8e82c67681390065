package io.b2mash.content.notification;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Hands notification sends to the notification executor. A send never runs on the request thread,
 * and its failure is logged here and goes no further.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationClient notificationClient;
  private final Executor executor;

  public NotificationDispatcher(
      NotificationClient notificationClient,
      @Qualifier("notificationExecutor") Executor executor) {
    this.notificationClient = notificationClient;
    this.executor = executor;
  }

  public void dispatchAll(List<NotificationRequest> requests) {
    for (var request : requests) {
      dispatch(request);
    }
  }

  public void dispatch(NotificationRequest request) {
    try {
      executor.execute(() -> send(request));
    } catch (RejectedExecutionException e) {
      log.warn(
          "Notification executor rejected type={} userId={}", request.type(), request.userId(), e);
    }
  }

  private void send(NotificationRequest request) {
    try {
      notificationClient.send(request);
      log.debug("Sent notification type={} userId={}", request.type(), request.userId());
    } catch (Exception e) {
      log.warn(
          "Failed to send notification type={} userId={}", request.type(), request.userId(), e);
    }
  }
}
