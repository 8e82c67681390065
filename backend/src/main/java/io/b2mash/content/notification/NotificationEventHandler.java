package io.b2mash.content.notification;

import io.b2mash.content.event.CommentCreatedEvent;
import io.b2mash.content.event.TaskAssignedEvent;
import io.b2mash.content.event.TaskStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Listens to domain events and dispatches notifications for them. Handlers run AFTER_COMMIT, so
 * only committed changes notify anyone, and a failure here never reaches the caller's request.
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationService notificationService;
  private final NotificationDispatcher notificationDispatcher;

  public NotificationEventHandler(
      NotificationService notificationService, NotificationDispatcher notificationDispatcher) {
    this.notificationService = notificationService;
    this.notificationDispatcher = notificationDispatcher;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onCommentCreated(CommentCreatedEvent event) {
    try {
      notificationDispatcher.dispatchAll(notificationService.handleCommentCreated(event));
    } catch (Exception e) {
      log.warn("Failed to notify for comment.created event={}", event.entityId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTaskAssigned(TaskAssignedEvent event) {
    try {
      notificationDispatcher.dispatchAll(notificationService.handleTaskAssigned(event));
    } catch (Exception e) {
      log.warn("Failed to notify for task.assigned event={}", event.entityId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTaskStatusChanged(TaskStatusChangedEvent event) {
    try {
      notificationDispatcher.dispatchAll(notificationService.handleTaskStatusChanged(event));
    } catch (Exception e) {
      log.warn("Failed to notify for task.status_changed event={}", event.entityId(), e);
    }
  }
}
