package io.b2mash.content.notification;

import io.b2mash.content.event.CommentCreatedEvent;
import io.b2mash.content.event.TaskAssignedEvent;
import io.b2mash.content.event.TaskStatusChangedEvent;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Turns domain events into notification requests. Recipients are deduplicated and never include the
 * user who caused the event.
 */
@Service
public class NotificationService {

  public List<NotificationRequest> handleCommentCreated(CommentCreatedEvent event) {
    var recipients = recipients(event.actorId(), event.taskAssigneeId(), event.taskCreatedBy());
    var requests = new ArrayList<NotificationRequest>();
    for (String userId : recipients) {
      requests.add(
          new NotificationRequest(
              userId,
              NotificationType.COMMENT_ADDED,
              "New Comment",
              "New comment on task: " + event.taskTitle(),
              Map.of(
                  "taskId", event.taskId().toString(),
                  "commentAuthorId", event.actorId())));
    }
    return requests;
  }

  public List<NotificationRequest> handleTaskAssigned(TaskAssignedEvent event) {
    if (event.assigneeId() == null || event.assigneeId().equals(event.actorId())) {
      return List.of();
    }
    return List.of(
        new NotificationRequest(
            event.assigneeId(),
            NotificationType.TASK_ASSIGNED,
            "Task Assigned",
            "You have been assigned to task: " + event.taskTitle(),
            Map.of(
                "taskId", event.taskId().toString(),
                "assignedBy", event.actorId())));
  }

  public List<NotificationRequest> handleTaskStatusChanged(TaskStatusChangedEvent event) {
    var recipients = recipients(event.actorId(), event.assigneeId(), event.createdBy());
    var requests = new ArrayList<NotificationRequest>();
    for (String userId : recipients) {
      requests.add(
          new NotificationRequest(
              userId,
              NotificationType.TASK_STATUS_CHANGED,
              "Task Status Changed",
              "Task \"%s\" changed from %s to %s"
                  .formatted(event.taskTitle(), event.fromStatus(), event.toStatus()),
              Map.of(
                  "taskId", event.taskId().toString(),
                  "fromStatus", event.fromStatus(),
                  "toStatus", event.toStatus(),
                  "changedBy", event.actorId())));
    }
    return requests;
  }

  /** Candidates in order, without nulls, duplicates or the actor. */
  static Set<String> recipients(String actorId, String... candidates) {
    var recipients = new LinkedHashSet<String>();
    for (String candidate : candidates) {
      if (candidate != null) {
        recipients.add(candidate);
      }
    }
    recipients.removeIf(userId -> Objects.equals(userId, actorId));
    return recipients;
  }
}
