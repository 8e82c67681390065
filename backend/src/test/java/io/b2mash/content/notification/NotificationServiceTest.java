package io.b2mash.content.notification;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.content.event.CommentCreatedEvent;
import io.b2mash.content.event.TaskAssignedEvent;
import io.b2mash.content.event.TaskStatusChangedEvent;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class NotificationServiceTest {

  private static final UUID TASK_ID = UUID.randomUUID();
  private static final UUID PROJECT_ID = UUID.randomUUID();

  private final NotificationService service = new NotificationService();

  @Test
  void commentAdded_notifiesAssigneeAndCreatorButNotAuthor() {
    var event = commentEvent("user2", "user1", "user3");

    var requests = service.handleCommentCreated(event);

    assertThat(requests)
        .extracting(NotificationRequest::userId)
        .containsExactly("user2", "user1");
    assertThat(requests)
        .allSatisfy(
            r -> {
              assertThat(r.type()).isEqualTo(NotificationType.COMMENT_ADDED);
              assertThat(r.metadata())
                  .containsEntry("taskId", TASK_ID.toString())
                  .containsEntry("commentAuthorId", "user3");
            });
  }

  @Test
  void commentAdded_deduplicatesWhenAssigneeIsCreator() {
    var requests = service.handleCommentCreated(commentEvent("user1", "user1", "user3"));

    assertThat(requests).extracting(NotificationRequest::userId).containsExactly("user1");
  }

  @Test
  void commentAdded_authorIsNeverNotified() {
    var requests = service.handleCommentCreated(commentEvent(null, "user1", "user1"));

    assertThat(requests).isEmpty();
  }

  @Test
  void taskAssigned_skipsSelfAssignment() {
    var self =
        new TaskAssignedEvent(TASK_ID, PROJECT_ID, "Docs", "user1", "user1", Instant.now());
    var other =
        new TaskAssignedEvent(TASK_ID, PROJECT_ID, "Docs", "user2", "user1", Instant.now());

    assertThat(service.handleTaskAssigned(self)).isEmpty();
    var requests = service.handleTaskAssigned(other);
    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).type()).isEqualTo(NotificationType.TASK_ASSIGNED);
    assertThat(requests.get(0).metadata()).containsEntry("assignedBy", "user1");
  }

  @Test
  void statusChanged_carriesTransition() {
    var event =
        new TaskStatusChangedEvent(
            TASK_ID, PROJECT_ID, "Docs", "todo", "done", "user2", "user1", "user2", Instant.now());

    var requests = service.handleTaskStatusChanged(event);

    assertThat(requests).extracting(NotificationRequest::userId).containsExactly("user1");
    assertThat(requests.get(0).body()).isEqualTo("Task \"Docs\" changed from todo to done");
    assertThat(requests.get(0).metadata())
        .containsEntry("fromStatus", "todo")
        .containsEntry("toStatus", "done")
        .containsEntry("changedBy", "user2");
  }

  private static CommentCreatedEvent commentEvent(
      String assigneeId, String createdBy, String authorId) {
    return new CommentCreatedEvent(
        UUID.randomUUID(),
        TASK_ID,
        PROJECT_ID,
        "Write docs",
        assigneeId,
        createdBy,
        authorId,
        Instant.now());
  }
}
