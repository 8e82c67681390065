package io.b2mash.content.event;

import java.time.Instant;
import java.util.UUID;

public record CommentCreatedEvent(
    UUID commentId,
    UUID taskId,
    UUID projectId,
    String taskTitle,
    String taskAssigneeId,
    String taskCreatedBy,
    String actorId,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "comment.created";
  }

  @Override
  public UUID entityId() {
    return commentId;
  }
}
