package io.b2mash.content.event;

import java.time.Instant;
import java.util.UUID;

/** A task got a new non-null assignee, at creation or through an update. */
public record TaskAssignedEvent(
    UUID taskId,
    UUID projectId,
    String taskTitle,
    String assigneeId,
    String actorId,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "task.assigned";
  }

  @Override
  public UUID entityId() {
    return taskId;
  }
}
