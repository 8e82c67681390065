package io.b2mash.content.event;

import java.time.Instant;
import java.util.UUID;

public record TaskStatusChangedEvent(
    UUID taskId,
    UUID projectId,
    String taskTitle,
    String fromStatus,
    String toStatus,
    String assigneeId,
    String createdBy,
    String actorId,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "task.status_changed";
  }

  @Override
  public UUID entityId() {
    return taskId;
  }
}
