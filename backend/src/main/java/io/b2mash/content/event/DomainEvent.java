package io.b2mash.content.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for domain events published through Spring's ApplicationEventPublisher.
 * Implementations are records of plain values with no entity references, so they stay valid after
 * the publishing transaction commits and carry everything a listener needs without another query.
 */
public sealed interface DomainEvent
    permits CommentCreatedEvent, TaskAssignedEvent, TaskStatusChangedEvent {

  String eventType();

  UUID entityId();

  UUID projectId();

  /** User whose request caused the event. */
  String actorId();

  Instant occurredAt();
}
