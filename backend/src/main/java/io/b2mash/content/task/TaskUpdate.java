package io.b2mash.content.task;

import java.time.Instant;
import java.util.List;

/**
 * A partial task update. Null title, description, status, priority or tags mean "keep". Assignee
 * and due date are nullable on the task itself, so each carries a {@code provided} flag: provided
 * with a null value clears the field, not provided keeps it.
 */
public record TaskUpdate(
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,
    boolean assigneeIdProvided,
    String assigneeId,
    boolean dueDateProvided,
    Instant dueDate,
    List<String> tags) {

  public TaskUpdate {
    tags = tags != null ? List.copyOf(tags) : null;
  }

  public static TaskUpdate empty() {
    return new TaskUpdate(null, null, null, null, false, null, false, null, null);
  }

  public TaskUpdate withTitle(String title) {
    return new TaskUpdate(
        title, description, status, priority, assigneeIdProvided, assigneeId, dueDateProvided,
        dueDate, tags);
  }

  public TaskUpdate withDescription(String description) {
    return new TaskUpdate(
        title, description, status, priority, assigneeIdProvided, assigneeId, dueDateProvided,
        dueDate, tags);
  }

  public TaskUpdate withStatus(TaskStatus status) {
    return new TaskUpdate(
        title, description, status, priority, assigneeIdProvided, assigneeId, dueDateProvided,
        dueDate, tags);
  }

  public TaskUpdate withPriority(TaskPriority priority) {
    return new TaskUpdate(
        title, description, status, priority, assigneeIdProvided, assigneeId, dueDateProvided,
        dueDate, tags);
  }

  /** Sets the assignee; null clears it. */
  public TaskUpdate withAssigneeId(String assigneeId) {
    return new TaskUpdate(
        title, description, status, priority, true, assigneeId, dueDateProvided, dueDate, tags);
  }

  /** Sets the due date; null clears it. */
  public TaskUpdate withDueDate(Instant dueDate) {
    return new TaskUpdate(
        title, description, status, priority, assigneeIdProvided, assigneeId, true, dueDate, tags);
  }

  public TaskUpdate withTags(List<String> tags) {
    return new TaskUpdate(
        title, description, status, priority, assigneeIdProvided, assigneeId, dueDateProvided,
        dueDate, tags);
  }
}
