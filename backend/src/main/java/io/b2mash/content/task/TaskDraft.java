package io.b2mash.content.task;

import java.time.Instant;
import java.util.List;

/** Input for a new task. There is no status: every task starts as {@link TaskStatus#TODO}. */
public record TaskDraft(
    String title,
    String description,
    TaskPriority priority,
    String assigneeId,
    Instant dueDate,
    List<String> tags) {}
