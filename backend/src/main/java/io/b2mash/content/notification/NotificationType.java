package io.b2mash.content.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
  TASK_ASSIGNED("task_assigned"),
  TASK_STATUS_CHANGED("task_status_changed"),
  COMMENT_ADDED("comment_added");

  private final String value;

  NotificationType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
