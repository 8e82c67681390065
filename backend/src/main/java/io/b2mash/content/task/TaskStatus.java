package io.b2mash.content.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task status label. Any status may follow any other; updates never reject a transition, so
 * {@code DONE -> TODO} is as valid as {@code TODO -> IN_PROGRESS}.
 */
public enum TaskStatus {
  TODO("todo"),
  IN_PROGRESS("in_progress"),
  REVIEW("review"),
  DONE("done");

  private final String value;

  TaskStatus(String value) {
    this.value = value;
  }

  /** Wire and column value. */
  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static TaskStatus fromValue(String value) {
    for (TaskStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown task status: " + value);
  }
}
