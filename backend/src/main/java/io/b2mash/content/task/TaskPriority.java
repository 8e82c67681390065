package io.b2mash.content.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Task priority with a total order: LOW < MEDIUM < HIGH < CRITICAL. */
public enum TaskPriority {
  LOW("low", 0),
  MEDIUM("medium", 1),
  HIGH("high", 2),
  CRITICAL("critical", 3);

  private final String value;
  private final int rank;

  TaskPriority(String value, int rank) {
    this.value = value;
    this.rank = rank;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Sort rank used when ordering by priority. */
  public int rank() {
    return rank;
  }

  @JsonCreator
  public static TaskPriority fromValue(String value) {
    for (TaskPriority priority : values()) {
      if (priority.value.equals(value)) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Unknown task priority: " + value);
  }
}
