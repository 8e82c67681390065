package io.b2mash.content.task;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link TaskStatus} as its lower-case value, matching the column CHECK constraint. */
@Converter
public class TaskStatusConverter implements AttributeConverter<TaskStatus, String> {

  @Override
  public String convertToDatabaseColumn(TaskStatus status) {
    return status != null ? status.value() : null;
  }

  @Override
  public TaskStatus convertToEntityAttribute(String value) {
    return value != null ? TaskStatus.fromValue(value) : null;
  }
}
