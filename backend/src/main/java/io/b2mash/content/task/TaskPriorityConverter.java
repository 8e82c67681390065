package io.b2mash.content.task;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class TaskPriorityConverter implements AttributeConverter<TaskPriority, String> {

  @Override
  public String convertToDatabaseColumn(TaskPriority priority) {
    return priority != null ? priority.value() : null;
  }

  @Override
  public TaskPriority convertToEntityAttribute(String value) {
    return value != null ? TaskPriority.fromValue(value) : null;
  }
}
